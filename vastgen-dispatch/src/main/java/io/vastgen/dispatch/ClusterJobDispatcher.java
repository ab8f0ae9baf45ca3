/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.vastgen.dispatch;

import io.vastgen.status.ProgressSink;
import io.vastgen.variation.Variant;
import io.vastgen.variation.spec.ExecutionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submits one isolated cluster job per variant and drives each through the
 * {@link JobState} machine until every variant is terminal.
 *
 * <h2>Scheduling</h2>
 * <p>A run gets a fixed pool of {@code concurrencyLimit} workers. A worker owns one variant
 * from its first submission through all its retries to a terminal state, so at most
 * {@code concurrencyLimit} jobs are ever running on the cluster for the run. Completion
 * is correlated by variant id, never by arrival order.
 *
 * <h2>Failure policy</h2>
 * <p>Each of the following fails the current attempt:
 * <ul>
 *   <li>the cluster reports the job failed, or no longer knows it</li>
 *   <li>submit or poll raises, which is treated as a transient cluster error</li>
 *   <li>the job stays pending longer than {@code start_timeout}</li>
 *   <li>the job runs longer than {@code job_timeout}</li>
 * </ul>
 * A failed attempt is retried until {@code max_attempts} attempts have been made; then the
 * variant is recorded as failed and the run continues. Job failures reach the caller only
 * through the {@link RunReport}, never as exceptions.
 */
public class ClusterJobDispatcher {

    private static final Logger logger = LogManager.getLogger(ClusterJobDispatcher.class);

    private final ClusterClient client;
    private final Clock clock;

    public ClusterJobDispatcher(ClusterClient client) {
        this(client, Clock.systemUTC());
    }

    public ClusterJobDispatcher(ClusterClient client, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Dispatches a run with the concurrency limit from its execution settings and blocks
     * until it completes.
     */
    public RunReport dispatch(Run run) throws InterruptedException {
        return dispatch(run, run.getSettings().getConcurrencyLimit());
    }

    /**
     * Dispatches a run and blocks until every variant is terminal.
     *
     * @param run the run
     * @param concurrencyLimit the most jobs allowed to run at once
     * @return the completion report
     * @throws InterruptedException if interrupted while waiting; the run is then cancelled
     */
    public RunReport dispatch(Run run, int concurrencyLimit) throws InterruptedException {
        RunHandle handle = start(run, concurrencyLimit, ProgressSink.none());
        try {
            return handle.await();
        } catch (InterruptedException e) {
            handle.cancel(run.getSettings().isCancelRunningOnAbort());
            throw e;
        }
    }

    /**
     * Starts dispatching a run and returns immediately.
     *
     * @param run the run
     * @param concurrencyLimit the most jobs allowed to run at once
     * @param sink receives one message per submission and per job outcome
     * @return a handle to await or cancel the run
     * @throws IllegalArgumentException if the limit is below one
     */
    public RunHandle start(Run run, int concurrencyLimit, ProgressSink sink) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrency limit must be at least 1, got " + concurrencyLimit);
        }
        Objects.requireNonNull(sink, "sink");
        int workerCount = Math.max(1, Math.min(concurrencyLimit, run.getVariants().size()));
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, threadsFor(run.getRunId()));
        RunHandle handle = new RunHandle(run, workers, clock);
        logger.info("Dispatching run {}: {} variants, concurrency limit {}, max attempts {}",
            run.getRunId(), run.getVariants().size(), concurrencyLimit, run.getSettings().getMaxAttempts());
        for (Variant variant : run.getVariants()) {
            Job job = handle.getJobs().get(variant.getId());
            workers.execute(() -> execute(handle, job, variant, sink));
        }
        workers.shutdown();
        return handle;
    }

    private void execute(RunHandle handle, Job job, Variant variant, ProgressSink sink) {
        Run run = handle.getRun();
        ExecutionSettings settings = run.getSettings();
        DispatchStatistics stats = handle.getStatistics();
        try {
            while (true) {
                if (handle.isCancelled()) {
                    job.transition(JobState.CANCELLED, clock.instant());
                    stats.incrementCancelled();
                    logger.info("Variant {} cancelled before attempt {}", job.getVariantId(), job.getAttemptCount() + 1);
                    sink.progress(job.getVariantId() + " cancelled");
                    return;
                }
                if (job.getState() == JobState.RETRYING) {
                    job.transition(JobState.PENDING, null);
                }

                int attempt = job.getAttemptCount() + 1;
                String name = JobNames.forAttempt(run.getRunId(), job.getVariantId(), attempt);
                job.beginAttempt(name, clock.instant());
                JobDescriptor descriptor = new JobDescriptor(run.getRunId(), job.getVariantId(), attempt, name,
                    variant.getAssignment(), ResultLocation.of(settings.getBucket(), run.getRunId(), job.getVariantId()),
                    settings);

                Outcome outcome = attempt(handle, job, descriptor, sink);
                if (outcome.state == JobState.SUCCEEDED) {
                    job.transition(JobState.SUCCEEDED, clock.instant());
                    stats.incrementSucceeded();
                    logger.info("Variant {} succeeded as {} on attempt {}", job.getVariantId(), name, attempt);
                    sink.progress(job.getVariantId() + " succeeded (" + stats.getFinished() + "/" + run.getVariants().size() + ")");
                    return;
                }
                if (outcome.state == JobState.CANCELLED) {
                    job.transition(JobState.CANCELLED, clock.instant());
                    stats.incrementCancelled();
                    logger.info("Variant {} cancelled while running as {}", job.getVariantId(), name);
                    sink.progress(job.getVariantId() + " cancelled");
                    return;
                }

                job.fail(outcome.reason);
                stats.incrementAttemptFailures();
                if (attempt < settings.getMaxAttempts()) {
                    job.transition(JobState.RETRYING, null);
                    stats.incrementRetries();
                    logger.warn("Variant {} attempt {}/{} failed ({}), retrying",
                        job.getVariantId(), attempt, settings.getMaxAttempts(), outcome.reason);
                    sink.progress(job.getVariantId() + " attempt " + attempt + " failed: " + outcome.reason + "; retrying");
                } else {
                    job.transition(JobState.FAILED_FINAL, clock.instant());
                    stats.incrementFailedFinal();
                    logger.error("Variant {} failed after {} attempt(s): {}", job.getVariantId(), attempt, outcome.reason);
                    sink.progress(job.getVariantId() + " failed after " + attempt + " attempt(s): " + outcome.reason);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finishInterrupted(job, stats);
        } finally {
            handle.variantFinished();
        }
    }

    private Outcome attempt(RunHandle handle, Job job, JobDescriptor descriptor, ProgressSink sink)
        throws InterruptedException {
        ClusterHandle clusterHandle;
        try {
            clusterHandle = client.submit(descriptor);
        } catch (ClusterException | RuntimeException e) {
            return Outcome.failed("submit failed: " + e.getMessage());
        }
        job.transition(JobState.RUNNING, null);
        handle.getStatistics().incrementSubmitted();
        logger.info("Submitted variant {} attempt {} as {}",
            descriptor.getVariantId(), descriptor.getAttempt(), clusterHandle);
        sink.progress("Submitted " + descriptor.getVariantId() + " attempt " + descriptor.getAttempt()
            + " as " + descriptor.getClusterJobName());

        handle.getStatistics().enterRunning();
        try {
            return awaitCompletion(handle, clusterHandle, descriptor.getSettings());
        } finally {
            handle.getStatistics().leaveRunning();
        }
    }

    private Outcome awaitCompletion(RunHandle handle, ClusterHandle clusterHandle, ExecutionSettings settings)
        throws InterruptedException {
        Instant submittedAt = clock.instant();
        Instant runningSince = null;
        try {
            while (true) {
                ClusterJobStatus status;
                try {
                    status = client.poll(clusterHandle);
                } catch (ClusterException | RuntimeException e) {
                    cancelQuietly(clusterHandle);
                    return Outcome.failed("poll failed: " + e.getMessage());
                }
                Instant now = clock.instant();
                switch (status) {
                    case SUCCEEDED:
                        return Outcome.SUCCEEDED;
                    case FAILED:
                        return Outcome.failed("cluster reported failure of " + clusterHandle.getName());
                    case PENDING:
                        if (runningSince == null && exceeded(submittedAt, now, settings.getStartTimeout())) {
                            cancelQuietly(clusterHandle);
                            return Outcome.failed("not started within " + settings.getStartTimeout());
                        }
                        break;
                    case RUNNING:
                        if (runningSince == null) {
                            runningSince = now;
                        }
                        if (exceeded(runningSince, now, settings.getJobTimeout())) {
                            cancelQuietly(clusterHandle);
                            return Outcome.failed("exceeded job timeout " + settings.getJobTimeout());
                        }
                        break;
                    default:
                        throw new IllegalStateException("unknown cluster status " + status);
                }
                if (handle.pause(settings.getPollInterval())) {
                    cancelQuietly(clusterHandle);
                    return Outcome.CANCELLED;
                }
            }
        } catch (InterruptedException e) {
            cancelQuietly(clusterHandle);
            throw e;
        }
    }

    private static boolean exceeded(Instant since, Instant now, Duration budget) {
        return Duration.between(since, now).compareTo(budget) > 0;
    }

    private void cancelQuietly(ClusterHandle clusterHandle) {
        try {
            client.cancel(clusterHandle);
        } catch (ClusterException | RuntimeException e) {
            logger.warn("Could not cancel cluster job {}: {}", clusterHandle, e.getMessage());
        }
    }

    private void finishInterrupted(Job job, DispatchStatistics stats) {
        Instant now = clock.instant();
        JobState state = job.getState();
        if (state == JobState.FAILED) {
            job.transition(JobState.FAILED_FINAL, now);
            stats.incrementFailedFinal();
        } else if (!state.isTerminal()) {
            job.transition(JobState.CANCELLED, now);
            stats.incrementCancelled();
        }
        logger.warn("Worker for variant {} interrupted in state {}", job.getVariantId(), state);
    }

    private static ThreadFactory threadsFor(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "dispatch-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Outcome {
        static final Outcome SUCCEEDED = new Outcome(JobState.SUCCEEDED, null);
        static final Outcome CANCELLED = new Outcome(JobState.CANCELLED, null);

        final JobState state;
        final String reason;

        private Outcome(JobState state, String reason) {
            this.state = state;
            this.reason = reason;
        }

        static Outcome failed(String reason) {
            return new Outcome(JobState.FAILED, reason);
        }
    }
}
