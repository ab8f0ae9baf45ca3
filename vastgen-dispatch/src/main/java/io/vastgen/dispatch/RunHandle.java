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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A run in progress. Obtained from {@link ClusterJobDispatcher#start}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RunHandle handle = dispatcher.start(run, 8, sink);
 * Runtime.getRuntime().addShutdownHook(new Thread(() -> handle.cancel(true)));
 * RunReport report = handle.await();
 * }</pre>
 */
public final class RunHandle {

    private final Run run;
    private final Map<String, Job> jobs;
    private final ExecutorService workers;
    private final DispatchStatistics statistics = new DispatchStatistics();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CountDownLatch finished;
    private final Instant startedAt;
    private volatile boolean cancelRunning;
    private volatile RunReport report;

    RunHandle(Run run, ExecutorService workers, Clock clock) {
        this.run = run;
        this.workers = workers;
        this.startedAt = clock.instant();
        Map<String, Job> byId = new LinkedHashMap<>();
        run.getVariants().forEach(v -> byId.put(v.getId(), new Job(v.getId())));
        this.jobs = Collections.unmodifiableMap(byId);
        this.finished = new CountDownLatch(byId.size());
    }

    public Run getRun() {
        return run;
    }

    public DispatchStatistics getStatistics() {
        return statistics;
    }

    /// @return the live job records, keyed by variant id in index order
    public Map<String, Job> getJobs() {
        return jobs;
    }

    public boolean isDone() {
        return finished.getCount() == 0;
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    /**
     * Stops submitting new jobs immediately. Jobs that are already running are cancelled on
     * the cluster when {@code cancelRunning} is set, and otherwise tracked until they finish.
     * Repeated calls have no further effect, except that a later call may widen a
     * non-cancelling call into a cancelling one.
     *
     * @param cancelRunning whether to issue best-effort cluster cancellation for running jobs
     */
    public void cancel(boolean cancelRunning) {
        if (cancelRunning) {
            this.cancelRunning = true;
        }
        cancelSignal.countDown();
    }

    /**
     * Blocks until every variant is terminal.
     *
     * @return the completion report
     * @throws InterruptedException if interrupted while waiting; the run keeps going
     */
    public RunReport await() throws InterruptedException {
        finished.await();
        return report();
    }

    /**
     * @param timeout how long to wait at most
     * @return true if the run finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * @return the completion report of a finished run
     * @throws IllegalStateException if the run is still in progress
     */
    public synchronized RunReport report() {
        if (!isDone()) {
            throw new IllegalStateException("run " + run.getRunId() + " is still in progress");
        }
        if (report == null) {
            workers.shutdown();
            List<Duration> durations = new ArrayList<>();
            Instant end = startedAt;
            for (Job job : jobs.values()) {
                Instant first = job.getFirstSubmittedAt();
                Instant last = job.getFinishedAt();
                if (first != null && last != null) {
                    durations.add(Duration.between(first, last));
                }
                if (last != null && last.isAfter(end)) {
                    end = last;
                }
            }
            report = RunReport.of(run.getRunId(), jobs.values(), new RunStatistics(startedAt, end, durations));
        }
        return report;
    }

    /**
     * Waits for the poll interval or a cancellation, whichever comes first.
     *
     * @return true if running jobs should be abandoned now
     */
    boolean pause(Duration interval) throws InterruptedException {
        if (cancelSignal.await(interval.toNanos(), TimeUnit.NANOSECONDS)) {
            if (cancelRunning) {
                return true;
            }
            // cancelled without abandoning running jobs: keep the polling cadence
            Thread.sleep(interval.toMillis());
        }
        return false;
    }

    void variantFinished() {
        finished.countDown();
    }
}
