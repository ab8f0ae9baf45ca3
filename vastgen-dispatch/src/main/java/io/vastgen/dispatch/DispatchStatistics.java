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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters for one dispatched run, readable from any thread while the run is in
 * progress.
 *
 * <p>Submissions count attempts, not variants: a variant retried twice contributes three
 * submissions. {@link #getMaxRunning()} is the high-water mark of jobs simultaneously in
 * {@link JobState#RUNNING}, which never exceeds the run's concurrency limit.
 */
public final class DispatchStatistics {
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong attemptFailures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong failedFinal = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    public long getSubmitted() {
        return submitted.get();
    }

    public long getSucceeded() {
        return succeeded.get();
    }

    /// @return failed attempts, whether or not they were retried
    public long getAttemptFailures() {
        return attemptFailures.get();
    }

    public long getRetries() {
        return retries.get();
    }

    public long getFailedFinal() {
        return failedFinal.get();
    }

    public long getCancelled() {
        return cancelled.get();
    }

    public int getRunning() {
        return running.get();
    }

    public int getMaxRunning() {
        return maxRunning.get();
    }

    /// @return variants that reached a terminal state
    public long getFinished() {
        return succeeded.get() + failedFinal.get() + cancelled.get();
    }

    void incrementSubmitted() {
        submitted.incrementAndGet();
    }

    void incrementSucceeded() {
        succeeded.incrementAndGet();
    }

    void incrementAttemptFailures() {
        attemptFailures.incrementAndGet();
    }

    void incrementRetries() {
        retries.incrementAndGet();
    }

    void incrementFailedFinal() {
        failedFinal.incrementAndGet();
    }

    void incrementCancelled() {
        cancelled.incrementAndGet();
    }

    void enterRunning() {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
    }

    void leaveRunning() {
        running.decrementAndGet();
    }

    @Override
    public String toString() {
        return String.format(
            "DispatchStatistics[submitted=%d, succeeded=%d, attemptFailures=%d, retries=%d, failedFinal=%d, cancelled=%d, running=%d, maxRunning=%d]",
            getSubmitted(), getSucceeded(), getAttemptFailures(), getRetries(), getFailedFinal(),
            getCancelled(), getRunning(), getMaxRunning()
        );
    }
}
