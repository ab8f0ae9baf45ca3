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

import java.time.Instant;
import java.util.Objects;

/**
 * The dispatcher's record of one variant within a run. State changes go through
 * {@link #transition} and must follow {@link JobState#canTransitionTo}.
 */
public final class Job {

    private final String variantId;
    private JobState state = JobState.PENDING;
    private int attemptCount;
    private String clusterJobName;
    private String failureReason;
    private Instant firstSubmittedAt;
    private Instant finishedAt;

    Job(String variantId) {
        this.variantId = Objects.requireNonNull(variantId, "variantId");
    }

    public String getVariantId() {
        return variantId;
    }

    public synchronized JobState getState() {
        return state;
    }

    /// @return the number of attempts started so far
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /// @return the cluster name of the latest attempt, or null before the first submit
    public synchronized String getClusterJobName() {
        return clusterJobName;
    }

    /// @return why the latest attempt failed, or null
    public synchronized String getFailureReason() {
        return failureReason;
    }

    public synchronized Instant getFirstSubmittedAt() {
        return firstSubmittedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    synchronized int beginAttempt(String clusterJobName, Instant now) {
        if (state != JobState.PENDING) {
            throw new IllegalStateException(variantId + ": cannot start an attempt from " + state);
        }
        this.clusterJobName = clusterJobName;
        if (firstSubmittedAt == null) {
            firstSubmittedAt = now;
        }
        return ++attemptCount;
    }

    synchronized void fail(String reason) {
        transition(JobState.FAILED, null);
        this.failureReason = reason;
    }

    synchronized void transition(JobState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(variantId + ": illegal transition " + state + " -> " + next);
        }
        state = next;
        if (next.isTerminal()) {
            finishedAt = now;
        }
    }

    @Override
    public synchronized String toString() {
        return "Job{" + variantId + ", " + state + ", attempts=" + attemptCount + "}";
    }
}
