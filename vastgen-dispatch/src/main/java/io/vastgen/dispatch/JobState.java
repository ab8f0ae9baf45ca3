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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one variant's job within a run.
 *
 * <pre>
 * PENDING --submit--> RUNNING --success--> SUCCEEDED
 *    |                   |
 *    +----submit error---+--failure/timeout--> FAILED --attempts left--> RETRYING --> PENDING
 *                                                  \--exhausted--> FAILED_FINAL
 * </pre>
 *
 * {@link #CANCELLED} is reachable from every non-terminal state when the run is cancelled.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    RETRYING,
    FAILED_FINAL,
    CANCELLED;

    /// @return true for states a job never leaves
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_FINAL || this == CANCELLED;
    }

    /**
     * @param next the proposed next state
     * @return true if the state machine allows the transition
     */
    public boolean canTransitionTo(JobState next) {
        return successors().contains(next);
    }

    private Set<JobState> successors() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING:
                return EnumSet.of(SUCCEEDED, FAILED, CANCELLED);
            case FAILED:
                return EnumSet.of(RETRYING, FAILED_FINAL);
            case RETRYING:
                return EnumSet.of(PENDING, CANCELLED);
            default:
                return EnumSet.noneOf(JobState.class);
        }
    }
}
