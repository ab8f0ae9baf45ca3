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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Wall-clock figures for a finished run: when it started and ended, and the spread of
 * per-variant durations from first submission to terminal state. Variants that were never
 * submitted do not contribute a duration.
 */
public final class RunStatistics {

    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<Duration> durations;

    public RunStatistics(Instant startedAt, Instant finishedAt, Collection<Duration> variantDurations) {
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
        List<Duration> sorted = new ArrayList<>(variantDurations);
        Collections.sort(sorted);
        this.durations = Collections.unmodifiableList(sorted);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getWallClock() {
        return Duration.between(startedAt, finishedAt);
    }

    /// @return measured variant durations, ascending
    public List<Duration> getDurations() {
        return durations;
    }

    public Duration getMin() {
        return durations.isEmpty() ? Duration.ZERO : durations.get(0);
    }

    public Duration getMax() {
        return durations.isEmpty() ? Duration.ZERO : durations.get(durations.size() - 1);
    }

    public Duration getMean() {
        if (durations.isEmpty()) {
            return Duration.ZERO;
        }
        Duration total = Duration.ZERO;
        for (Duration d : durations) {
            total = total.plus(d);
        }
        return total.dividedBy(durations.size());
    }

    /// Even-sized samples average the two middle values.
    public Duration getMedian() {
        int n = durations.size();
        if (n == 0) {
            return Duration.ZERO;
        }
        if (n % 2 == 1) {
            return durations.get(n / 2);
        }
        return durations.get(n / 2 - 1).plus(durations.get(n / 2)).dividedBy(2);
    }

    @Override
    public String toString() {
        return "RunStatistics{wallClock=" + getWallClock() + ", min=" + getMin() + ", median=" + getMedian()
            + ", mean=" + getMean() + ", max=" + getMax() + "}";
    }
}
