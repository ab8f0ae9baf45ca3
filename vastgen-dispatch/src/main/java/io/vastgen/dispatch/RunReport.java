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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The completion report of a run: which variants succeeded, which failed, and which were
 * cancelled before finishing. This is the only status a run exposes to callers; command
 * line and automation layers format it but do not reinterpret it.
 *
 * <p>Variant ids are held in sorted order, so reports compare equal regardless of the order
 * in which jobs completed on the cluster.
 */
public final class RunReport {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final String runId;
    private final SortedSet<String> succeeded;
    private final SortedSet<String> failed;
    private final SortedSet<String> cancelled;
    private final SortedMap<String, Integer> attempts;
    private final SortedMap<String, String> failureReasons;
    private final RunStatistics statistics;

    public RunReport(String runId, Collection<String> succeeded, Collection<String> failed,
                     Collection<String> cancelled, Map<String, Integer> attempts,
                     Map<String, String> failureReasons, RunStatistics statistics) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.succeeded = Collections.unmodifiableSortedSet(new TreeSet<>(succeeded));
        this.failed = Collections.unmodifiableSortedSet(new TreeSet<>(failed));
        this.cancelled = Collections.unmodifiableSortedSet(new TreeSet<>(cancelled));
        this.attempts = Collections.unmodifiableSortedMap(new TreeMap<>(attempts));
        this.failureReasons = Collections.unmodifiableSortedMap(new TreeMap<>(failureReasons));
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    static RunReport of(String runId, Collection<Job> jobs, RunStatistics statistics) {
        List<String> ok = new ArrayList<>();
        List<String> bad = new ArrayList<>();
        List<String> stopped = new ArrayList<>();
        Map<String, Integer> attempts = new TreeMap<>();
        Map<String, String> reasons = new TreeMap<>();
        for (Job job : jobs) {
            attempts.put(job.getVariantId(), job.getAttemptCount());
            switch (job.getState()) {
                case SUCCEEDED:
                    ok.add(job.getVariantId());
                    break;
                case FAILED_FINAL:
                    bad.add(job.getVariantId());
                    reasons.put(job.getVariantId(), String.valueOf(job.getFailureReason()));
                    break;
                case CANCELLED:
                    stopped.add(job.getVariantId());
                    break;
                default:
                    throw new IllegalStateException("job not finished: " + job);
            }
        }
        return new RunReport(runId, ok, bad, stopped, attempts, reasons, statistics);
    }

    public String getRunId() {
        return runId;
    }

    public SortedSet<String> getSucceeded() {
        return succeeded;
    }

    public SortedSet<String> getFailed() {
        return failed;
    }

    public SortedSet<String> getCancelled() {
        return cancelled;
    }

    /// @return attempts started per variant; zero for variants cancelled before their first submit
    public SortedMap<String, Integer> getAttempts() {
        return attempts;
    }

    /// @return the last failure reason of each finally failed variant
    public SortedMap<String, String> getFailureReasons() {
        return failureReasons;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    public int getTotal() {
        return succeeded.size() + failed.size() + cancelled.size();
    }

    /// @return true when every variant reached a terminal state through execution, i.e. none was cancelled
    public boolean isComplete() {
        return cancelled.isEmpty();
    }

    public boolean isAllSucceeded() {
        return failed.isEmpty() && cancelled.isEmpty();
    }

    /**
     * @return the report as a JSON document for automation layers
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("run_id", runId);
        root.addProperty("complete", isComplete());
        root.add("succeeded", array(succeeded));
        root.add("failed", array(failed));
        root.add("cancelled", array(cancelled));
        JsonObject attemptsJson = new JsonObject();
        attempts.forEach(attemptsJson::addProperty);
        root.add("attempts", attemptsJson);
        JsonObject reasonsJson = new JsonObject();
        failureReasons.forEach(reasonsJson::addProperty);
        root.add("failure_reasons", reasonsJson);
        JsonObject stats = new JsonObject();
        stats.addProperty("started_at", statistics.getStartedAt().toString());
        stats.addProperty("finished_at", statistics.getFinishedAt().toString());
        stats.addProperty("min_millis", statistics.getMin().toMillis());
        stats.addProperty("median_millis", statistics.getMedian().toMillis());
        stats.addProperty("mean_millis", statistics.getMean().toMillis());
        stats.addProperty("max_millis", statistics.getMax().toMillis());
        root.add("statistics", stats);
        return GSON.toJson(root);
    }

    /**
     * @return a multi-line summary for humans
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(runId).append(": ")
            .append(succeeded.size()).append(" succeeded, ")
            .append(failed.size()).append(" failed, ")
            .append(cancelled.size()).append(" cancelled\n");
        for (String id : failed) {
            sb.append("  FAILED ").append(id).append(" after ").append(attempts.get(id))
                .append(" attempt(s): ").append(failureReasons.get(id)).append('\n');
        }
        for (String id : cancelled) {
            sb.append("  CANCELLED ").append(id).append('\n');
        }
        sb.append("  wall clock ").append(format(statistics.getWallClock()))
            .append(", per variant min ").append(format(statistics.getMin()))
            .append(" median ").append(format(statistics.getMedian()))
            .append(" mean ").append(format(statistics.getMean()))
            .append(" max ").append(format(statistics.getMax()));
        return sb.toString();
    }

    private static String format(Duration d) {
        return String.format("%d.%03ds", d.getSeconds(), d.toMillisPart());
    }

    private static JsonArray array(Collection<String> ids) {
        JsonArray a = new JsonArray();
        ids.forEach(a::add);
        return a;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunReport)) return false;
        RunReport that = (RunReport) o;
        return runId.equals(that.runId) && succeeded.equals(that.succeeded) && failed.equals(that.failed)
            && cancelled.equals(that.cancelled);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, succeeded, failed, cancelled);
    }

    @Override
    public String toString() {
        return "RunReport{" + runId + ", succeeded=" + succeeded + ", failed=" + failed + ", cancelled=" + cancelled + "}";
    }
}
