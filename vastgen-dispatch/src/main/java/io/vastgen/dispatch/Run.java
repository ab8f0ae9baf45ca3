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

import io.vastgen.variation.Variant;
import io.vastgen.variation.spec.ExecutionSettings;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One end-to-end execution of every variant of a specification, tracked as a unit for
 * dispatch and archiving.
 */
public final class Run {

    private static final DateTimeFormatter RUN_ID_FORMAT =
        DateTimeFormatter.ofPattern("'run-'yyyy-MM-dd-HHmmss").withZone(ZoneOffset.UTC);

    private final String runId;
    private final List<Variant> variants;
    private final ExecutionSettings settings;

    /**
     * @param runId the run identifier; the top-level namespace of results and archive
     * @param variants the variants to execute, in index order
     * @param settings execution policy for every job of the run
     * @throws IllegalArgumentException if the run id is blank or two variants share an id
     */
    public Run(String runId, List<Variant> variants, ExecutionSettings settings) {
        Objects.requireNonNull(runId, "runId");
        if (runId.isBlank() || runId.contains("/")) {
            throw new IllegalArgumentException("run id must be non-blank and contain no '/': '" + runId + "'");
        }
        Set<String> ids = new HashSet<>();
        for (Variant v : variants) {
            if (!ids.add(v.getId())) {
                throw new IllegalArgumentException("duplicate variant id '" + v.getId() + "' in run " + runId);
            }
        }
        this.runId = runId;
        this.variants = List.copyOf(variants);
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /// @return `run-yyyy-MM-dd-HHmmss` for the clock's current instant, in UTC
    public static String defaultRunId(Clock clock) {
        return RUN_ID_FORMAT.format(clock.instant());
    }

    public String getRunId() {
        return runId;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    public ExecutionSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "Run{" + runId + ", variants=" + variants.size() + "}";
    }
}
