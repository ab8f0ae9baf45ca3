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
import io.vastgen.variation.spec.ExecutionSettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything a cluster needs to run one attempt of one variant.
 *
 * <p>The variant's assignment is the job's only input. It travels as environment:
 * the whole assignment as JSON in {@value #VARIANT_ASSIGNMENT}, plus one
 * {@code PARAM_<NAME>} variable per parameter for scripts that do not parse JSON.
 */
public final class JobDescriptor {

    public static final String RUN_ID = "RUN_ID";
    public static final String VARIANT_ID = "VARIANT_ID";
    public static final String ATTEMPT = "ATTEMPT";
    public static final String RESULT_LOCATION = "RESULT_LOCATION";
    public static final String VARIANT_ASSIGNMENT = "VARIANT_ASSIGNMENT";
    public static final String PARAM_PREFIX = "PARAM_";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final String runId;
    private final String variantId;
    private final int attempt;
    private final String clusterJobName;
    private final Map<String, Object> assignment;
    private final ResultLocation resultLocation;
    private final ExecutionSettings settings;

    public JobDescriptor(String runId, String variantId, int attempt, String clusterJobName,
                         Map<String, ?> assignment, ResultLocation resultLocation, ExecutionSettings settings) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.variantId = Objects.requireNonNull(variantId, "variantId");
        this.attempt = attempt;
        this.clusterJobName = Objects.requireNonNull(clusterJobName, "clusterJobName");
        this.assignment = Collections.unmodifiableMap(new TreeMap<>(assignment));
        this.resultLocation = Objects.requireNonNull(resultLocation, "resultLocation");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public String getRunId() {
        return runId;
    }

    public String getVariantId() {
        return variantId;
    }

    /// @return the 1-based attempt number
    public int getAttempt() {
        return attempt;
    }

    public String getClusterJobName() {
        return clusterJobName;
    }

    public Map<String, Object> getAssignment() {
        return assignment;
    }

    public ResultLocation getResultLocation() {
        return resultLocation;
    }

    public ExecutionSettings getSettings() {
        return settings;
    }

    /**
     * @return the job's environment, in a stable order
     */
    public Map<String, String> environment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(RUN_ID, runId);
        env.put(VARIANT_ID, variantId);
        env.put(ATTEMPT, Integer.toString(attempt));
        env.put(RESULT_LOCATION, resultLocation.toUri());
        env.put(VARIANT_ASSIGNMENT, GSON.toJson(assignment));
        for (Map.Entry<String, Object> e : assignment.entrySet()) {
            env.put(parameterVariable(e.getKey()), String.valueOf(e.getValue()));
        }
        return env;
    }

    /// @return `PARAM_` plus the upper-cased name with every character outside `[A-Z0-9_]` replaced by `_`
    public static String parameterVariable(String parameter) {
        return PARAM_PREFIX + parameter.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
    }

    @Override
    public String toString() {
        return "JobDescriptor{" + clusterJobName + ", variant=" + variantId + ", attempt=" + attempt + "}";
    }
}
