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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.vastgen.variation.spec.ExecutionSettings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobDescriptorTest {

    private static JobDescriptor descriptor() {
        Map<String, Object> assignment = new LinkedHashMap<>();
        assignment.put("speed", 1.5);
        assignment.put("map.name", "warehouse");
        assignment.put("obstacles", 3L);
        return new JobDescriptor("run-1", "variant-0001", 2, "run-1-variant-0001-2", assignment,
            ResultLocation.of("results", "run-1", "variant-0001"), ExecutionSettings.defaults());
    }

    @Test
    void environmentCarriesIdentityAndLocation() {
        Map<String, String> env = descriptor().environment();

        assertThat(env).containsEntry(JobDescriptor.RUN_ID, "run-1")
            .containsEntry(JobDescriptor.VARIANT_ID, "variant-0001")
            .containsEntry(JobDescriptor.ATTEMPT, "2")
            .containsEntry(JobDescriptor.RESULT_LOCATION, "s3://results/run-1/variant-0001/");
    }

    @Test
    void assignmentIsPassedAsJsonAndPerParameterVariables() {
        Map<String, String> env = descriptor().environment();

        JsonObject json = JsonParser.parseString(env.get(JobDescriptor.VARIANT_ASSIGNMENT)).getAsJsonObject();
        assertThat(json.get("speed").getAsDouble()).isEqualTo(1.5);
        assertThat(json.get("obstacles").getAsLong()).isEqualTo(3L);
        assertThat(json.get("map.name").getAsString()).isEqualTo("warehouse");

        assertThat(env).containsEntry("PARAM_SPEED", "1.5")
            .containsEntry("PARAM_MAP_NAME", "warehouse")
            .containsEntry("PARAM_OBSTACLES", "3");
    }

    @Test
    void resultPrefixIsRunThenVariant() {
        ResultLocation location = ResultLocation.of("bucket", "r", "v");
        assertThat(location.getPrefix()).isEqualTo("r/v/");
        assertThat(location).isEqualTo(ResultLocation.of("bucket", "r", "v"));
    }
}
