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
import io.vastgen.variation.Variant;
import io.vastgen.variation.spec.ExecutionSettings;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunReportTest {

    private static RunStatistics stats(long... millis) {
        List<Duration> durations = new ArrayList<>();
        for (long m : millis) {
            durations.add(Duration.ofMillis(m));
        }
        return new RunStatistics(Instant.EPOCH, Instant.EPOCH.plusSeconds(10), durations);
    }

    @Test
    void durationSpread() {
        RunStatistics s = stats(400, 100, 300, 200);

        assertThat(s.getMin()).isEqualTo(Duration.ofMillis(100));
        assertThat(s.getMax()).isEqualTo(Duration.ofMillis(400));
        assertThat(s.getMedian()).isEqualTo(Duration.ofMillis(250));
        assertThat(s.getMean()).isEqualTo(Duration.ofMillis(250));
        assertThat(s.getWallClock()).isEqualTo(Duration.ofSeconds(10));
        assertThat(stats().getMedian()).isEqualTo(Duration.ZERO);
        assertThat(stats(5, 1, 3).getMedian()).isEqualTo(Duration.ofMillis(3));
    }

    @Test
    void idsAreSortedAndCompletenessIgnoresFailures() {
        RunReport report = new RunReport("r", List.of("b", "a"), List.of("c"), List.of(),
            Map.of("a", 1, "b", 1, "c", 3), Map.of("c", "boom"), stats(1));

        assertThat(report.getSucceeded()).containsExactly("a", "b");
        assertThat(report.isComplete()).isTrue();
        assertThat(report.isAllSucceeded()).isFalse();
        assertThat(report.getTotal()).isEqualTo(3);
        assertThat(report.summary()).contains("2 succeeded, 1 failed, 0 cancelled").contains("FAILED c after 3 attempt(s): boom");
    }

    @Test
    void jsonFormIsMachineReadable() {
        RunReport report = new RunReport("r", List.of("a"), List.of(), List.of("z"),
            Map.of("a", 1, "z", 0), Map.of(), stats(1500));

        JsonObject json = JsonParser.parseString(report.toJson()).getAsJsonObject();
        assertThat(json.get("run_id").getAsString()).isEqualTo("r");
        assertThat(json.get("complete").getAsBoolean()).isFalse();
        assertThat(json.getAsJsonArray("cancelled").get(0).getAsString()).isEqualTo("z");
        assertThat(json.getAsJsonObject("statistics").get("max_millis").getAsLong()).isEqualTo(1500L);
    }

    @Test
    void defaultRunIdUsesUtcTimestamp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.ofHours(5));
        assertThat(Run.defaultRunId(clock)).isEqualTo("run-2024-03-05-070809");
    }

    @Test
    void runRejectsDuplicateVariantIds() {
        List<Variant> variants = List.of(new Variant(0, "same", Map.of()), new Variant(1, "same", Map.of()));
        assertThatThrownBy(() -> new Run("r", variants, ExecutionSettings.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("same");
    }
}
