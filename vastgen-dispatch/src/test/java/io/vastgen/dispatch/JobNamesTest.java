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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobNamesTest {

    @Test
    void simpleNamesPassThroughLowerCased() {
        assertThat(JobNames.forAttempt("Run-1", "Variant-0003", 2)).isEqualTo("run-1-variant-0003-2");
    }

    @Test
    void invalidCharactersBecomeSingleDashes() {
        assertThat(JobNames.forAttempt("run_2024.01", "a..b", 1)).isEqualTo("run-2024-01-a-b-1");
        assertThat(JobNames.dnsLabel("--x--")).isEqualTo("x");
        assertThat(JobNames.dnsLabel("___")).isEqualTo("job");
    }

    @Test
    void longNamesAreTruncatedWithADistinguishingHash() {
        String variant = "v".repeat(80);
        String a = JobNames.forAttempt("run-2024-01-01-120000", variant, 1);
        String b = JobNames.forAttempt("run-2024-01-01-120000", variant, 2);

        assertThat(a).hasSizeLessThanOrEqualTo(JobNames.MAX_LENGTH).matches("[a-z0-9]([a-z0-9-]*[a-z0-9])?");
        assertThat(b).hasSizeLessThanOrEqualTo(JobNames.MAX_LENGTH);
        assertThat(a).isNotEqualTo(b);
        assertThat(a).startsWith("run-2024-01-01-120000-vvv");
    }

    @Test
    void labelValuesKeepCaseAndDots() {
        assertThat(JobNames.labelValue("Variant_1.a")).isEqualTo("Variant_1.a");
        assertThat(JobNames.labelValue("-x/y-")).isEqualTo("x-y");
        assertThat(JobNames.labelValue("A".repeat(100))).hasSize(JobNames.MAX_LENGTH);
    }
}
