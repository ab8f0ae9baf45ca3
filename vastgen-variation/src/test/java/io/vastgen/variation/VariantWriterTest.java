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


package io.vastgen.variation;

import io.vastgen.variation.distribution.ListDistribution;
import io.vastgen.variation.distribution.UniformDistribution;
import io.vastgen.variation.spec.VariationSpecification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class VariantWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneFilePerVariantAndAManifest() throws IOException {
        VariationSpecification spec = VariationSpecification.builder()
            .count(3)
            .seed(42)
            .parameter("lane", new ListDistribution(List.of(1, 2, 3)))
            .parameter("speed", new UniformDistribution(0, 1))
            .build();
        List<Variant> variants = new VariantGenerator().generate(spec);
        Path out = tempDir.resolve("out");

        Path manifest = new VariantWriter().write(variants, out);

        assertThat(manifest).isEqualTo(out.resolve(VariantWriter.MANIFEST_NAME));
        try (Stream<Path> files = Files.list(out)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .containsExactlyInAnyOrder("scenario.variants",
                    "variant-0000.variant.yaml", "variant-0001.variant.yaml", "variant-0002.variant.yaml");
        }

        Load load = new Load(LoadSettings.builder().build());
        List<?> entries = (List<?>) load.loadFromString(Files.readString(manifest));
        assertThat(entries).hasSize(3);
        Map<?, ?> first = (Map<?, ?>) entries.get(0);
        assertThat(first.get("id")).isEqualTo("variant-0000");
        assertThat(((Map<?, ?>) first.get("assignment")).get("lane")).isEqualTo(1);

        Map<?, ?> single = (Map<?, ?>) load.loadFromString(Files.readString(out.resolve("variant-0002.variant.yaml")));
        assertThat(single.get("index")).isEqualTo(2);
        assertThat(((Map<?, ?>) single.get("assignment")).get("speed")).isEqualTo(variants.get(2).get("speed"));
    }
}
