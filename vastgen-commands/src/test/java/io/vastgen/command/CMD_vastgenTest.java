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


package io.vastgen.command;

import io.vastgen.variation.VariantWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_vastgenTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;

    @BeforeEach
    void setUp() {
        System.setOut(new PrintStream(outContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private Path spec(String text) throws IOException {
        Path file = tempDir.resolve("campaign.yaml");
        Files.writeString(file, text);
        return file;
    }

    @Test
    void generateWritesVariantsAndManifest() throws IOException {
        Path spec = spec("count: 3\nseed: 42\nparameters:\n  obstacles: [1, 2, 3]\n");
        Path out = tempDir.resolve("out");

        int exitCode = CMD_vastgen.commandLine().execute("generate", spec.toString(), "-o", out.toString(), "--no-cache");

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(out.resolve(VariantWriter.MANIFEST_NAME)).exists();
        assertThat(out.resolve("variant-0002" + VariantWriter.VARIANT_SUFFIX)).exists();
        assertThat(outContent.toString()).contains("Generated 3 variants");
        assertThat(tempDir.resolve(".cache")).doesNotExist();
    }

    @Test
    void generateUsesTheCacheNextToTheSpecification() throws IOException {
        Path spec = spec("count: 2\nseed: 1\nparameters:\n  speed: {type: uniform, low: 0, high: 5}\n");

        int exitCode = CMD_vastgen.commandLine().execute("generate", spec.toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(tempDir.resolve(".cache")).isDirectory();
    }

    @Test
    void invalidSpecificationExitsWithError() throws IOException {
        Path spec = spec("count: 3\nseed: 42\nparameters:\n  speed: {type: warp, factor: 9}\n");

        int exitCode = CMD_vastgen.commandLine().execute("generate", spec.toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.ERROR);
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void missingRequiredOptionIsAUsageError() throws IOException {
        Path spec = spec("count: 1\nseed: 1\nparameters:\n  a: [1]\n");
        assertThat(CMD_vastgen.commandLine().execute("generate", spec.toString())).isEqualTo(ExitCodes.ERROR);
    }

    @Test
    void archiveFromLocalDirectory() throws IOException {
        Path results = tempDir.resolve("results");
        Files.createDirectories(results.resolve("run-7/variant-0000"));
        Files.writeString(results.resolve("run-7/variant-0000/metrics.csv"), "a\n1\n");
        Path archive = tempDir.resolve("run-7.tar.gz");

        int exitCode = CMD_vastgen.commandLine().execute(
            "archive", "run-7", "-o", archive.toString(), "--from-dir", results.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(archive).exists();
        assertThat(outContent.toString()).contains("1 objects, 0 skipped");
    }
}
