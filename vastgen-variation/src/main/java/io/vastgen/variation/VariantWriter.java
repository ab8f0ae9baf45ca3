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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes generated variants to an output directory: one {@code <id>.variant.yaml} per
 * variant plus a {@code scenario.variants} manifest listing every variant in index order.
 *
 * <p>Each file is written to a temporary sibling and renamed into place, so readers never
 * observe a half-written file.
 */
public class VariantWriter {
    private static final Logger logger = LogManager.getLogger(VariantWriter.class);

    public static final String MANIFEST_NAME = "scenario.variants";
    public static final String VARIANT_SUFFIX = ".variant.yaml";

    private final Dump dump = new Dump(DumpSettings.builder()
        .setDefaultFlowStyle(FlowStyle.BLOCK)
        .setIndent(2)
        .build());

    /**
     * @param variants the variants to write
     * @param outputDir the target directory, created if missing
     * @return the manifest path
     * @throws IOException if any file cannot be written
     */
    public Path write(List<Variant> variants, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Map<String, Object>> manifest = new ArrayList<>(variants.size());
        for (Variant variant : variants) {
            Map<String, Object> doc = toDocument(variant);
            writeAtomically(outputDir, outputDir.resolve(variant.getId() + VARIANT_SUFFIX), dump.dumpToString(doc));
            manifest.add(doc);
        }
        Path manifestPath = outputDir.resolve(MANIFEST_NAME);
        writeAtomically(outputDir, manifestPath, dump.dumpToString(manifest));
        logger.info("wrote {} variant file(s) and manifest {}", variants.size(), manifestPath);
        return manifestPath;
    }

    private static Map<String, Object> toDocument(Variant variant) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", variant.getId());
        doc.put("index", variant.getIndex());
        doc.put("assignment", new LinkedHashMap<>(variant.getAssignment()));
        return doc;
    }

    private static void writeAtomically(Path dir, Path target, String text) throws IOException {
        Path temp = Files.createTempFile(dir, ".write-", ".tmp");
        try {
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
