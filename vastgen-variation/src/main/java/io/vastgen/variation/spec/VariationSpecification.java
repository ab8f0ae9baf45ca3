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


package io.vastgen.variation.spec;

import io.vastgen.variation.distribution.Distribution;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * An immutable, validated variation document: the parameters and how each is sampled,
 * plus count, seed and output naming.
 *
 * <p>Parameters are held in lexicographic name order, which is also the order in which
 * the generator draws them. The {@linkplain #getDigest() digest} is a SHA-256 over a
 * canonical rendering of everything that influences the generated variants (and nothing
 * else, so comments, key order and the {@code execution} section do not affect it).
 */
public final class VariationSpecification {

    /// Parameter names: an identifier, optionally with dots and dashes after the first character
    public static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private final int count;
    private final long seed;
    private final OutputNaming outputNaming;
    private final SortedMap<String, Distribution> parameters;
    private final List<String> inputs;
    private final ExecutionSettings execution;
    private final String sourceText;
    private final Path sourceFile;
    private final Path baseDir;
    private final String digest;

    private VariationSpecification(Builder b) {
        this.count = b.count;
        this.seed = b.seed;
        this.outputNaming = b.outputNaming;
        this.parameters = Collections.unmodifiableSortedMap(new TreeMap<>(b.parameters));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(b.inputs));
        this.execution = b.execution;
        this.sourceText = b.sourceText;
        this.sourceFile = b.sourceFile;
        this.baseDir = b.baseDir;
        this.digest = computeDigest();
    }

    public static Builder builder() {
        return new Builder();
    }

    private String computeDigest() {
        StringBuilder canonical = new StringBuilder();
        canonical.append("count=").append(count).append('\n');
        canonical.append("seed=").append(seed).append('\n');
        canonical.append("output_naming=").append(outputNaming.getTemplate()).append('\n');
        List<String> sortedInputs = new ArrayList<>(inputs);
        Collections.sort(sortedInputs);
        canonical.append("inputs=").append(sortedInputs).append('\n');
        for (Map.Entry<String, Distribution> e : parameters.entrySet()) {
            canonical.append("parameter ").append(e.getKey()).append('=')
                .append(e.getValue().describe()).append('\n');
        }
        return sha256Hex(canonical.toString());
    }

    static String sha256Hex(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(Character.forDigit((b >>> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /// @return the number of variants to generate; validated by the generator, not here
    public int getCount() {
        return count;
    }

    public long getSeed() {
        return seed;
    }

    public OutputNaming getOutputNaming() {
        return outputNaming;
    }

    /// @return parameters in lexicographic name order
    public SortedMap<String, Distribution> getParameters() {
        return parameters;
    }

    /// @return glob patterns, relative to the base directory, of files whose metadata joins the cache key
    public List<String> getInputs() {
        return inputs;
    }

    public ExecutionSettings getExecution() {
        return execution;
    }

    /// @return the document text, or null for programmatically built specifications
    public String getSourceText() {
        return sourceText;
    }

    /// @return the file the document was loaded from, or null
    public Path getSourceFile() {
        return sourceFile;
    }

    /// @return the directory relative paths in the document resolve against
    public Path getBaseDir() {
        return baseDir;
    }

    /// @return lowercase hex SHA-256 over the canonical content
    public String getDigest() {
        return digest;
    }

    @Override
    public String toString() {
        return "VariationSpecification[count=" + count + ", seed=" + seed + ", parameters="
            + parameters.keySet() + ", digest=" + digest.substring(0, 12) + "]";
    }

    public static final class Builder {
        private int count;
        private long seed;
        private OutputNaming outputNaming = OutputNaming.parse(OutputNaming.DEFAULT_TEMPLATE);
        private final Map<String, Distribution> parameters = new LinkedHashMap<>();
        private final List<String> inputs = new ArrayList<>();
        private ExecutionSettings execution = ExecutionSettings.defaults();
        private String sourceText;
        private Path sourceFile;
        private Path baseDir = Path.of("").toAbsolutePath();

        private Builder() {
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder outputNaming(OutputNaming outputNaming) {
            this.outputNaming = Objects.requireNonNull(outputNaming, "outputNaming");
            return this;
        }

        public Builder outputNaming(String template) {
            return outputNaming(OutputNaming.parse(template));
        }

        /**
         * @throws DuplicateParameterNameException if the name was already added
         * @throws SpecParseException if the name is not a valid parameter name
         */
        public Builder parameter(String name, Distribution distribution) {
            Objects.requireNonNull(distribution, "distribution");
            if (name == null || !PARAMETER_NAME.matcher(name).matches()) {
                throw new SpecParseException("invalid parameter name '" + name + "', names must match "
                    + PARAMETER_NAME.pattern());
            }
            if (parameters.containsKey(name)) {
                throw new DuplicateParameterNameException(name);
            }
            parameters.put(name, distribution);
            return this;
        }

        public Builder input(String glob) {
            this.inputs.add(Objects.requireNonNull(glob, "glob"));
            return this;
        }

        public Builder execution(ExecutionSettings execution) {
            this.execution = Objects.requireNonNull(execution, "execution");
            return this;
        }

        public Builder source(String sourceText, Path sourceFile) {
            this.sourceText = sourceText;
            this.sourceFile = sourceFile == null ? null : sourceFile.toAbsolutePath().normalize();
            return this;
        }

        public Builder baseDir(Path baseDir) {
            this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
            return this;
        }

        /**
         * @throws SpecParseException if no parameter was added
         */
        public VariationSpecification build() {
            if (parameters.isEmpty()) {
                throw new SpecParseException("a variation specification needs at least one parameter");
            }
            return new VariationSpecification(this);
        }
    }
}
