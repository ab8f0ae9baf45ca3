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
import io.vastgen.variation.distribution.DistributionFactory;
import io.vastgen.variation.distribution.DistributionFields;
import io.vastgen.variation.distribution.DistributionRegistry;
import io.vastgen.variation.distribution.ListDistribution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.api.lowlevel.Compose;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.nodes.MappingNode;
import org.snakeyaml.engine.v2.nodes.Node;
import org.snakeyaml.engine.v2.nodes.NodeTuple;
import org.snakeyaml.engine.v2.nodes.ScalarNode;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses variation documents (YAML 1.2, and therefore JSON) into
 * {@link VariationSpecification}s.
 *
 * <pre>{@code
 * count: 10
 * seed: 42
 * output_naming: "variant-{index:04}"
 * inputs: [scenarios/*.osc]
 * parameters:
 *   speed:     {type: uniform, low: 0.5, high: 2.0}
 *   obstacles: {type: list, values: [0, 2, 4]}
 *   noise:     {type: gaussian, mean: 0.0, stddev: 0.1, min: -0.3, max: 0.3}
 * execution:
 *   concurrency_limit: 8
 * }</pre>
 *
 * <p>A parameter may also be given as a bare sequence, shorthand for an exhaustive list.
 *
 * <p>Parsing is pure: it reads the supplied document and nothing else. Glob patterns under
 * {@code inputs} are resolved later, at generation time.
 */
public class VariationSpecificationParser {
    private static final Logger logger = LogManager.getLogger(VariationSpecificationParser.class);

    public static final String COUNT = "count";
    public static final String SEED = "seed";
    public static final String OUTPUT_NAMING = "output_naming";
    public static final String INPUTS = "inputs";
    public static final String PARAMETERS = "parameters";
    public static final String EXECUTION = "execution";

    private static final Set<String> TOP_LEVEL_KEYS = new TreeSet<>(List.of(
        COUNT, SEED, OUTPUT_NAMING, INPUTS, PARAMETERS, EXECUTION, "name", "description"));

    private final DistributionRegistry registry;

    public VariationSpecificationParser() {
        this(DistributionRegistry.standard());
    }

    public VariationSpecificationParser(DistributionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Reads and parses a document file. Relative paths in the document resolve against the
     * file's directory.
     *
     * @param file the document
     * @return the specification
     * @throws IOException if the file cannot be read
     * @throws SpecParseException if the document is malformed
     */
    public VariationSpecification load(Path file) throws IOException {
        Path absolute = file.toAbsolutePath().normalize();
        String text = Files.readString(absolute);
        logger.debug("parsing variation document {}", absolute);
        return parse(text, absolute.getParent(), absolute);
    }

    /**
     * Parses document text.
     *
     * @param text the document
     * @param baseDir the directory relative paths resolve against
     * @return the specification
     * @throws SpecParseException if the document is malformed
     */
    public VariationSpecification parse(String text, Path baseDir) {
        return parse(text, baseDir, null);
    }

    private VariationSpecification parse(String text, Path baseDir, Path sourceFile) {
        LoadSettings settings = LoadSettings.builder()
            .setLabel(sourceFile == null ? "variation document" : sourceFile.toString())
            .setAllowDuplicateKeys(false)
            .build();

        Object document;
        try {
            checkDuplicateParameters(new Compose(settings).composeString(text));
            document = new Load(settings).loadFromString(text);
        } catch (YamlEngineException e) {
            throw new SpecParseException("invalid YAML: " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new SpecParseException("a variation document must be a mapping, got "
                + (document == null ? "an empty document" : document.getClass().getSimpleName()));
        }
        Map<?, ?> root = (Map<?, ?>) document;
        for (Object key : root.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(String.valueOf(key))) {
                throw new SpecParseException("unknown top-level field '" + key + "', known fields: " + TOP_LEVEL_KEYS);
            }
        }

        VariationSpecification.Builder builder = VariationSpecification.builder()
            .count(requireInt(root, COUNT))
            .seed(requireLong(root, SEED))
            .baseDir(baseDir == null ? Path.of("") : baseDir)
            .source(text, sourceFile);

        Object naming = root.get(OUTPUT_NAMING);
        if (naming != null) {
            if (!(naming instanceof String)) {
                throw new SpecParseException("'" + OUTPUT_NAMING + "' must be a string, got " + naming);
            }
            builder.outputNaming((String) naming);
        }

        Object inputs = root.get(INPUTS);
        if (inputs != null) {
            if (!(inputs instanceof List<?>)) {
                throw new SpecParseException("'" + INPUTS + "' must be a list of glob patterns");
            }
            for (Object glob : (List<?>) inputs) {
                if (!(glob instanceof String)) {
                    throw new SpecParseException("'" + INPUTS + "' entries must be strings, got " + glob);
                }
                builder.input((String) glob);
            }
        }

        Object parameters = root.get(PARAMETERS);
        if (parameters == null) {
            throw new SpecParseException("missing required field '" + PARAMETERS + "'");
        }
        if (!(parameters instanceof Map<?, ?>)) {
            throw new SpecParseException("'" + PARAMETERS + "' must be a mapping of name to distribution");
        }
        Map<?, ?> parameterMap = (Map<?, ?>) parameters;
        if (parameterMap.isEmpty()) {
            throw new SpecParseException("'" + PARAMETERS + "' must declare at least one parameter");
        }
        for (Map.Entry<?, ?> entry : parameterMap.entrySet()) {
            String name = String.valueOf(entry.getKey());
            builder.parameter(name, distributionFor(name, entry.getValue()));
        }

        Object execution = root.get(EXECUTION);
        if (execution != null && !(execution instanceof Map<?, ?>)) {
            throw new SpecParseException("'" + EXECUTION + "' must be a mapping");
        }
        builder.execution(ExecutionSettings.fromDocument((Map<?, ?>) execution));

        VariationSpecification spec = builder.build();
        logger.debug("parsed {}", spec);
        return spec;
    }

    private Distribution distributionFor(String name, Object declaration) {
        if (declaration instanceof List<?>) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(DistributionFields.TYPE, ListDistribution.KIND);
            fields.put("values", declaration);
            declaration = fields;
        }
        if (!(declaration instanceof Map<?, ?>)) {
            throw new SpecParseException("parameter '" + name + "' must be a mapping with a 'type' field, got "
                + declaration);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : ((Map<?, ?>) declaration).entrySet()) {
            fields.put(String.valueOf(field.getKey()), field.getValue());
        }
        Object kind = fields.get(DistributionFields.TYPE);
        if (!(kind instanceof String)) {
            throw new SpecParseException("parameter '" + name + "' is missing its 'type' field");
        }
        Optional<DistributionFactory> factory = registry.find((String) kind);
        if (factory.isEmpty()) {
            throw new UnknownDistributionKindException(name, (String) kind, registry.getKinds());
        }
        return factory.get().create(new DistributionFields(name, fields));
    }

    /**
     * Walks the composed node graph for repeated keys under {@code parameters}, which the
     * loader would otherwise report only as a generic duplicate key.
     */
    private static void checkDuplicateParameters(Optional<Node> root) {
        if (root.isEmpty() || !(root.get() instanceof MappingNode)) {
            return;
        }
        for (NodeTuple tuple : ((MappingNode) root.get()).getValue()) {
            if (tuple.getKeyNode() instanceof ScalarNode
                && PARAMETERS.equals(((ScalarNode) tuple.getKeyNode()).getValue())
                && tuple.getValueNode() instanceof MappingNode) {
                Set<String> seen = new HashSet<>();
                for (NodeTuple param : ((MappingNode) tuple.getValueNode()).getValue()) {
                    if (param.getKeyNode() instanceof ScalarNode) {
                        String name = ((ScalarNode) param.getKeyNode()).getValue();
                        if (!seen.add(name)) {
                            throw new DuplicateParameterNameException(name);
                        }
                    }
                }
            }
        }
    }

    private static int requireInt(Map<?, ?> root, String field) {
        long value = requireLong(root, field);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new SpecParseException("'" + field + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static long requireLong(Map<?, ?> root, String field) {
        Object value = root.get(field);
        if (value == null) {
            throw new SpecParseException("missing required field '" + field + "'");
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64) {
            return ((BigInteger) value).longValue();
        }
        throw new SpecParseException("'" + field + "' must be an integer, got " + value);
    }
}
