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

import io.vastgen.cache.CacheEntry;
import io.vastgen.cache.CacheKey;
import io.vastgen.cache.CacheKeys;
import io.vastgen.cache.ContentCache;
import io.vastgen.status.ProgressSink;
import io.vastgen.variation.distribution.Distribution;
import io.vastgen.variation.distribution.ListDistribution;
import io.vastgen.variation.distribution.RandomGenerators;
import io.vastgen.variation.spec.VariationSpecification;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Expands a {@link VariationSpecification} into its ordered list of {@link Variant}s.
 *
 * <h2>Algorithm</h2>
 * <p>For each index {@code i} in {@code 0 .. count-1}:
 * <ol>
 *   <li>exhaustive list parameters take their digit of {@code i} in the mixed-radix
 *       numbering of their cartesian product (parameters in name order, the last name
 *       varying fastest), cycling once the product is exhausted</li>
 *   <li>a random source is seeded with {@link SeedDerivation#derive(long, long)} and every
 *       other parameter draws from it in name order</li>
 *   <li>the id is formatted from the output naming template</li>
 * </ol>
 * The same {@code (seed, index, specification)} therefore always yields the same variant.
 *
 * <h2>Caching</h2>
 * <p>Before sampling, the generator consults its {@link ContentCache} under the logical
 * name {@value #CACHE_NAME}, keyed by the source document file and resolved {@code inputs}
 * plus the document digest and derivation version. A hit is returned unmodified. Any cache
 * trouble is logged and generation proceeds without it.
 */
public class VariantGenerator {
    private static final Logger logger = LogManager.getLogger(VariantGenerator.class);

    public static final String CACHE_NAME = "variants.json";

    private static final int PROGRESS_STEPS = 10;

    private final ContentCache cache;
    private final SeedDerivation derivation;

    public VariantGenerator() {
        this(ContentCache.disabled());
    }

    public VariantGenerator(ContentCache cache) {
        this(cache, SeedDerivation.V1);
    }

    public VariantGenerator(ContentCache cache, SeedDerivation derivation) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.derivation = Objects.requireNonNull(derivation, "derivation");
    }

    public List<Variant> generate(VariationSpecification spec) {
        return generate(spec, ProgressSink.none());
    }

    /**
     * Generates all variants, or returns the cached list from an identical earlier run.
     *
     * @param spec the specification
     * @param progress receives progress messages
     * @return the variants in index order, unmodifiable
     * @throws GenerationException if {@code count <= 0} or ids collide
     */
    public List<Variant> generate(VariationSpecification spec, ProgressSink progress) {
        if (spec.getCount() <= 0) {
            throw new GenerationException("count must be positive, got " + spec.getCount());
        }

        Optional<CacheKey> key = cacheKey(spec);
        if (key.isPresent()) {
            Optional<List<Variant>> cached = fromCache(spec, key.get());
            if (cached.isPresent()) {
                progress.progress("Reusing " + cached.get().size() + " cached variants (key " + key.get() + ")");
                return cached.get();
            }
        }

        List<Variant> variants = expand(spec, progress);

        key.ifPresent(k -> cache.store(k, CACHE_NAME, VariantListCodec.encode(variants).getBytes(StandardCharsets.UTF_8)));
        return variants;
    }

    /**
     * Generates all variants without consulting the cache.
     */
    public List<Variant> expand(VariationSpecification spec, ProgressSink progress) {
        if (spec.getCount() <= 0) {
            throw new GenerationException("count must be positive, got " + spec.getCount());
        }
        Map<String, Distribution> parameters = spec.getParameters();
        List<String> exhaustive = new ArrayList<>();
        for (Map.Entry<String, Distribution> e : parameters.entrySet()) {
            if (e.getValue().isExhaustive()) {
                exhaustive.add(e.getKey());
            }
        }

        int count = spec.getCount();
        int step = Math.max(1, count / PROGRESS_STEPS);
        List<Variant> variants = new ArrayList<>(count);
        Set<String> ids = new HashSet<>();
        progress.progress("Generating " + count + " variants over " + parameters.size() + " parameter(s)");

        for (int index = 0; index < count; index++) {
            Map<String, Object> assignment = new LinkedHashMap<>();
            assignExhaustive(parameters, exhaustive, index, assignment);

            UniformRandomProvider rng = RandomGenerators.create(derivation.derive(spec.getSeed(), index));
            for (Map.Entry<String, Distribution> e : parameters.entrySet()) {
                if (!e.getValue().isExhaustive()) {
                    assignment.put(e.getKey(), e.getValue().sample(rng));
                }
            }

            String hash = spec.getOutputNaming().usesHash() ? variantHash(spec, index) : null;
            String id = spec.getOutputNaming().format(index, hash);
            if (!ids.add(id)) {
                throw new GenerationException("output_naming '" + spec.getOutputNaming()
                    + "' produced the id '" + id + "' twice (index " + index + ")");
            }
            variants.add(new Variant(index, id, assignment));

            if ((index + 1) % step == 0 || index + 1 == count) {
                progress.progress("Generated " + (index + 1) + "/" + count + " variants");
            }
        }
        logger.debug("expanded {} into {} variants", spec, variants.size());
        return Collections.unmodifiableList(variants);
    }

    private static void assignExhaustive(Map<String, Distribution> parameters, List<String> exhaustive,
                                         long index, Map<String, Object> assignment) {
        long remaining = index;
        for (int i = exhaustive.size() - 1; i >= 0; i--) {
            String name = exhaustive.get(i);
            ListDistribution list = (ListDistribution) parameters.get(name);
            assignment.put(name, list.valueAt(remaining % list.size()));
            remaining /= list.size();
        }
    }

    /**
     * @return eight hex characters of SHA-256 over seed, index and document digest
     */
    static String variantHash(VariationSpecification spec, long index) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(ByteBuffer.allocate(16).putLong(spec.getSeed()).putLong(index).array());
            md.update(spec.getDigest().getBytes(StandardCharsets.US_ASCII));
            return CacheKeys.toHex(md.digest(), 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * @return the cache key for this specification, or empty if its inputs cannot be examined
     */
    Optional<CacheKey> cacheKey(VariationSpecification spec) {
        try {
            List<Path> files = new ArrayList<>(InputFiles.resolve(spec.getBaseDir(), spec.getInputs()));
            if (spec.getSourceFile() != null) {
                files.add(spec.getSourceFile());
            }
            return Optional.of(CacheKeys.compute(files, List.of(
                "digest=" + spec.getDigest(),
                "derivation=" + derivation.version()
            )));
        } catch (IOException | UncheckedIOException e) {
            logger.warn("not caching variants: unable to examine inputs under {}: {}", spec.getBaseDir(), e.toString());
            return Optional.empty();
        }
    }

    private Optional<List<Variant>> fromCache(VariationSpecification spec, CacheKey key) {
        try {
            Optional<CacheEntry> entry = cache.lookup(key, CACHE_NAME);
            if (entry.isEmpty()) {
                return Optional.empty();
            }
            List<Variant> variants = VariantListCodec.decode(new String(entry.get().getPayload(), StandardCharsets.UTF_8));
            if (variants.size() != spec.getCount()) {
                logger.warn("ignoring cached variant list {}: holds {} variants, expected {}",
                    key, variants.size(), spec.getCount());
                return Optional.empty();
            }
            for (Variant variant : variants) {
                if (!variant.getAssignment().keySet().equals(spec.getParameters().keySet())) {
                    logger.warn("ignoring cached variant list {}: parameters do not match the specification", key);
                    return Optional.empty();
                }
            }
            logger.info("variant cache hit {} ({} variants)", key, variants.size());
            return Optional.of(Collections.unmodifiableList(variants));
        } catch (RuntimeException e) {
            logger.warn("ignoring unreadable cached variant list {}: {}", key, e.toString());
            return Optional.empty();
        }
    }
}
