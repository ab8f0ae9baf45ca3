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


package io.vastgen.variation.distribution;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Resolves distribution kind tags to their {@link DistributionFactory}.
 *
 * <p>The standard registry is populated once via {@link ServiceLoader} from every
 * {@link DistributionFactory} on the class path; the kind name is read from the
 * {@link DistributionKind} annotation, so providers are only instantiated when chosen.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * DistributionRegistry registry = DistributionRegistry.standard();
 * DistributionFactory uniform = registry.find("uniform").orElseThrow();
 *
 * // tests and embedders can assemble their own registry
 * DistributionRegistry custom = DistributionRegistry.standard()
 *     .with("constant", fields -> new ListDistribution(List.of(fields.requireDouble("value"))));
 * }</pre>
 *
 * @see DistributionKind
 */
public final class DistributionRegistry {
    private static final Logger logger = LogManager.getLogger(DistributionRegistry.class);

    private static volatile DistributionRegistry standard;

    private final Map<String, DistributionFactory> factories;

    private DistributionRegistry(Map<String, DistributionFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * @return the registry of all factories discoverable from this class's class loader
     */
    public static DistributionRegistry standard() {
        DistributionRegistry registry = standard;
        if (registry == null) {
            synchronized (DistributionRegistry.class) {
                registry = standard;
                if (registry == null) {
                    registry = load(DistributionRegistry.class.getClassLoader());
                    standard = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Discovers factories from the given class loader.
     *
     * @param classLoader the loader to search
     * @return a new registry
     * @throws IllegalStateException if two providers claim the same kind
     */
    public static DistributionRegistry load(ClassLoader classLoader) {
        Map<String, DistributionFactory> found = new LinkedHashMap<>();
        ServiceLoader<DistributionFactory> loader = ServiceLoader.load(DistributionFactory.class, classLoader);
        loader.stream().forEach(provider -> {
            DistributionKind kind = provider.type().getAnnotation(DistributionKind.class);
            if (kind == null) {
                logger.warn("ignoring distribution factory {} without @DistributionKind", provider.type().getName());
                return;
            }
            if (found.containsKey(kind.value())) {
                throw new IllegalStateException("distribution kind '" + kind.value() + "' is provided by both "
                    + found.get(kind.value()).getClass().getName() + " and " + provider.type().getName());
            }
            found.put(kind.value(), provider.get());
        });
        logger.debug("loaded distribution kinds {}", found.keySet());
        return new DistributionRegistry(found);
    }

    /**
     * @param kind the tag to register
     * @param factory its factory
     * @return a copy of this registry with the kind added or replaced
     */
    public DistributionRegistry with(String kind, DistributionFactory factory) {
        Map<String, DistributionFactory> copy = new LinkedHashMap<>(factories);
        copy.put(kind, factory);
        return new DistributionRegistry(copy);
    }

    /**
     * @param kind the tag from a parameter declaration
     * @return its factory, or empty if the kind is not registered
     */
    public Optional<DistributionFactory> find(String kind) {
        return Optional.ofNullable(factories.get(kind));
    }

    /// @return the registered kind tags
    public Set<String> getKinds() {
        return factories.keySet();
    }
}
