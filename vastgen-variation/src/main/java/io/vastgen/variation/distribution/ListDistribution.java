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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A fixed, ordered sequence of values.
 *
 * <p>In {@link Mode#EXHAUSTIVE} mode, the default, the generator enumerates the values by
 * variant index via {@link #valueAt(long)}; in {@link Mode#RANDOM} mode each draw picks a
 * uniformly chosen element.
 */
public final class ListDistribution implements Distribution {

    public static final String KIND = "list";

    public enum Mode {
        EXHAUSTIVE,
        RANDOM;

        public static Mode parse(String name) {
            if (name == null) {
                return EXHAUSTIVE;
            }
            switch (name.toLowerCase(Locale.ROOT)) {
                case "exhaustive":
                    return EXHAUSTIVE;
                case "random":
                    return RANDOM;
                default:
                    throw new IllegalArgumentException("unknown list mode '" + name
                        + "', expected exhaustive or random");
            }
        }
    }

    private final List<Object> values;
    private final Mode mode;

    public ListDistribution(List<?> values) {
        this(values, Mode.EXHAUSTIVE);
    }

    /**
     * @param values the candidate values; normalized to supported scalar types
     * @param mode enumeration mode
     * @throws InvalidDistributionException if the list is empty or holds non-scalars
     */
    public ListDistribution(List<?> values, Mode mode) {
        if (values == null || values.isEmpty()) {
            throw new InvalidDistributionException(null, "list distribution needs at least one value");
        }
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            try {
                normalized.add(Scalars.normalize(value));
            } catch (IllegalArgumentException e) {
                throw new InvalidDistributionException(null, "list value: " + e.getMessage());
            }
        }
        this.values = Collections.unmodifiableList(normalized);
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Object sample(UniformRandomProvider rng) {
        return values.get(rng.nextInt(values.size()));
    }

    /**
     * @param index any non-negative index; wraps around past the end
     * @return the value at {@code index mod size}
     */
    public Object valueAt(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        return values.get((int) (index % values.size()));
    }

    public int size() {
        return values.size();
    }

    public List<Object> getValues() {
        return values;
    }

    public Mode getMode() {
        return mode;
    }

    @Override
    public boolean isExhaustive() {
        return mode == Mode.EXHAUSTIVE;
    }

    @Override
    public String describe() {
        return KIND + "(mode=" + mode.name().toLowerCase(Locale.ROOT)
            + ",values=" + Scalars.canonical(values) + ")";
    }

    @Override
    public String toString() {
        return "list" + values + (mode == Mode.RANDOM ? " (random)" : "");
    }
}
