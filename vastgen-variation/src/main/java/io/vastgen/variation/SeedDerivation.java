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

/**
 * Versioned rules for deriving a per-variant random seed from the document seed and the
 * variant index.
 *
 * <p>A rule must never change once published: archived runs are reproduced by
 * re-deriving the same seeds. New behaviour gets a new constant, and the
 * {@linkplain #version() version} participates in generator cache keys so results of
 * different rules are never confused.
 */
public enum SeedDerivation {

    /**
     * {@code mix64(seed + GOLDEN_GAMMA * (index + 1))}, where {@code mix64} is the SplitMix64
     * output finalizer. Adjacent indices land on statistically unrelated seeds.
     */
    V1("v1") {
        @Override
        public long derive(long seed, long index) {
            return mix64(seed + GOLDEN_GAMMA * (index + 1));
        }
    };

    /// The 64-bit golden ratio increment used by SplitMix64
    public static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final String version;

    SeedDerivation(String version) {
        this.version = version;
    }

    /**
     * @param seed the document seed
     * @param index the variant index
     * @return the seed for that variant's random source
     */
    public abstract long derive(long seed, long index);

    public String version() {
        return version;
    }

    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
