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

/**
 * A sampling primitive producing one scalar per draw.
 *
 * <p>Implementations are immutable and validate their parameters on construction,
 * throwing {@link InvalidDistributionException}. Samples are {@link Long},
 * {@link Double}, {@link Boolean} or {@link String}.
 *
 * <p>{@link #sample} consumes values from the provider and is deterministic for a given
 * provider state. Nothing else about the provider is retained.
 *
 * @see DistributionFactory
 * @see DistributionRegistry
 */
public interface Distribution {

    /**
     * @return the registered kind tag, such as {@code uniform}
     */
    String kind();

    /**
     * Draws one value.
     *
     * @param rng the random source, positioned by the caller
     * @return a scalar
     */
    Object sample(UniformRandomProvider rng);

    /**
     * A canonical, unambiguous rendering of this distribution's parameters. Two
     * distributions that sample identically have identical descriptions; the text feeds
     * document digests and therefore cache keys.
     *
     * @return the description
     */
    String describe();

    /**
     * Exhaustive distributions are enumerated by index rather than sampled.
     *
     * @return true if the generator should call {@link ListDistribution#valueAt(long)}
     */
    default boolean isExhaustive() {
        return false;
    }
}
