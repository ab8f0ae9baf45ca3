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

import java.util.Objects;

/**
 * A uniform distribution over {@code [low, high]}.
 *
 * <h2>Interval conventions</h2>
 * <ul>
 *   <li>{@code float} and {@code string}: half-open {@code [low, high)}; a degenerate
 *       range {@code low == high} always yields {@code low}</li>
 *   <li>{@code int}: closed {@code [ceil(low), floor(high)]}</li>
 *   <li>{@code bool}: {@code true} with probability {@code high}; {@code low} is ignored</li>
 * </ul>
 */
public final class UniformDistribution implements Distribution {

    public static final String KIND = "uniform";

    private final double low;
    private final double high;
    private final ValueType valueType;

    public UniformDistribution(double low, double high) {
        this(low, high, ValueType.FLOAT);
    }

    /**
     * @throws InvalidDistributionException if {@code low > high}, a bound is not finite,
     *                                      an int range holds no integer, or a bool
     *                                      probability lies outside [0, 1]
     */
    public UniformDistribution(double low, double high, ValueType valueType) {
        if (!Double.isFinite(low) || !Double.isFinite(high)) {
            throw new InvalidDistributionException(null, "uniform bounds must be finite, got low=" + low + " high=" + high);
        }
        if (low > high) {
            throw new InvalidDistributionException(null, "uniform requires low <= high, got low=" + low + " high=" + high);
        }
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        if (valueType == ValueType.INT && Math.ceil(low) > Math.floor(high)) {
            throw new InvalidDistributionException(null, "uniform int range [" + low + ", " + high + "] contains no integer");
        }
        if (valueType == ValueType.BOOL && (high < 0.0 || high > 1.0)) {
            throw new InvalidDistributionException(null, "uniform bool probability (high) must be within [0, 1], got " + high);
        }
        this.low = low;
        this.high = high;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Object sample(UniformRandomProvider rng) {
        switch (valueType) {
            case INT:
                return RandomGenerators.uniformInclusive(rng, (long) Math.ceil(low), (long) Math.floor(high));
            case BOOL:
                return rng.nextDouble() < high;
            case STRING:
                return Double.toString(RandomGenerators.uniform(rng, low, high));
            case FLOAT:
            default:
                return RandomGenerators.uniform(rng, low, high);
        }
    }

    public double getLow() {
        return low;
    }

    public double getHigh() {
        return high;
    }

    public ValueType getValueType() {
        return valueType;
    }

    @Override
    public String describe() {
        return KIND + "(low=" + Scalars.canonical(low) + ",high=" + Scalars.canonical(high)
            + ",value_type=" + valueType.label() + ")";
    }

    @Override
    public String toString() {
        return "uniform[" + low + ", " + high + "] " + valueType.label();
    }
}
