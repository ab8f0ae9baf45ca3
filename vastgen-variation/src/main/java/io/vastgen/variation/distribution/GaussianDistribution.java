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
 * A normal distribution with the given mean and standard deviation.
 *
 * <p>Draws are unbounded unless the declaration names explicit {@code min} and/or
 * {@code max} bounds, in which case draws are clipped to them. Nothing is clipped
 * implicitly.
 *
 * <p>{@code int} draws round half-up, {@code bool} draws yield {@code value >= mean}.
 */
public final class GaussianDistribution implements Distribution {

    public static final String KIND = "gaussian";

    private final double mean;
    private final double stddev;
    private final Double min;
    private final Double max;
    private final ValueType valueType;

    public GaussianDistribution(double mean, double stddev) {
        this(mean, stddev, null, null, ValueType.FLOAT);
    }

    /**
     * @param min optional inclusive lower clip, or null
     * @param max optional inclusive upper clip, or null
     * @throws InvalidDistributionException on a negative or non-finite stddev, a
     *                                      non-finite mean, or {@code min > max}
     */
    public GaussianDistribution(double mean, double stddev, Double min, Double max, ValueType valueType) {
        if (!Double.isFinite(mean)) {
            throw new InvalidDistributionException(null, "gaussian mean must be finite, got " + mean);
        }
        if (!Double.isFinite(stddev) || stddev < 0.0) {
            throw new InvalidDistributionException(null, "gaussian requires stddev >= 0, got " + stddev);
        }
        if (min != null && max != null && min > max) {
            throw new InvalidDistributionException(null, "gaussian requires min <= max, got min=" + min + " max=" + max);
        }
        this.mean = mean;
        this.stddev = stddev;
        this.min = min;
        this.max = max;
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public Object sample(UniformRandomProvider rng) {
        double value = mean + stddev * RandomGenerators.standardNormal(rng);
        if (min != null && value < min) {
            value = min;
        }
        if (max != null && value > max) {
            value = max;
        }
        switch (valueType) {
            case INT:
                return (long) Math.floor(value + 0.5);
            case BOOL:
                return value >= mean;
            case STRING:
                return Double.toString(value);
            case FLOAT:
            default:
                return value;
        }
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public ValueType getValueType() {
        return valueType;
    }

    @Override
    public String describe() {
        return KIND + "(mean=" + Scalars.canonical(mean) + ",stddev=" + Scalars.canonical(stddev)
            + ",min=" + (min == null ? "-" : Scalars.canonical(min))
            + ",max=" + (max == null ? "-" : Scalars.canonical(max))
            + ",value_type=" + valueType.label() + ")";
    }

    @Override
    public String toString() {
        return "gaussian(" + mean + ", " + stddev + ")" + (min != null || max != null ? " clipped [" + min + ", " + max + "]" : "")
            + " " + valueType.label();
    }
}
