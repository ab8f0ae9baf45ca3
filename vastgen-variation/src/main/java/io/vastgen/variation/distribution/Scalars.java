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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.StringJoiner;

/**
 * Helpers for the scalar values a distribution may produce.
 */
public final class Scalars {

    private Scalars() {
    }

    /**
     * Normalizes a document value to one of the supported scalar types.
     *
     * @param value the loaded value
     * @return a Long, Double, Boolean or String
     * @throws IllegalArgumentException for nulls, collections, or integers outside the
     *                                  {@code long} range
     */
    public static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Double
            || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.bitLength() < 64) {
                return big.longValue();
            }
            throw new IllegalArgumentException("integer " + big + " is out of range");
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value == null) {
            throw new IllegalArgumentException("null is not a valid value");
        }
        throw new IllegalArgumentException("expected a scalar but found "
            + value.getClass().getSimpleName() + " " + value);
    }

    /**
     * Renders a scalar with a type tag, so that {@code 1}, {@code 1.0} and {@code "1"}
     * describe differently.
     *
     * @param value a normalized scalar
     * @return the canonical text
     */
    public static String canonical(Object value) {
        if (value instanceof Long) {
            return "L" + value;
        }
        if (value instanceof Double) {
            return "D" + Double.doubleToLongBits((Double) value);
        }
        if (value instanceof Boolean) {
            return "B" + value;
        }
        String s = String.valueOf(value);
        return "S" + s.length() + ":" + s;
    }

    /**
     * @param values normalized scalars
     * @return the canonical text of the sequence, in order
     */
    public static String canonical(Collection<?> values) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (Object value : values) {
            joiner.add(canonical(value));
        }
        return joiner.toString();
    }

    static String canonical(double value) {
        return canonical((Object) value);
    }
}
