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

import java.util.Locale;

/**
 * The scalar type a numeric distribution produces.
 *
 * <ul>
 *   <li>{@link #FLOAT}: {@link Double}</li>
 *   <li>{@link #INT}: {@link Long}</li>
 *   <li>{@link #BOOL}: {@link Boolean}</li>
 *   <li>{@link #STRING}: the decimal rendering of the underlying real draw</li>
 * </ul>
 */
public enum ValueType {
    FLOAT,
    INT,
    BOOL,
    STRING;

    /**
     * @param name the document spelling, case-insensitive; null means {@link #FLOAT}
     * @return the matching type
     * @throws IllegalArgumentException for unknown names
     */
    public static ValueType parse(String name) {
        if (name == null) {
            return FLOAT;
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "float":
            case "double":
                return FLOAT;
            case "int":
            case "integer":
                return INT;
            case "bool":
            case "boolean":
                return BOOL;
            case "str":
            case "string":
                return STRING;
            default:
                throw new IllegalArgumentException("unknown value_type '" + name
                    + "', expected one of float, int, bool, string");
        }
    }

    /// @return the document spelling
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
