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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed, validating access to the fields of a single parameter declaration. Every failure
 * is reported as an {@link InvalidDistributionException} naming the parameter and field.
 */
public final class DistributionFields {

    /// The field carrying the kind tag
    public static final String TYPE = "type";

    private final String parameterName;
    private final Map<String, Object> fields;

    public DistributionFields(String parameterName, Map<String, ?> fields) {
        this.parameterName = parameterName;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getParameterName() {
        return parameterName;
    }

    public boolean has(String field) {
        return fields.containsKey(field) && fields.get(field) != null;
    }

    public double requireDouble(String field) {
        if (!has(field)) {
            throw invalid("missing required field '" + field + "'");
        }
        return toDouble(field, fields.get(field));
    }

    public Double optionalDouble(String field) {
        return has(field) ? toDouble(field, fields.get(field)) : null;
    }

    public String optionalString(String field) {
        if (!has(field)) {
            return null;
        }
        Object value = fields.get(field);
        if (!(value instanceof String)) {
            throw invalid("field '" + field + "' must be a string, got " + value);
        }
        return (String) value;
    }

    public List<?> requireList(String field) {
        if (!has(field)) {
            throw invalid("missing required field '" + field + "'");
        }
        Object value = fields.get(field);
        if (!(value instanceof List<?>)) {
            throw invalid("field '" + field + "' must be a list, got " + value);
        }
        return (List<?>) value;
    }

    /**
     * @param allowed the fields the kind understands, besides {@code type}
     * @throws InvalidDistributionException naming the first unexpected field
     */
    public void checkOnly(String... allowed) {
        Set<String> known = new TreeSet<>(Arrays.asList(allowed));
        known.add(TYPE);
        for (String field : new TreeSet<>(fields.keySet())) {
            if (!known.contains(field)) {
                throw invalid("unexpected field '" + field + "', allowed: " + known);
            }
        }
    }

    public ValueType valueType(String field) {
        try {
            return ValueType.parse(optionalString(field));
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage());
        }
    }

    public InvalidDistributionException invalid(String reason) {
        return new InvalidDistributionException(parameterName, reason);
    }

    private double toDouble(String field, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw invalid("field '" + field + "' must be a number, got " + value);
    }
}
