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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One concrete parameter assignment: its index, its id, and the value chosen for each
 * parameter. Assignments are held in lexicographic parameter order and never change.
 */
public final class Variant {

    private final int index;
    private final String id;
    private final Map<String, Object> assignment;

    public Variant(int index, String id, Map<String, ?> assignment) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        this.index = index;
        this.id = Objects.requireNonNull(id, "id");
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(assignment)));
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    /// @return parameter name to scalar, in name order
    public Map<String, Object> getAssignment() {
        return assignment;
    }

    public Object get(String parameter) {
        return assignment.get(parameter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variant)) return false;
        Variant variant = (Variant) o;
        return index == variant.index && id.equals(variant.id) && assignment.equals(variant.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, id, assignment);
    }

    @Override
    public String toString() {
        return id + assignment;
    }
}
