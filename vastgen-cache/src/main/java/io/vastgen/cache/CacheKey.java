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


package io.vastgen.cache;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A computed cache key: 128 bits rendered as 32 lowercase hex characters, together with
 * the input file stamps it was derived from.
 *
 * <p>Two keys are equal when their hex values are equal. The stamps are carried along so
 * that a stored entry can record what it depends on and be re-validated on lookup.
 */
public final class CacheKey {

    private final String value;
    private final List<FileStamp> stamps;

    CacheKey(String value, List<FileStamp> stamps) {
        this.value = Objects.requireNonNull(value, "value");
        this.stamps = Collections.unmodifiableList(stamps);
    }

    /// @return the hex form of the key, safe for use as a file name
    public String getValue() {
        return value;
    }

    /// @return the input stamps, sorted by path
    public List<FileStamp> getStamps() {
        return stamps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        return value.equals(((CacheKey) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
