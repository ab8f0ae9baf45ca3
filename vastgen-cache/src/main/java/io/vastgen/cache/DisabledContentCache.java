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

import java.util.Optional;

/// A cache that never hits.
final class DisabledContentCache implements ContentCache {

    static final DisabledContentCache INSTANCE = new DisabledContentCache();

    private DisabledContentCache() {
    }

    @Override
    public Optional<CacheEntry> lookup(CacheKey key, String logicalName) {
        return Optional.empty();
    }

    @Override
    public boolean contains(CacheKey key, String logicalName) {
        return false;
    }

    @Override
    public void store(CacheKey key, String logicalName, byte[] payload) {
    }

    @Override
    public String toString() {
        return "DisabledContentCache";
    }
}
