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

import java.nio.file.Path;
import java.util.Optional;

/**
 * A content-addressed store of derived artifacts, keyed by {@code (CacheKey, logical name)}.
 *
 * <p>The cache is an optimization and never a correctness dependency. Implementations
 * resolve every problem they meet (missing entry, changed inputs, corrupt or unreadable
 * files) as a miss and log it. {@link #store} never throws for I/O reasons.
 *
 * <p>Instances are safe for concurrent use. Operations on distinct keys do not block one
 * another, and a caller that stores an entry sees it on its next lookup.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ContentCache cache = ContentCache.atDirectory(ContentCache.defaultDirectory(dataDir));
 * CacheKey key = CacheKeys.compute(List.of(specFile), List.of(digest));
 * byte[] bytes = cache.lookup(key, "variants.json")
 *     .map(CacheEntry::getPayload)
 *     .orElseGet(() -> {
 *         byte[] fresh = expensiveWork();
 *         cache.store(key, "variants.json", fresh);
 *         return fresh;
 *     });
 * }</pre>
 */
public interface ContentCache {

    /// Name of the cache directory created inside a data directory
    String DEFAULT_DIRECTORY_NAME = ".cache";

    /**
     * Looks up an entry. Every input stamp recorded with the entry is compared against the
     * file system; any difference is a miss.
     *
     * @param key the key
     * @param logicalName the artifact name within the key
     * @return the entry, or empty on a miss
     */
    Optional<CacheEntry> lookup(CacheKey key, String logicalName);

    /**
     * Presence check that validates the entry's metadata and inputs without reading the
     * payload. Used when the caller only needs an invalidation decision.
     *
     * @param key the key
     * @param logicalName the artifact name within the key
     * @return true if {@link #lookup} would currently hit, payload corruption aside
     */
    boolean contains(CacheKey key, String logicalName);

    /**
     * Stores an entry, silently replacing one with the same key and logical name.
     *
     * @param key the key, whose stamps are recorded for later validation
     * @param logicalName the artifact name within the key
     * @param payload the bytes to store
     */
    void store(CacheKey key, String logicalName, byte[] payload);

    /**
     * @return a cache that always misses and discards stores
     */
    static ContentCache disabled() {
        return DisabledContentCache.INSTANCE;
    }

    /**
     * @param directory the cache root, created on first store if needed
     * @return a file-system backed cache
     */
    static ContentCache atDirectory(Path directory) {
        return new DirectoryContentCache(directory);
    }

    /**
     * @param dataDirectory a directory the caller owns
     * @return the conventional cache location within it
     */
    static Path defaultDirectory(Path dataDirectory) {
        return dataDirectory.resolve(DEFAULT_DIRECTORY_NAME);
    }
}
