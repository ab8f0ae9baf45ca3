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
import java.time.Instant;
import java.util.Objects;

/**
 * A validated cache hit. The payload has already been checked against the recorded length
 * and CRC32 when this object is handed out.
 */
public final class CacheEntry {

    private final CacheKey key;
    private final String logicalName;
    private final byte[] payload;
    private final Path payloadPath;
    private final Instant created;

    CacheEntry(CacheKey key, String logicalName, byte[] payload, Path payloadPath, Instant created) {
        this.key = Objects.requireNonNull(key);
        this.logicalName = Objects.requireNonNull(logicalName);
        this.payload = payload;
        this.payloadPath = payloadPath;
        this.created = created;
    }

    public CacheKey getKey() {
        return key;
    }

    public String getLogicalName() {
        return logicalName;
    }

    /// @return a copy of the payload bytes
    public byte[] getPayload() {
        return payload.clone();
    }

    /// @return where the payload lives on disk, or null for caches without a backing file
    public Path getPayloadPath() {
        return payloadPath;
    }

    public Instant getCreated() {
        return created;
    }

    @Override
    public String toString() {
        return "CacheEntry[" + logicalName + "/" + key + ", " + payload.length + " bytes]";
    }
}
