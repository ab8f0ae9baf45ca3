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


package io.vastgen.archive;

import java.time.Instant;
import java.util.Objects;

/**
 * A reference to one stored result object: bucket, key, size and modification time as
 * reported by the store's listing.
 *
 * <p>Keys use {@code /} separators and must be relative without {@code .} or {@code ..}
 * segments, so an object can never be placed outside its run's namespace in an archive.
 */
public final class ObjectRef implements Comparable<ObjectRef> {

    private final String bucket;
    private final String key;
    private final long size;
    private final Instant lastModified;

    /**
     * @throws IllegalArgumentException if the key is empty, absolute, or has a {@code .}, {@code ..} or empty segment
     */
    public ObjectRef(String bucket, String key, long size, Instant lastModified) {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.key = checkKey(Objects.requireNonNull(key, "key"));
        if (size < 0) {
            throw new IllegalArgumentException("negative size " + size + " for " + key);
        }
        this.size = size;
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
    }

    private static String checkKey(String key) {
        if (key.isEmpty() || key.startsWith("/") || key.endsWith("/")) {
            throw new IllegalArgumentException("invalid object key '" + key + "'");
        }
        for (String segment : key.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("invalid object key '" + key + "'");
            }
        }
        return key;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    public long getSize() {
        return size;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    @Override
    public int compareTo(ObjectRef o) {
        int c = bucket.compareTo(o.bucket);
        return c != 0 ? c : key.compareTo(o.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectRef)) return false;
        ObjectRef that = (ObjectRef) o;
        return bucket.equals(that.bucket) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
