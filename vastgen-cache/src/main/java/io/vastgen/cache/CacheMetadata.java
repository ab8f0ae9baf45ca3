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

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON sidecar written next to every payload. It makes an entry self-describing: the
 * recorded length and CRC32 catch truncated or corrupted payloads, the stamps catch
 * changed inputs.
 */
class CacheMetadata {

    static final int FORMAT_VERSION = 1;

    @SerializedName("version")
    int version;

    @SerializedName("key")
    String key;

    @SerializedName("logical_name")
    String logicalName;

    @SerializedName("inputs")
    List<Stamp> inputs = new ArrayList<>();

    @SerializedName("payload_length")
    long payloadLength;

    @SerializedName("payload_crc32")
    long payloadCrc32;

    /** Creation time in epoch milliseconds */
    @SerializedName("created")
    long created;

    static class Stamp {
        @SerializedName("path")
        String path;

        @SerializedName("size")
        long size;

        @SerializedName("mtime_nanos")
        long mtimeNanos;

        Stamp() {
        }

        Stamp(FileStamp stamp) {
            this.path = stamp.getPath();
            this.size = stamp.getSize();
            this.mtimeNanos = stamp.getMtimeNanos();
        }

        FileStamp toFileStamp() {
            return new FileStamp(path, size, mtimeNanos);
        }
    }
}
