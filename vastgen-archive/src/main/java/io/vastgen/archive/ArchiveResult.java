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

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful {@link ResultArchiver#archive} call.
 */
public final class ArchiveResult {

    private final Path path;
    private final List<String> entries;
    private final List<ObjectRef> skipped;
    private final long bytes;

    ArchiveResult(Path path, List<String> entries, List<ObjectRef> skipped, long bytes) {
        this.path = path;
        this.entries = List.copyOf(entries);
        this.skipped = List.copyOf(skipped);
        this.bytes = bytes;
    }

    public Path getPath() {
        return path;
    }

    /// @return names of the file entries written, in archive order
    public List<String> getEntries() {
        return entries;
    }

    /// @return objects left out under [FailurePolicy#SKIP_UNREADABLE]
    public List<ObjectRef> getSkipped() {
        return skipped;
    }

    /// @return uncompressed payload bytes archived
    public long getBytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return "ArchiveResult{" + path + ", entries=" + entries.size() + ", skipped=" + skipped.size() + ", bytes=" + bytes + "}";
    }
}
