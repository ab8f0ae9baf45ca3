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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * The identity of an input file as far as the cache is concerned: its absolute path,
 * its size and its modification time.
 *
 * <p>A missing file is stamped with size and mtime {@code -1}, so its later appearance
 * changes the key just as a modification would.
 */
public final class FileStamp implements Comparable<FileStamp> {

    /// Sentinel size and mtime for files that do not exist
    public static final long ABSENT = -1L;

    private final String path;
    private final long size;
    private final long mtimeNanos;

    public FileStamp(String path, long size, long mtimeNanos) {
        this.path = Objects.requireNonNull(path, "path");
        this.size = size;
        this.mtimeNanos = mtimeNanos;
    }

    /**
     * Stats a file. Missing files yield an {@link #ABSENT} stamp; other I/O problems
     * propagate so callers can decide whether they are fatal.
     *
     * @param file the file to stat
     * @return its current stamp
     * @throws IOException if the attributes exist but cannot be read
     */
    public static FileStamp of(Path file) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        try {
            BasicFileAttributes attrs = Files.readAttributes(normalized, BasicFileAttributes.class);
            return new FileStamp(
                normalized.toString(),
                attrs.size(),
                attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS)
            );
        } catch (NoSuchFileException e) {
            return new FileStamp(normalized.toString(), ABSENT, ABSENT);
        }
    }

    public String getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    public long getMtimeNanos() {
        return mtimeNanos;
    }

    public boolean isAbsent() {
        return size == ABSENT && mtimeNanos == ABSENT;
    }

    /**
     * @return true if the file on disk still carries the same size and mtime
     */
    public boolean isCurrent() {
        try {
            return this.equals(of(Path.of(path)));
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public int compareTo(FileStamp o) {
        return path.compareTo(o.path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileStamp)) return false;
        FileStamp that = (FileStamp) o;
        return size == that.size && mtimeNanos == that.mtimeNanos && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, size, mtimeNanos);
    }

    @Override
    public String toString() {
        return path + "[size=" + size + ", mtime=" + mtimeNanos + "]";
    }
}
