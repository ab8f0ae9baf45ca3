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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * An object store backed by a directory: each regular file under the root is an object
 * whose key is its relative path with {@code /} separators. Used for local execution,
 * where jobs write results to a shared directory instead of a bucket.
 */
public class LocalObjectStore implements ObjectStore {

    private final Path root;
    private final String bucket;

    /**
     * @param root the directory standing in for the bucket; its file name is used as the bucket name
     */
    public LocalObjectStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        Path name = this.root.getFileName();
        this.bucket = name == null ? "local" : name.toString();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public List<ObjectRef> list(String prefix) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<ObjectRef> refs = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                if (!attrs.isRegularFile()) {
                    continue;
                }
                String key = keyOf(file);
                if (key.startsWith(prefix)) {
                    refs.add(new ObjectRef(bucket, key, attrs.size(), attrs.lastModifiedTime().toInstant()));
                }
            }
        }
        Collections.sort(refs);
        return refs;
    }

    @Override
    public InputStream open(ObjectRef ref) throws IOException {
        Path file = root.resolve(ref.getKey()).normalize();
        if (!file.startsWith(root)) {
            throw new NoSuchFileException(ref.getKey(), null, "outside of " + root);
        }
        return Files.newInputStream(file);
    }

    private String keyOf(Path file) {
        StringBuilder key = new StringBuilder();
        for (Path part : root.relativize(file)) {
            if (key.length() > 0) {
                key.append('/');
            }
            key.append(part);
        }
        return key.toString();
    }

    @Override
    public String toString() {
        return "LocalObjectStore{" + root + "}";
    }
}
