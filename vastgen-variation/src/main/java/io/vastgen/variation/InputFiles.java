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

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves the {@code inputs} glob patterns of a document to concrete files.
 *
 * <p>Patterns are matched against paths relative to the base directory, using
 * {@link java.nio.file.FileSystem#getPathMatcher(String) glob} syntax with {@code /}
 * separators. A pattern without glob metacharacters names a single file, which is
 * included even when it does not exist so that its later creation changes the key.
 */
final class InputFiles {

    private InputFiles() {
    }

    static List<Path> resolve(Path baseDir, List<String> patterns) throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        for (String pattern : patterns) {
            if (!isGlob(pattern)) {
                files.add(baseDir.resolve(pattern).toAbsolutePath().normalize());
                continue;
            }
            if (!Files.isDirectory(baseDir)) {
                continue;
            }
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            try (Stream<Path> walk = Files.walk(baseDir)) {
                files.addAll(walk
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(baseDir.relativize(p)))
                    .map(p -> p.toAbsolutePath().normalize())
                    .collect(Collectors.toList()));
            }
        }
        return List.copyOf(files);
    }

    private static boolean isGlob(String pattern) {
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return true;
            }
        }
        return false;
    }
}
