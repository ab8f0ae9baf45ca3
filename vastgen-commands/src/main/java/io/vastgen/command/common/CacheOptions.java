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


package io.vastgen.command.common;

import io.vastgen.cache.ContentCache;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/// Cache location options shared by commands that generate variants.
public class CacheOptions {

    @Option(names = {"--cache-dir"},
        description = "Cache directory (default: .cache next to the specification)")
    Path cacheDir;

    @Option(names = {"--no-cache"},
        description = "Always regenerate and store nothing; takes precedence over --cache-dir")
    boolean noCache;

    /**
     * @param specFile the specification being processed
     * @return the cache these options select
     */
    public ContentCache open(Path specFile) {
        if (noCache) {
            return ContentCache.disabled();
        }
        if (cacheDir != null) {
            return ContentCache.atDirectory(cacheDir);
        }
        Path parent = specFile.toAbsolutePath().getParent();
        return ContentCache.atDirectory(ContentCache.defaultDirectory(parent));
    }
}
