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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * A {@link ContentCache} backed by a directory tree.
 *
 * <p>Layout: {@code <root>/<logical name>/<key>.payload} holds the artifact and
 * {@code <root>/<logical name>/<key>.meta.json} describes it. Both files are written to a
 * temporary sibling first and renamed into place, payload before metadata, so an entry
 * only becomes visible once it is complete. A reader that races with a replacement sees
 * a CRC mismatch and treats it as a miss.
 */
public class DirectoryContentCache implements ContentCache {
    private static final Logger logger = LogManager.getLogger(DirectoryContentCache.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private static final Pattern LOGICAL_NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9._-]*");

    static final String PAYLOAD_SUFFIX = ".payload";
    static final String META_SUFFIX = ".meta.json";

    private final Path root;

    public DirectoryContentCache(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Optional<CacheEntry> lookup(CacheKey key, String logicalName) {
        Optional<CacheMetadata> meta = validMetadata(key, logicalName);
        if (meta.isEmpty()) {
            return Optional.empty();
        }
        Path payloadPath = payloadPath(key, logicalName);
        byte[] payload;
        try {
            payload = Files.readAllBytes(payloadPath);
        } catch (IOException e) {
            logger.warn("cache miss for {}/{}: unable to read payload: {}", logicalName, key, e.toString());
            return Optional.empty();
        }
        if (payload.length != meta.get().payloadLength || crc32(payload) != meta.get().payloadCrc32) {
            logger.warn("cache miss for {}/{}: payload does not match its recorded length or checksum",
                logicalName, key);
            return Optional.empty();
        }
        logger.debug("cache hit for {}/{}", logicalName, key);
        return Optional.of(new CacheEntry(key, logicalName, payload, payloadPath,
            Instant.ofEpochMilli(meta.get().created)));
    }

    @Override
    public boolean contains(CacheKey key, String logicalName) {
        return validMetadata(key, logicalName).isPresent()
            && Files.isRegularFile(payloadPath(key, logicalName));
    }

    @Override
    public void store(CacheKey key, String logicalName, byte[] payload) {
        checkLogicalName(logicalName);
        Path dir = root.resolve(logicalName);

        CacheMetadata meta = new CacheMetadata();
        meta.version = CacheMetadata.FORMAT_VERSION;
        meta.key = key.getValue();
        meta.logicalName = logicalName;
        List<CacheMetadata.Stamp> stamps = new ArrayList<>();
        for (FileStamp stamp : key.getStamps()) {
            stamps.add(new CacheMetadata.Stamp(stamp));
        }
        meta.inputs = stamps;
        meta.payloadLength = payload.length;
        meta.payloadCrc32 = crc32(payload);
        meta.created = System.currentTimeMillis();

        try {
            Files.createDirectories(dir);
            writeAtomically(dir, payloadPath(key, logicalName), payload);
            writeAtomically(dir, metaPath(key, logicalName),
                GSON.toJson(meta).getBytes(StandardCharsets.UTF_8));
            logger.debug("stored {}/{} ({} bytes)", logicalName, key, payload.length);
        } catch (IOException e) {
            logger.warn("unable to store cache entry {}/{} under {}: {}", logicalName, key, root, e.toString());
        }
    }

    private Optional<CacheMetadata> validMetadata(CacheKey key, String logicalName) {
        checkLogicalName(logicalName);
        Path metaPath = metaPath(key, logicalName);
        if (!Files.isRegularFile(metaPath)) {
            logger.debug("cache miss for {}/{}: no entry", logicalName, key);
            return Optional.empty();
        }

        CacheMetadata meta;
        try (Reader reader = Files.newBufferedReader(metaPath, StandardCharsets.UTF_8)) {
            meta = GSON.fromJson(reader, CacheMetadata.class);
        } catch (IOException | JsonParseException e) {
            logger.warn("cache miss for {}/{}: unreadable metadata {}: {}", logicalName, key, metaPath, e.toString());
            return Optional.empty();
        }
        if (meta == null || meta.version != CacheMetadata.FORMAT_VERSION) {
            logger.warn("cache miss for {}/{}: unsupported metadata format", logicalName, key);
            return Optional.empty();
        }
        if (!key.getValue().equals(meta.key) || !logicalName.equals(meta.logicalName)) {
            logger.warn("cache miss for {}/{}: metadata describes a different entry", logicalName, key);
            return Optional.empty();
        }
        if (meta.inputs == null) {
            return Optional.empty();
        }
        for (CacheMetadata.Stamp recorded : meta.inputs) {
            if (recorded == null || recorded.path == null) {
                logger.warn("cache miss for {}/{}: metadata {} has an incomplete input stamp", logicalName, key, metaPath);
                return Optional.empty();
            }
            boolean current;
            try {
                current = recorded.toFileStamp().isCurrent();
            } catch (RuntimeException e) {
                logger.warn("cache miss for {}/{}: cannot check input {}: {}", logicalName, key, recorded.path, e.toString());
                return Optional.empty();
            }
            if (!current) {
                logger.debug("cache miss for {}/{}: input changed since store: {}", logicalName, key, recorded.path);
                return Optional.empty();
            }
        }
        return Optional.of(meta);
    }

    private static void writeAtomically(Path dir, Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    Path payloadPath(CacheKey key, String logicalName) {
        return root.resolve(logicalName).resolve(key.getValue() + PAYLOAD_SUFFIX);
    }

    Path metaPath(CacheKey key, String logicalName) {
        return root.resolve(logicalName).resolve(key.getValue() + META_SUFFIX);
    }

    private static void checkLogicalName(String logicalName) {
        if (logicalName == null || !LOGICAL_NAME.matcher(logicalName).matches()) {
            throw new IllegalArgumentException("Invalid cache entry name: '" + logicalName + "'");
        }
    }

    private static long crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return crc.getValue();
    }

    @Override
    public String toString() {
        return "DirectoryContentCache[" + root + "]";
    }
}
