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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes {@link CacheKey}s over input file metadata and auxiliary strings.
 *
 * <p>The key is SHA-256 truncated to 128 bits over a canonical serialization:
 * <ol>
 *   <li>each file, sorted by absolute normalized path, as {@code path \0 size \0 mtimeNanos \0}</li>
 *   <li>a separator byte</li>
 *   <li>each string, sorted, as a 4-byte length followed by its UTF-8 bytes</li>
 * </ol>
 *
 * <p>Only size and modification time are considered, never file content. Computing a key
 * is therefore proportional to the number of files rather than their total size. A file
 * rewritten with identical size inside the filesystem's timestamp resolution keeps its
 * old key; this is an accepted limitation.
 */
public final class CacheKeys {
    private static final Logger logger = LogManager.getLogger(CacheKeys.class);

    private static final int KEY_BYTES = 16;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private CacheKeys() {
    }

    /**
     * Computes a key from files and strings. Enumeration order of either collection does not
     * affect the result; duplicate paths are counted once.
     *
     * @param files input files, which need not exist
     * @param strings auxiliary strings such as command lines or document digests
     * @return the key
     * @throws UncheckedIOException if a file exists but its attributes cannot be read
     */
    public static CacheKey compute(Collection<Path> files, Collection<String> strings) {
        TreeSet<FileStamp> stamps = new TreeSet<>();
        for (Path file : files) {
            try {
                stamps.add(FileStamp.of(file));
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to stat cache input " + file, e);
            }
        }
        return compute(new ArrayList<>(stamps), strings);
    }

    /**
     * Computes a key from already taken stamps.
     *
     * @param stamps file stamps in any order
     * @param strings auxiliary strings
     * @return the key
     */
    public static CacheKey compute(List<FileStamp> stamps, Collection<String> strings) {
        List<FileStamp> sortedStamps = new ArrayList<>(new TreeSet<>(stamps));
        List<String> sortedStrings = new ArrayList<>(strings);
        Collections.sort(sortedStrings);

        MessageDigest digest = sha256();
        for (FileStamp stamp : sortedStamps) {
            digest.update(stamp.getPath().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(Long.toString(stamp.getSize()).getBytes(StandardCharsets.US_ASCII));
            digest.update((byte) 0);
            digest.update(Long.toString(stamp.getMtimeNanos()).getBytes(StandardCharsets.US_ASCII));
            digest.update((byte) 0);
        }
        digest.update((byte) 0x1e);
        for (String s : sortedStrings) {
            byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
            digest.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
            digest.update(bytes);
        }

        String value = toHex(digest.digest(), KEY_BYTES);
        logger.debug("computed cache key {} over {} file(s) and {} string(s)",
            value, sortedStamps.size(), sortedStrings.size());
        return new CacheKey(value, sortedStamps);
    }

    /**
     * @param bytes source bytes
     * @param length number of leading bytes to render
     * @return lowercase hex
     */
    public static String toHex(byte[] bytes, int length) {
        char[] out = new char[length * 2];
        for (int i = 0; i < length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
