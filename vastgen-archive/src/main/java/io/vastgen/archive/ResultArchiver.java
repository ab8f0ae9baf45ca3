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

import io.vastgen.status.ProgressSink;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregates a run's result objects into one {@code .tar.gz} archive.
 *
 * <p>Entries are named {@code <run id>/<variant id>/<path below the variant prefix>}, so
 * archives of different runs never collide when unpacked side by side. Objects are
 * streamed from the store into the archive one at a time; nothing is buffered per run.
 *
 * <p>Archives are written to a temporary file next to the target and moved into place
 * only when complete. A failed call leaves any earlier archive at the target untouched,
 * and archiving the same run again replaces the archive with identical contents.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ResultArchiver archiver = new ResultArchiver(S3ObjectStore.connect(S3Settings.fromEnvironment(), "results"));
 * List<ObjectRef> refs = archiver.collect(report.getRunId(), report.getSucceeded());
 * // failures are not fatal for a finished run: leave unreadable objects out
 * archiver.archive(report.getRunId(), refs, Path.of("run.tar.gz"), FailurePolicy.SKIP_UNREADABLE);
 * }</pre>
 */
public class ResultArchiver {

    private static final Logger logger = LogManager.getLogger(ResultArchiver.class);

    private final ObjectStore store;

    public ResultArchiver(ObjectStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public ObjectStore getStore() {
        return store;
    }

    /**
     * Lists the result objects of the given variants.
     *
     * @param runId the run
     * @param variantIds the variants whose results to include, typically the succeeded ones
     * @return object references ordered by variant id, then key
     * @throws IOException if the store could not be listed
     */
    public List<ObjectRef> collect(String runId, Collection<String> variantIds) throws IOException {
        List<ObjectRef> refs = new ArrayList<>();
        for (String variantId : new TreeSet<>(variantIds)) {
            refs.addAll(store.list(runId + "/" + variantId + "/"));
        }
        logger.debug("Collected {} object(s) for {} variant(s) of run {}", refs.size(), variantIds.size(), runId);
        return refs;
    }

    /**
     * Lists every result object of a run, regardless of variant.
     *
     * @param runId the run
     * @return object references ordered by key
     * @throws IOException if the store could not be listed
     */
    public List<ObjectRef> collectRun(String runId) throws IOException {
        return store.list(runId + "/");
    }

    public ArchiveResult archive(String runId, List<ObjectRef> refs, Path archivePath, FailurePolicy policy)
        throws ArchiveIOException {
        return archive(runId, refs, archivePath, policy, ProgressSink.none());
    }

    /**
     * Writes the archive.
     *
     * <p>An object that cannot be opened is handled per {@code policy}. An object that fails
     * after its content has started streaming always fails the archive, since the tar
     * stream cannot be repaired.
     *
     * @param runId the run; the archive's top-level directory
     * @param refs the objects to include, in archive order
     * @param archivePath where to write; replaced if present
     * @param policy what to do with objects that cannot be opened
     * @param sink receives one message per archived object
     * @return what was written
     * @throws ArchiveIOException if the archive could not be completed; the target is then unchanged
     * @throws IllegalArgumentException if two references map to the same entry name
     */
    public ArchiveResult archive(String runId, List<ObjectRef> refs, Path archivePath, FailurePolicy policy,
                                 ProgressSink sink) throws ArchiveIOException {
        Objects.requireNonNull(policy, "policy");
        String root = runId + "/";
        List<String> names = entryNames(root, refs);

        Path target = archivePath.toAbsolutePath();
        Path tmp = null;
        List<String> written = new ArrayList<>();
        List<ObjectRef> skipped = new ArrayList<>();
        long bytes = 0;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(tmp));
                 GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(file);
                 TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
                tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
                tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

                TarArchiveEntry dir = new TarArchiveEntry(root);
                dir.setModTime(0L);
                tar.putArchiveEntry(dir);
                tar.closeArchiveEntry();

                for (int i = 0; i < refs.size(); i++) {
                    ObjectRef ref = refs.get(i);
                    InputStream in;
                    try {
                        in = store.open(ref);
                    } catch (IOException e) {
                        if (policy == FailurePolicy.FAIL_FAST) {
                            throw new ArchiveIOException("cannot read " + ref + ": " + e.getMessage(), ref, e);
                        }
                        logger.warn("Skipping unreadable object {}: {}", ref, e.getMessage());
                        skipped.add(ref);
                        continue;
                    }
                    try (InputStream content = in) {
                        bytes += append(tar, names.get(i), ref, content);
                    } catch (IOException e) {
                        throw new ArchiveIOException("failed while archiving " + ref + ": " + e.getMessage(), ref, e);
                    }
                    written.add(names.get(i));
                    sink.progress("Archived " + names.get(i));
                }
                tar.finish();
            }
            moveIntoPlace(tmp, target);
            tmp = null;
        } catch (ArchiveIOException e) {
            throw e;
        } catch (IOException e) {
            throw new ArchiveIOException("could not write archive " + target + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }
        logger.info("Archived {} object(s) of run {} to {} ({} skipped)", written.size(), runId, target, skipped.size());
        return new ArchiveResult(target, written, skipped, bytes);
    }

    private static long append(TarArchiveOutputStream tar, String name, ObjectRef ref, InputStream content)
        throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(ref.getSize());
        entry.setModTime(Date.from(ref.getLastModified()));
        tar.putArchiveEntry(entry);
        long copied = IOUtils.copyLarge(content, tar);
        if (copied != ref.getSize()) {
            throw new IOException("object changed while archiving: listed " + ref.getSize() + " bytes, read " + copied);
        }
        tar.closeArchiveEntry();
        return copied;
    }

    /// Keys already under the run's namespace keep their path; others are placed beneath it.
    static String entryName(String root, ObjectRef ref) {
        return ref.getKey().startsWith(root) ? ref.getKey() : root + ref.getKey();
    }

    private static List<String> entryNames(String root, List<ObjectRef> refs) {
        List<String> names = new ArrayList<>(refs.size());
        Set<String> seen = new HashSet<>();
        for (ObjectRef ref : refs) {
            String name = entryName(root, ref);
            if (!seen.add(name)) {
                throw new IllegalArgumentException("two objects map to archive entry " + name);
            }
            names.add(name);
        }
        return names;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary archive {}: {}", tmp, e.getMessage());
        }
    }
}
