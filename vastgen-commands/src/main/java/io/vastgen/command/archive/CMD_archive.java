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


package io.vastgen.command.archive;

import io.vastgen.archive.ArchiveIOException;
import io.vastgen.archive.ArchiveResult;
import io.vastgen.archive.FailurePolicy;
import io.vastgen.archive.LocalObjectStore;
import io.vastgen.archive.ObjectRef;
import io.vastgen.archive.ObjectStore;
import io.vastgen.archive.ResultArchiver;
import io.vastgen.archive.S3ObjectStore;
import io.vastgen.archive.S3Settings;
import io.vastgen.command.ExitCodes;
import io.vastgen.command.common.Progress;
import io.vastgen.status.ProgressSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Archives the stored results of an earlier run. Useful when archiving failed after a run,
 * or to re-archive; repeated calls replace the archive with identical contents.
 */
@Command(name = "archive",
    description = "Archive the stored results of a run into one .tar.gz")
public class CMD_archive implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_archive.class);

    @Parameters(index = "0", description = "Run identifier")
    private String runId;

    @Option(names = {"-o", "--output"}, required = true, description = "Archive file to write")
    private Path output;

    @Option(names = {"--variant"}, description = "Only these variants (repeatable; default: every variant of the run)")
    private List<String> variants = new ArrayList<>();

    @Option(names = {"--skip-unreadable"},
        description = "Leave unreadable objects out instead of failing")
    private boolean skipUnreadable;

    @Option(names = {"--bucket"}, defaultValue = "results", description = "Result bucket (default: ${DEFAULT-VALUE})")
    private String bucket;

    @Option(names = {"--from-dir"}, description = "Read results from a local directory instead of S3")
    private Path fromDir;

    @Override
    public Integer call() {
        ObjectStore store = fromDir != null
            ? new LocalObjectStore(fromDir)
            : S3ObjectStore.connect(S3Settings.fromEnvironment(), bucket);
        ResultArchiver archiver = new ResultArchiver(store);
        FailurePolicy policy = skipUnreadable ? FailurePolicy.SKIP_UNREADABLE : FailurePolicy.FAIL_FAST;
        ProgressSink sink = Progress.toLog();
        try {
            List<ObjectRef> refs = variants.isEmpty() ? archiver.collectRun(runId) : archiver.collect(runId, variants);
            ArchiveResult result = archiver.archive(runId, refs, output, policy, sink);
            System.out.println("Archive " + result.getPath() + ": " + result.getEntries().size() + " objects, "
                + result.getSkipped().size() + " skipped");
            return ExitCodes.SUCCESS;
        } catch (ArchiveIOException e) {
            logger.error("Archiving run {} failed: {}", runId, e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            logger.error("Could not list results of run {}: {}", runId, e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
