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


package io.vastgen.command.run;

import io.vastgen.archive.ArchiveIOException;
import io.vastgen.archive.ArchiveResult;
import io.vastgen.archive.FailurePolicy;
import io.vastgen.archive.ObjectRef;
import io.vastgen.archive.ResultArchiver;
import io.vastgen.dispatch.ClusterJobDispatcher;
import io.vastgen.dispatch.Run;
import io.vastgen.dispatch.RunHandle;
import io.vastgen.dispatch.RunReport;
import io.vastgen.status.ProgressSink;
import io.vastgen.variation.Variant;
import io.vastgen.variation.VariantGenerator;
import io.vastgen.variation.spec.ExecutionSettings;
import io.vastgen.variation.spec.VariationSpecification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Generate, dispatch, then archive: the sequence behind {@code vastgen run}.
 *
 * <p>Specification and generation errors propagate before anything is submitted. Job
 * failures arrive only in the report. An archive failure is captured in the result next
 * to the report, since the job results it was reading remain in object storage.
 */
public class RunPipeline {
    private static final Logger logger = LogManager.getLogger(RunPipeline.class);

    private final VariantGenerator generator;
    private final ClusterJobDispatcher dispatcher;
    private final ResultArchiver archiver;
    private Consumer<RunHandle> onStart = h -> { };

    /**
     * @param archiver the archiver, or null when the run is not archived
     */
    public RunPipeline(VariantGenerator generator, ClusterJobDispatcher dispatcher, ResultArchiver archiver) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.archiver = archiver;
    }

    /// Registers a callback that receives the run handle once dispatch starts, e.g. to cancel on shutdown.
    public RunPipeline onStart(Consumer<RunHandle> onStart) {
        this.onStart = Objects.requireNonNull(onStart, "onStart");
        return this;
    }

    /**
     * @param spec the parsed specification
     * @param settings execution settings after command line overrides
     * @param runId the run identifier
     * @param archivePath where to write the archive; ignored without an archiver
     * @param policy unreadable-object policy for the archive
     * @param sink progress for generation and dispatch
     * @return the report, and the archive outcome when one was requested
     * @throws InterruptedException if interrupted while the run is in progress
     */
    public Result execute(VariationSpecification spec, ExecutionSettings settings, String runId,
                          Path archivePath, FailurePolicy policy, ProgressSink sink) throws InterruptedException {
        List<Variant> variants = generator.generate(spec, sink);
        Run run = new Run(runId, variants, settings);

        RunHandle handle = dispatcher.start(run, settings.getConcurrencyLimit(), sink);
        onStart.accept(handle);
        RunReport report;
        try {
            report = handle.await();
        } catch (InterruptedException e) {
            handle.cancel(settings.isCancelRunningOnAbort());
            throw e;
        }
        logger.info("Run {} finished: {} succeeded, {} failed, {} cancelled", runId,
            report.getSucceeded().size(), report.getFailed().size(), report.getCancelled().size());

        if (archiver == null || archivePath == null) {
            return new Result(report, null, null);
        }
        try {
            List<ObjectRef> refs;
            try {
                refs = archiver.collect(runId, report.getSucceeded());
            } catch (IOException e) {
                throw new ArchiveIOException("could not list results of run " + runId + ": " + e.getMessage(), e);
            }
            ArchiveResult archive = archiver.archive(runId, refs, archivePath, policy, sink);
            return new Result(report, archive, null);
        } catch (ArchiveIOException e) {
            logger.error("Archiving run {} failed: {}", runId, e.getMessage());
            return new Result(report, null, e);
        }
    }

    /// What a pipeline execution produced.
    public static final class Result {
        private final RunReport report;
        private final ArchiveResult archive;
        private final ArchiveIOException archiveFailure;

        Result(RunReport report, ArchiveResult archive, ArchiveIOException archiveFailure) {
            this.report = report;
            this.archive = archive;
            this.archiveFailure = archiveFailure;
        }

        public RunReport getReport() {
            return report;
        }

        public Optional<ArchiveResult> getArchive() {
            return Optional.ofNullable(archive);
        }

        public Optional<ArchiveIOException> getArchiveFailure() {
            return Optional.ofNullable(archiveFailure);
        }
    }
}
