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

import io.vastgen.archive.FailurePolicy;
import io.vastgen.archive.ResultArchiver;
import io.vastgen.archive.S3ObjectStore;
import io.vastgen.archive.S3Settings;
import io.vastgen.command.ExitCodes;
import io.vastgen.command.common.CacheOptions;
import io.vastgen.command.common.ExecutionOptions;
import io.vastgen.command.common.Progress;
import io.vastgen.dispatch.ClusterClient;
import io.vastgen.dispatch.ClusterException;
import io.vastgen.dispatch.ClusterJobDispatcher;
import io.vastgen.dispatch.Run;
import io.vastgen.dispatch.RunHandle;
import io.vastgen.dispatch.RunReport;
import io.vastgen.dispatch.k8s.KubernetesClusterClient;
import io.vastgen.variation.GenerationException;
import io.vastgen.variation.VariantGenerator;
import io.vastgen.variation.distribution.InvalidDistributionException;
import io.vastgen.variation.spec.ExecutionSettings;
import io.vastgen.variation.spec.SpecParseException;
import io.vastgen.variation.spec.VariationSpecification;
import io.vastgen.variation.spec.VariationSpecificationParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Generates the variants of a specification, runs each as a Kubernetes Job and optionally
 * archives the results. Exits 0 when every variant succeeded, 1 when some failed, and 2
 * when the specification, generation or archive step failed.
 */
@Command(name = "run",
    description = "Run every variant of a specification on the cluster")
public class CMD_run implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_run.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @Parameters(index = "0", description = "Variation specification file")
    private Path specFile;

    @Option(names = {"--run-id"}, description = "Run identifier (default: run-<UTC timestamp>)")
    private String runId;

    @Option(names = {"--archive"}, description = "Write the succeeded variants' results to this .tar.gz")
    private Path archivePath;

    @Option(names = {"--skip-unreadable"},
        description = "Leave unreadable result objects out of the archive instead of failing it")
    private boolean skipUnreadable;

    @Option(names = {"--cleanup"}, description = "Delete the run's Jobs from the cluster when it finishes")
    private boolean cleanup;

    @Option(names = {"--json"}, description = "Print the completion report as JSON")
    private boolean json;

    @Mixin
    private CacheOptions cacheOptions = new CacheOptions();

    @Mixin
    private ExecutionOptions executionOptions = new ExecutionOptions();

    @Override
    public Integer call() {
        VariationSpecification spec;
        ExecutionSettings settings;
        try {
            spec = new VariationSpecificationParser().load(specFile);
            settings = executionOptions.applyTo(spec.getExecution());
        } catch (SpecParseException | InvalidDistributionException | IllegalArgumentException e) {
            logger.error("Invalid specification {}: {}", specFile, e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            logger.error("Could not read {}: {}", specFile, e.getMessage());
            return ExitCodes.ERROR;
        }
        String id = runId != null ? runId : Run.defaultRunId(Clock.systemUTC());

        try (KubernetesClusterClient cluster = KubernetesClusterClient.fromEnvironment()) {
            int code = execute(spec, settings, id, cluster);
            if (cleanup) {
                cleanup(cluster, settings.getNamespace(), id);
            }
            return code;
        }
    }

    int execute(VariationSpecification spec, ExecutionSettings settings, String id, ClusterClient cluster) {
        ResultArchiver archiver = archivePath == null
            ? null
            : new ResultArchiver(S3ObjectStore.connect(S3Settings.fromEnvironment(), settings.getBucket()));
        RunPipeline pipeline = new RunPipeline(
            new VariantGenerator(cacheOptions.open(specFile)), new ClusterJobDispatcher(cluster), archiver)
            .onStart(handle -> cancelOnShutdown(handle, settings.isCancelRunningOnAbort()));
        FailurePolicy policy = skipUnreadable ? FailurePolicy.SKIP_UNREADABLE : FailurePolicy.FAIL_FAST;

        RunPipeline.Result result;
        try {
            result = pipeline.execute(spec, settings, id, archivePath, policy, Progress.toLog());
        } catch (GenerationException | InvalidDistributionException | IllegalArgumentException e) {
            logger.error("Could not start run {} from {}: {}", id, specFile, e.getMessage());
            return ExitCodes.ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while run {} was in progress", id);
            return ExitCodes.ERROR;
        }

        RunReport report = result.getReport();
        System.out.println(json ? report.toJson() : report.summary());
        result.getArchive().ifPresent(a -> System.out.println("Archive " + a.getPath() + ": "
            + a.getEntries().size() + " objects, " + a.getSkipped().size() + " skipped"));
        if (result.getArchiveFailure().isPresent()) {
            return ExitCodes.ERROR;
        }
        return report.isAllSucceeded() ? ExitCodes.SUCCESS : ExitCodes.VARIANTS_FAILED;
    }

    private static void cancelOnShutdown(RunHandle handle, boolean cancelRunning) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (handle.isDone()) {
                return;
            }
            logger.warn("Shutting down: cancelling run {}", handle.getRun().getRunId());
            handle.cancel(cancelRunning);
            try {
                handle.await(SHUTDOWN_GRACE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "vastgen-shutdown"));
    }

    private static void cleanup(KubernetesClusterClient cluster, String namespace, String id) {
        try {
            cluster.cleanupRun(namespace, id);
        } catch (ClusterException e) {
            logger.warn("Could not remove jobs of run {}: {}", id, e.getMessage());
        }
    }
}
