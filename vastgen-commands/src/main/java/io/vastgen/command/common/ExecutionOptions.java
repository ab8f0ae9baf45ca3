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

import io.vastgen.variation.spec.ExecutionSettings;
import picocli.CommandLine.Option;

import java.time.Duration;

/// Command line overrides for the `execution:` section of a specification. Options left
/// unset keep the document's value.
public class ExecutionOptions {

    @Option(names = {"-c", "--concurrency"}, description = "Most jobs running at once")
    Integer concurrencyLimit;

    @Option(names = {"--max-attempts"}, description = "Attempts per variant before it is recorded as failed")
    Integer maxAttempts;

    @Option(names = {"--job-timeout"}, converter = DurationConverter.class,
        description = "Wall-clock budget of a running job (ISO-8601 or seconds)")
    Duration jobTimeout;

    @Option(names = {"--start-timeout"}, converter = DurationConverter.class,
        description = "How long a job may wait to start (ISO-8601 or seconds)")
    Duration startTimeout;

    @Option(names = {"--poll-interval"}, converter = DurationConverter.class,
        description = "Delay between status polls (ISO-8601 or seconds)")
    Duration pollInterval;

    @Option(names = {"-n", "--namespace"}, description = "Kubernetes namespace")
    String namespace;

    @Option(names = {"--image"}, description = "Container image running each variant")
    String image;

    @Option(names = {"--bucket"}, description = "Bucket jobs write their results to")
    String bucket;

    @Option(names = {"--cancel-running-on-abort"}, negatable = true,
        description = "Delete running jobs when the run is interrupted")
    Boolean cancelRunningOnAbort;

    /**
     * @param base settings from the specification document
     * @return base with every given option applied
     * @throws IllegalArgumentException if an override is out of range
     */
    public ExecutionSettings applyTo(ExecutionSettings base) {
        ExecutionSettings.Builder b = base.toBuilder();
        if (concurrencyLimit != null) b.concurrencyLimit(concurrencyLimit);
        if (maxAttempts != null) b.maxAttempts(maxAttempts);
        if (jobTimeout != null) b.jobTimeout(jobTimeout);
        if (startTimeout != null) b.startTimeout(startTimeout);
        if (pollInterval != null) b.pollInterval(pollInterval);
        if (namespace != null) b.namespace(namespace);
        if (image != null) b.image(image);
        if (bucket != null) b.bucket(bucket);
        if (cancelRunningOnAbort != null) b.cancelRunningOnAbort(cancelRunningOnAbort);
        return b.build();
    }
}
