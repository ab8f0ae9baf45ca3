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


package io.vastgen.command.cleanup;

import io.vastgen.command.ExitCodes;
import io.vastgen.dispatch.ClusterException;
import io.vastgen.dispatch.k8s.KubernetesClusterClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/// Removes the Jobs a run left in the cluster.
@Command(name = "cleanup",
    description = "Delete a run's Jobs from the cluster")
public class CMD_cleanup implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_cleanup.class);

    @Parameters(index = "0", description = "Run identifier")
    private String runId;

    @Option(names = {"-n", "--namespace"}, defaultValue = "default", description = "Namespace (default: ${DEFAULT-VALUE})")
    private String namespace;

    @Override
    public Integer call() {
        try (KubernetesClusterClient cluster = KubernetesClusterClient.fromEnvironment()) {
            int removed = cluster.cleanupRun(namespace, runId);
            System.out.println("Removed " + removed + " job(s) of run " + runId);
            return ExitCodes.SUCCESS;
        } catch (ClusterException e) {
            logger.error("{}", e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
