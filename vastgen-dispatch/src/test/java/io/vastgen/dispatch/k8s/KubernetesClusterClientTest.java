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


package io.vastgen.dispatch.k8s;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobSpec;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.vastgen.dispatch.ClusterException;
import io.vastgen.dispatch.ClusterHandle;
import io.vastgen.dispatch.ClusterJobStatus;
import io.vastgen.dispatch.JobDescriptor;
import io.vastgen.dispatch.ResultLocation;
import io.vastgen.variation.spec.ExecutionSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnableKubernetesMockClient(crud = true)
class KubernetesClusterClientTest {

    KubernetesClient client;

    private static ExecutionSettings settings() {
        return ExecutionSettings.builder()
            .namespace("sims")
            .image("registry.local/scenario:1")
            .command(List.of("/run.sh"))
            .cpu("2")
            .memory("4Gi")
            .build();
    }

    private static JobDescriptor descriptor(String runId, String variantId, int attempt, ExecutionSettings settings) {
        return new JobDescriptor(runId, variantId, attempt, runId + "-" + variantId + "-" + attempt,
            Map.of("speed", 2.5), ResultLocation.of("results", runId, variantId), settings);
    }

    @Test
    void submitCreatesASingleAttemptJob() throws ClusterException {
        KubernetesClusterClient cluster = new KubernetesClusterClient(client);

        ClusterHandle handle = cluster.submit(descriptor("run-1", "v0", 1, settings()));

        assertThat(handle).isEqualTo(new ClusterHandle("sims", "run-1-v0-1"));
        Job job = client.batch().v1().jobs().inNamespace("sims").withName("run-1-v0-1").get();
        assertThat(job).isNotNull();
        assertThat(job.getMetadata().getLabels())
            .containsEntry(KubernetesClusterClient.JOBGROUP_LABEL, KubernetesClusterClient.JOBGROUP)
            .containsEntry(KubernetesClusterClient.RUN_ID_LABEL, "run-1")
            .containsEntry(KubernetesClusterClient.VARIANT_ID_LABEL, "v0");
        JobSpec spec = job.getSpec();
        assertThat(spec.getBackoffLimit()).isZero();
        assertThat(spec.getTemplate().getSpec().getRestartPolicy()).isEqualTo("Never");
        Container container = spec.getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getImage()).isEqualTo("registry.local/scenario:1");
        assertThat(container.getCommand()).containsExactly("/run.sh");
        assertThat(container.getResources().getLimits()).containsEntry("memory", new Quantity("4Gi"));
        Map<String, String> env = container.getEnv().stream()
            .collect(Collectors.toMap(EnvVar::getName, EnvVar::getValue));
        assertThat(env).containsEntry("VARIANT_ID", "v0")
            .containsEntry("PARAM_SPEED", "2.5")
            .containsEntry("RESULT_LOCATION", "s3://results/run-1/v0/");
    }

    @Test
    void submitWithoutImageIsRejected() {
        KubernetesClusterClient cluster = new KubernetesClusterClient(client);
        ExecutionSettings noImage = ExecutionSettings.builder().namespace("sims").build();

        assertThatThrownBy(() -> cluster.submit(descriptor("run-1", "v0", 1, noImage)))
            .isInstanceOf(ClusterException.class)
            .hasMessageContaining("image");
    }

    @Test
    void freshJobIsPendingAndVanishedJobHasFailed() throws ClusterException {
        KubernetesClusterClient cluster = new KubernetesClusterClient(client);
        ClusterHandle handle = cluster.submit(descriptor("run-1", "v0", 1, settings()));

        assertThat(cluster.poll(handle)).isEqualTo(ClusterJobStatus.PENDING);
        assertThat(cluster.poll(new ClusterHandle("sims", "does-not-exist"))).isEqualTo(ClusterJobStatus.FAILED);
    }

    @Test
    void cancelDeletesTheJob() throws ClusterException {
        KubernetesClusterClient cluster = new KubernetesClusterClient(client);
        ClusterHandle handle = cluster.submit(descriptor("run-1", "v0", 1, settings()));

        cluster.cancel(handle);

        assertThat(client.batch().v1().jobs().inNamespace("sims").withName("run-1-v0-1").get()).isNull();
        assertThat(cluster.poll(handle)).isEqualTo(ClusterJobStatus.FAILED);
    }

    @Test
    void cleanupRemovesOnlyTheGivenRun() throws ClusterException {
        KubernetesClusterClient cluster = new KubernetesClusterClient(client);
        cluster.submit(descriptor("run-1", "v0", 1, settings()));
        cluster.submit(descriptor("run-1", "v1", 1, settings()));
        cluster.submit(descriptor("run-2", "v0", 1, settings()));

        int removed = cluster.cleanupRun("sims", "run-1");

        assertThat(removed).isEqualTo(2);
        assertThat(client.batch().v1().jobs().inNamespace("sims").list().getItems())
            .extracting(j -> j.getMetadata().getName())
            .containsExactly("run-2-v0-1");
    }

    @Test
    void statusMapping() {
        assertThat(KubernetesClusterClient.stateOf(new JobBuilder().build())).isEqualTo(ClusterJobStatus.PENDING);
        assertThat(KubernetesClusterClient.stateOf(withStatus(1, 1, null, null))).isEqualTo(ClusterJobStatus.RUNNING);
        assertThat(KubernetesClusterClient.stateOf(withStatus(null, null, 1, null))).isEqualTo(ClusterJobStatus.SUCCEEDED);
        assertThat(KubernetesClusterClient.stateOf(withStatus(null, null, null, 1))).isEqualTo(ClusterJobStatus.FAILED);
        assertThat(KubernetesClusterClient.stateOf(withStatus(0, 0, 0, 0))).isEqualTo(ClusterJobStatus.PENDING);
        Job deadlineExceeded = new JobBuilder().withNewStatus()
            .addNewCondition().withType("Failed").withStatus("True").withReason("DeadlineExceeded").endCondition()
            .endStatus().build();
        assertThat(KubernetesClusterClient.stateOf(deadlineExceeded)).isEqualTo(ClusterJobStatus.FAILED);
    }

    @Test
    void activeButUnscheduledPodIsStillPending() {
        assertThat(KubernetesClusterClient.stateOf(withStatus(1, 0, null, null))).isEqualTo(ClusterJobStatus.PENDING);
        assertThat(KubernetesClusterClient.stateOf(withStatus(1, null, null, null))).isEqualTo(ClusterJobStatus.PENDING);
    }

    private static Job withStatus(Integer active, Integer ready, Integer succeeded, Integer failed) {
        return new JobBuilder().withNewStatus()
            .withActive(active)
            .withReady(ready)
            .withSucceeded(succeeded)
            .withFailed(failed)
            .endStatus()
            .build();
    }
}
