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

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.JobCondition;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.vastgen.dispatch.ClusterClient;
import io.vastgen.dispatch.ClusterException;
import io.vastgen.dispatch.ClusterHandle;
import io.vastgen.dispatch.ClusterJobStatus;
import io.vastgen.dispatch.JobDescriptor;
import io.vastgen.dispatch.JobNames;
import io.vastgen.variation.spec.ExecutionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs variants as Kubernetes {@code batch/v1} Jobs through the fabric8 client.
 *
 * <p>Each attempt is its own Job with {@code backoffLimit: 0} and restart policy
 * {@code Never}; retrying is left to the dispatcher. Jobs carry the labels
 * {@code jobgroup=scenario-runs}, {@code run-id} and {@code variant-id} so that a run's
 * left-overs can be found and removed with {@link #cleanupRun(String, String)}.
 */
public class KubernetesClusterClient implements ClusterClient, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(KubernetesClusterClient.class);

    public static final String JOBGROUP_LABEL = "jobgroup";
    public static final String JOBGROUP = "scenario-runs";
    public static final String RUN_ID_LABEL = "run-id";
    public static final String VARIANT_ID_LABEL = "variant-id";
    public static final String CONTAINER_NAME = "scenario";

    private final KubernetesClient client;
    private final boolean ownsClient;

    /**
     * Uses a caller-managed client; {@link #close()} leaves it open.
     */
    public KubernetesClusterClient(KubernetesClient client) {
        this(client, false);
    }

    private KubernetesClusterClient(KubernetesClient client, boolean ownsClient) {
        this.client = Objects.requireNonNull(client, "client");
        this.ownsClient = ownsClient;
    }

    /**
     * @return a client configured from the environment: kubeconfig, or the in-cluster service account
     */
    public static KubernetesClusterClient fromEnvironment() {
        return new KubernetesClusterClient(new KubernetesClientBuilder().build(), true);
    }

    @Override
    public ClusterHandle submit(JobDescriptor descriptor) throws ClusterException {
        ExecutionSettings settings = descriptor.getSettings();
        if (settings.getImage() == null) {
            throw new ClusterException("no container image configured for " + descriptor.getVariantId());
        }
        Job job = jobFor(descriptor);
        String namespace = settings.getNamespace();
        try {
            client.batch().v1().jobs().inNamespace(namespace).resource(job).create();
        } catch (KubernetesClientException e) {
            throw new ClusterException("could not create job " + descriptor.getClusterJobName()
                + " in " + namespace + ": " + e.getMessage(), e);
        }
        logger.debug("Created job {}/{}", namespace, descriptor.getClusterJobName());
        return new ClusterHandle(namespace, descriptor.getClusterJobName());
    }

    @Override
    public ClusterJobStatus poll(ClusterHandle handle) throws ClusterException {
        Job job;
        try {
            job = client.batch().v1().jobs().inNamespace(handle.getNamespace()).withName(handle.getName()).get();
        } catch (KubernetesClientException e) {
            throw new ClusterException("could not read job " + handle + ": " + e.getMessage(), e);
        }
        if (job == null) {
            logger.warn("Job {} no longer exists", handle);
            return ClusterJobStatus.FAILED;
        }
        return stateOf(job);
    }

    @Override
    public void cancel(ClusterHandle handle) throws ClusterException {
        try {
            client.batch().v1().jobs().inNamespace(handle.getNamespace()).withName(handle.getName())
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();
        } catch (KubernetesClientException e) {
            throw new ClusterException("could not delete job " + handle + ": " + e.getMessage(), e);
        }
        logger.info("Deleted job {}", handle);
    }

    /**
     * Deletes every job a run left behind in the namespace.
     *
     * @param namespace the namespace the run used
     * @param runId the run identifier
     * @return the number of jobs deleted
     * @throws ClusterException if the jobs could not be listed or deleted
     */
    public int cleanupRun(String namespace, String runId) throws ClusterException {
        try {
            List<Job> jobs = client.batch().v1().jobs().inNamespace(namespace)
                .withLabel(JOBGROUP_LABEL, JOBGROUP)
                .withLabel(RUN_ID_LABEL, JobNames.labelValue(runId))
                .list()
                .getItems();
            for (Job job : jobs) {
                client.batch().v1().jobs().inNamespace(namespace).withName(job.getMetadata().getName())
                    .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                    .delete();
            }
            logger.info("Removed {} job(s) of run {} from {}", jobs.size(), runId, namespace);
            return jobs.size();
        } catch (KubernetesClientException e) {
            throw new ClusterException("could not clean up run " + runId + " in " + namespace + ": " + e.getMessage(), e);
        }
    }

    /**
     * Maps a Job's status onto the dispatcher's view. Success wins over failure, failure
     * over activity; a Job with no status yet is pending.
     *
     * <p>{@code active} also counts pods that are still waiting to be scheduled, so a Job is
     * only running once one of its pods is {@code ready}.
     */
    public static ClusterJobStatus stateOf(Job job) {
        JobStatus status = job.getStatus();
        if (status == null) {
            return ClusterJobStatus.PENDING;
        }
        if (positive(status.getSucceeded())) {
            return ClusterJobStatus.SUCCEEDED;
        }
        if (positive(status.getFailed()) || hasCondition(status, "Failed")) {
            return ClusterJobStatus.FAILED;
        }
        if (positive(status.getReady())) {
            return ClusterJobStatus.RUNNING;
        }
        return ClusterJobStatus.PENDING;
    }

    static Job jobFor(JobDescriptor descriptor) {
        ExecutionSettings settings = descriptor.getSettings();
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(JOBGROUP_LABEL, JOBGROUP);
        labels.put(RUN_ID_LABEL, JobNames.labelValue(descriptor.getRunId()));
        labels.put(VARIANT_ID_LABEL, JobNames.labelValue(descriptor.getVariantId()));

        List<EnvVar> env = descriptor.environment().entrySet().stream()
            .map(e -> new EnvVarBuilder()
                .withName(e.getKey())
                .withValue(e.getValue())
                .build())
            .collect(Collectors.toList());

        return new JobBuilder()
            .withNewMetadata()
                .withName(descriptor.getClusterJobName())
                .withNamespace(settings.getNamespace())
                .withLabels(labels)
            .endMetadata()
            .withNewSpec()
                .withBackoffLimit(0)
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(labels)
                    .endMetadata()
                    .withNewSpec()
                        .withRestartPolicy("Never")
                        .addNewContainer()
                            .withName(CONTAINER_NAME)
                            .withImage(settings.getImage())
                            .withCommand(settings.getCommand())
                            .withEnv(env)
                            .withResources(resources(settings))
                        .endContainer()
                    .endSpec()
                .endTemplate()
            .endSpec()
            .build();
    }

    private static ResourceRequirements resources(ExecutionSettings settings) {
        ResourceRequirementsBuilder builder = new ResourceRequirementsBuilder();
        if (settings.getCpu() != null) {
            builder.addToLimits("cpu", new Quantity(settings.getCpu()));
        }
        if (settings.getMemory() != null) {
            builder.addToLimits("memory", new Quantity(settings.getMemory()));
        }
        return builder.build();
    }

    private static boolean positive(Integer n) {
        return n != null && n > 0;
    }

    private static boolean hasCondition(JobStatus status, String type) {
        if (status.getConditions() == null) {
            return false;
        }
        for (JobCondition c : status.getConditions()) {
            if (type.equals(c.getType()) && "True".equals(c.getStatus())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }
}
