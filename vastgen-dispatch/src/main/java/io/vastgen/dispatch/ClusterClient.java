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


package io.vastgen.dispatch;

/**
 * The narrow capability the dispatcher needs from a cluster scheduler.
 *
 * <p>Implementations adapt a concrete scheduler API. They hold no retry or concurrency
 * policy of their own; those belong to {@link ClusterJobDispatcher}. Implementations must
 * be safe for concurrent use by the dispatcher's workers.
 *
 * @see io.vastgen.dispatch.k8s.KubernetesClusterClient
 */
public interface ClusterClient {

    /**
     * Submits one job. Returns once the scheduler has accepted it.
     *
     * @param descriptor what to run
     * @return a handle for later polling
     * @throws ClusterException if the scheduler rejected or could not be reached
     */
    ClusterHandle submit(JobDescriptor descriptor) throws ClusterException;

    /**
     * @param handle a handle from {@link #submit}
     * @return the job's current status; a job the scheduler no longer knows is {@link ClusterJobStatus#FAILED}
     * @throws ClusterException if the scheduler could not be reached
     */
    ClusterJobStatus poll(ClusterHandle handle) throws ClusterException;

    /**
     * Best-effort cancellation; the job may keep running for a while after this returns.
     *
     * @param handle a handle from {@link #submit}
     * @throws ClusterException if the scheduler could not be reached
     */
    void cancel(ClusterHandle handle) throws ClusterException;
}
