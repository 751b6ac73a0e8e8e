/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.cronsync.runtime.connector.kubernetes;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

/**
 * {@link KubeApiFacade} encapsulates the Kubernetes client, except the entity model and the informer API. All
 * operations are blocking, and report failures as {@link KubeApiException}. The facade is an interface so it is easy
 * to replace with an in-memory implementation in the test code.
 */
public interface KubeApiFacade {

    // Deployments

    /**
     * Returns {@link Optional#empty()} if the deployment does not exist.
     */
    Optional<Deployment> findDeployment(String namespace, String name);

    /**
     * Creates a deployment informer, which is not started yet. An empty namespace means all namespaces.
     */
    SharedIndexInformer<Deployment> createDeploymentInformer(String namespace, long resyncPeriodMs);

    // CronJobs

    List<CronJob> listCronJobs(String namespace);

    /**
     * Writes back the CronJob. The write fails with {@link KubeApiException.ErrorCode#CONFLICT} if the CronJob was
     * modified since the given version was read.
     */
    CronJob updateCronJob(CronJob cronJob);

    // Jobs

    List<Job> listJobs(String namespace);

    void deleteJob(Job job, DeletionPropagation propagation);

    // Pods

    void deletePods(String namespace, Map<String, String> labels);

    // Events

    void createEvent(Event event);
}
