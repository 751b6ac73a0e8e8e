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

package com.netflix.cronsync.runtime.connector.kubernetes.fabric8io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.base.Stopwatch;
import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.util.StringExt;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiException;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class Fabric8IOKubeApiFacade implements KubeApiFacade {

    private static final Logger logger = LoggerFactory.getLogger(Fabric8IOKubeApiFacade.class);

    private static final String METRIC_ROOT = "cronsync.kubeClient.fabric8io.";

    private final KubernetesClient kubernetesClient;
    private final CronSyncRuntime runtime;
    private final Registry registry;

    private final Id requestsId;

    private final Object informerLock = new Object();
    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();
    private final List<Fabric8IOInformerMetrics<?>> informerMetrics = new ArrayList<>();

    @Inject
    public Fabric8IOKubeApiFacade(KubernetesClient kubernetesClient, CronSyncRuntime runtime) {
        this.kubernetesClient = kubernetesClient;
        this.runtime = runtime;
        this.registry = runtime.getRegistry();
        this.requestsId = registry.createId(METRIC_ROOT + "requests");
    }

    @PreDestroy
    public void shutdown() {
        synchronized (informerLock) {
            informers.forEach(SharedIndexInformer::stop);
            informerMetrics.forEach(Fabric8IOInformerMetrics::close);
            informers.clear();
            informerMetrics.clear();
        }
    }

    @Override
    public Optional<Deployment> findDeployment(String namespace, String name) {
        return invoke("getDeployment", () -> Optional.ofNullable(
                kubernetesClient.apps().deployments().inNamespace(namespace).withName(name).get()
        ));
    }

    @Override
    public SharedIndexInformer<Deployment> createDeploymentInformer(String namespace, long resyncPeriodMs) {
        SharedIndexInformer<Deployment> informer = StringExt.isEmpty(namespace)
                ? kubernetesClient.apps().deployments().inAnyNamespace().runnableInformer(resyncPeriodMs)
                : kubernetesClient.apps().deployments().inNamespace(namespace).runnableInformer(resyncPeriodMs);
        synchronized (informerLock) {
            informers.add(informer);
            informerMetrics.add(new Fabric8IOInformerMetrics<>("deployments", informer, runtime));
        }
        logger.info("Created deployment informer: namespace={}, resyncPeriodMs={}",
                StringExt.isEmpty(namespace) ? "<all>" : namespace, resyncPeriodMs);
        return informer;
    }

    @Override
    public List<CronJob> listCronJobs(String namespace) {
        return invoke("listCronJobs", () -> kubernetesClient.batch().v1().cronjobs().inNamespace(namespace).list().getItems());
    }

    @Override
    public CronJob updateCronJob(CronJob cronJob) {
        return invoke("updateCronJob", () -> kubernetesClient.batch().v1().cronjobs()
                .inNamespace(cronJob.getMetadata().getNamespace())
                .resource(cronJob)
                .update()
        );
    }

    @Override
    public List<Job> listJobs(String namespace) {
        return invoke("listJobs", () -> kubernetesClient.batch().v1().jobs().inNamespace(namespace).list().getItems());
    }

    @Override
    public void deleteJob(Job job, DeletionPropagation propagation) {
        invoke("deleteJob", () -> kubernetesClient.batch().v1().jobs()
                .inNamespace(job.getMetadata().getNamespace())
                .resource(job)
                .withPropagationPolicy(propagation)
                .delete()
        );
    }

    @Override
    public void deletePods(String namespace, Map<String, String> labels) {
        invoke("deletePods", () -> kubernetesClient.pods().inNamespace(namespace).withLabels(labels).delete());
    }

    @Override
    public void createEvent(Event event) {
        invoke("createEvent", () -> kubernetesClient.v1().events()
                .inNamespace(event.getMetadata().getNamespace())
                .resource(event)
                .create()
        );
    }

    private <T> T invoke(String operation, Supplier<T> action) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            T result = action.get();
            registry.counter(requestsId.withTag("operation", operation).withTag("status", "success")).increment();
            logger.debug("Kube API call completed: operation={}, elapsedMs={}", operation, stopwatch.elapsed().toMillis());
            return result;
        } catch (KubernetesClientException e) {
            KubeApiException error = new KubeApiException(operation, e);
            registry.counter(requestsId.withTag("operation", operation).withTag("status", error.getErrorCode().name())).increment();
            logger.debug("Kube API call failed: operation={}, errorCode={}, elapsedMs={}",
                    operation, error.getErrorCode(), stopwatch.elapsed().toMillis());
            throw error;
        }
    }
}
