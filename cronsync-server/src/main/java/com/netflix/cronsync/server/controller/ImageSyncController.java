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

package com.netflix.cronsync.server.controller;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.netflix.cronsync.common.framework.workqueue.WorkQueue;
import com.netflix.cronsync.common.framework.workqueue.internal.DefaultWorkQueue;
import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.util.Evaluators;
import com.netflix.cronsync.common.util.ExecutorsExt;
import com.netflix.cronsync.common.util.retry.Retryers;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches deployments, and reconciles each added or updated deployment with {@link DeploymentReconciler}. Keys are
 * passed through a {@link WorkQueue}, so a deployment is never reconciled by two workers at the same time.
 * A failed reconcile is retried with an exponential backoff.
 */
@Singleton
public class ImageSyncController {

    private static final Logger logger = LoggerFactory.getLogger(ImageSyncController.class);

    public static final String NAME = "imageSyncController";

    private static final String METRIC_ROOT = "cronsync.imageSync.controller.";

    private final ImageSyncControllerConfiguration configuration;
    private final KubeApiFacade kubeApiFacade;
    private final DeploymentReconciler reconciler;
    private final CronSyncRuntime runtime;
    private final Registry registry;

    private final Id reconcileResultsId;
    private final Id reconcileLatencyId;

    private final Object activationLock = new Object();

    private volatile boolean active;
    private SharedIndexInformer<Deployment> informer;
    private WorkQueue<ReconcileKey> queue;
    private ExecutorService workers;
    private CompletableFuture<Void> activationFuture;

    @Inject
    public ImageSyncController(ImageSyncControllerConfiguration configuration,
                               KubeApiFacade kubeApiFacade,
                               DeploymentReconciler reconciler,
                               CronSyncRuntime runtime) {
        this.configuration = configuration;
        this.kubeApiFacade = kubeApiFacade;
        this.reconciler = reconciler;
        this.runtime = runtime;
        this.registry = runtime.getRegistry();
        this.reconcileResultsId = registry.createId(METRIC_ROOT + "reconcileResults");
        this.reconcileLatencyId = registry.createId(METRIC_ROOT + "reconcileLatency");
    }

    /**
     * Starts watching deployments. The returned future completes when the deployment informer has synced, or
     * completes exceptionally if the informer fails to start. In the latter case the controller is shut down
     * before the future completes.
     */
    public CompletableFuture<Void> enterActiveMode() {
        synchronized (activationLock) {
            if (active) {
                return activationFuture;
            }
            if (!configuration.isControllerEnabled()) {
                logger.info("Controller {} is disabled", NAME);
                return CompletableFuture.completedFuture(null);
            }

            int workerCount = configuration.getMaxConcurrentReconciles();
            this.queue = new DefaultWorkQueue<>(
                    NAME,
                    Retryers.exponentialBackoff(configuration.getRetryInitialDelayMs(), configuration.getRetryMaxDelayMs(), TimeUnit.MILLISECONDS),
                    runtime
            );
            this.workers = ExecutorsExt.instrumentedFixedSizeThreadPool(registry, NAME, workerCount);
            WorkQueue<ReconcileKey> workerQueue = queue;
            for (int i = 0; i < workerCount; i++) {
                workers.submit(() -> runWorker(workerQueue));
            }

            SharedIndexInformer<Deployment> startedInformer = kubeApiFacade.createDeploymentInformer(
                    configuration.getWatchNamespace(),
                    configuration.getInformerResyncIntervalMs()
            );
            startedInformer.addEventHandler(new DeploymentEventHandler(workerQueue));
            this.informer = startedInformer;
            this.activationFuture = new CompletableFuture<>();
            this.active = true;
            logger.info("Controller {} entered active mode: watchNamespace={}, workers={}",
                    NAME, configuration.getWatchNamespace(), workerCount);

            CompletableFuture<Void> result = activationFuture;
            startedInformer.start().whenComplete((ignored, error) -> {
                if (error == null) {
                    logger.info("Deployment informer synced");
                    result.complete(null);
                } else if (shutdownIfCurrent(startedInformer)) {
                    logger.error("Deployment informer failed to start, controller {} shut down", NAME, error);
                    result.completeExceptionally(error);
                } else {
                    // Stopped by shutdown before the initial sync.
                    logger.debug("Deployment informer stopped before sync: {}", error.getMessage());
                }
            });
            return result;
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (activationLock) {
            if (!active) {
                return;
            }
            Evaluators.acceptNotNull(informer, SharedIndexInformer::stop);
            Evaluators.acceptNotNull(queue, WorkQueue::shutdown);
            Evaluators.acceptNotNull(workers, ExecutorService::shutdownNow);
            this.informer = null;
            this.queue = null;
            this.workers = null;
            this.activationFuture = null;
            this.active = false;
            logger.info("Controller {} shut down", NAME);
        }
    }

    public boolean isActive() {
        return active;
    }

    private boolean shutdownIfCurrent(SharedIndexInformer<Deployment> startedInformer) {
        synchronized (activationLock) {
            if (informer != startedInformer) {
                return false;
            }
            shutdown();
            return true;
        }
    }

    private void runWorker(WorkQueue<ReconcileKey> workerQueue) {
        while (true) {
            ReconcileKey key;
            try {
                key = workerQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            try {
                processKey(workerQueue, key);
            } finally {
                workerQueue.done(key);
            }
        }
    }

    @VisibleForTesting
    boolean processKey(WorkQueue<ReconcileKey> workerQueue, ReconcileKey key) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            ReconcileResult result = reconciler.reconcile(key);
            workerQueue.forget(key);
            registry.counter(reconcileResultsId.withTag("status", "success")).increment();
            logger.debug("Reconciled deployment {}: {}", key, result);
            return true;
        } catch (RuntimeException e) {
            registry.counter(reconcileResultsId.withTag("status", "failure")).increment();
            logger.warn("Reconcile of deployment {} failed, retrying with backoff: {}", key, e.getMessage());
            logger.debug("Stack trace", e);
            workerQueue.addRateLimited(key);
            return false;
        } finally {
            registry.timer(reconcileLatencyId).record(stopwatch.elapsed(TimeUnit.MILLISECONDS), TimeUnit.MILLISECONDS);
        }
    }

    private static class DeploymentEventHandler implements ResourceEventHandler<Deployment> {

        private final WorkQueue<ReconcileKey> queue;

        private DeploymentEventHandler(WorkQueue<ReconcileKey> queue) {
            this.queue = queue;
        }

        @Override
        public void onAdd(Deployment deployment) {
            queue.add(ReconcileKey.of(deployment));
        }

        @Override
        public void onUpdate(Deployment oldDeployment, Deployment newDeployment) {
            queue.add(ReconcileKey.of(newDeployment));
        }

        @Override
        public void onDelete(Deployment deployment, boolean deletedFinalStateUnknown) {
            logger.debug("Ignoring deleted deployment: {}", ReconcileKey.of(deployment));
        }
    }
}
