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

package com.netflix.cronsync.server.leader;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.cronsync.common.util.SystemExt;
import com.netflix.cronsync.server.controller.ImageSyncController;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderCallbacks;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElectionConfig;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElectionConfigBuilder;
import io.fabric8.kubernetes.client.extended.leaderelection.resourcelock.LeaseLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Activates {@link ImageSyncController} in the leader process only. With leader election disabled, the controller
 * is activated immediately.
 * <p>
 * A leader elector runs a single election. Once leadership is lost, the controller is shut down and the
 * deactivation callback is invoked, which by default terminates the process so that a fresh instance can rejoin
 * the election. The callback is invoked as well if the controller fails to activate.
 */
@Singleton
public class LeaderActivationCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(LeaderActivationCoordinator.class);

    private final LeaderElectionConfiguration configuration;
    private final KubernetesClient kubernetesClient;
    private final ImageSyncController controller;
    private final Consumer<Throwable> deactivationCallback;
    private final String identity;

    private final Object lock = new Object();
    private CompletableFuture<?> leaderElectionFuture;
    private volatile boolean shutdown;

    @Inject
    public LeaderActivationCoordinator(LeaderElectionConfiguration configuration,
                                       KubernetesClient kubernetesClient,
                                       ImageSyncController controller) {
        this(configuration, kubernetesClient, controller, error -> SystemExt.forcedProcessExit(-1));
    }

    @VisibleForTesting
    LeaderActivationCoordinator(LeaderElectionConfiguration configuration,
                                KubernetesClient kubernetesClient,
                                ImageSyncController controller,
                                Consumer<Throwable> deactivationCallback) {
        this.configuration = configuration;
        this.kubernetesClient = kubernetesClient;
        this.controller = controller;
        this.deactivationCallback = deactivationCallback;
        this.identity = resolveIdentity();
    }

    public void start() {
        if (!configuration.isEnabled()) {
            logger.info("Leader election disabled; activating the controller");
            activateController();
            return;
        }
        synchronized (lock) {
            if (leaderElectionFuture != null) {
                return;
            }
            logger.info("Starting leader election: lease={}/{}, identity={}",
                    configuration.getNamespace(), configuration.getLeaseName(), identity);
            this.leaderElectionFuture = kubernetesClient.leaderElector()
                    .withConfig(newLeaderElectionConfig())
                    .build()
                    .start();
        }
    }

    public void shutdown() {
        this.shutdown = true;
        synchronized (lock) {
            if (leaderElectionFuture != null) {
                leaderElectionFuture.cancel(true);
                leaderElectionFuture = null;
            }
        }
        controller.shutdown();
    }

    public String getIdentity() {
        return identity;
    }

    @VisibleForTesting
    LeaderElectionConfig newLeaderElectionConfig() {
        return new LeaderElectionConfigBuilder()
                .withName(configuration.getLeaseName())
                .withLeaseDuration(Duration.ofMillis(configuration.getLeaseDurationMs()))
                .withRenewDeadline(Duration.ofMillis(configuration.getRenewDeadlineMs()))
                .withRetryPeriod(Duration.ofMillis(configuration.getRetryPeriodMs()))
                .withLock(new LeaseLock(configuration.getNamespace(), configuration.getLeaseName(), identity))
                .withLeaderCallbacks(new LeaderCallbacks(
                        this::onStartLeading,
                        this::onStopLeading,
                        newLeader -> logger.info("New leader elected: {}", newLeader)
                ))
                .build();
    }

    private void onStartLeading() {
        logger.info("Leadership acquired by {}", identity);
        activateController();
    }

    private void onStopLeading() {
        if (shutdown) {
            logger.info("Leadership released by {} on shutdown", identity);
            controller.shutdown();
            return;
        }
        logger.warn("Leadership lost by {}", identity);
        try {
            controller.shutdown();
        } finally {
            deactivationCallback.accept(new IllegalStateException("Lost leadership"));
        }
    }

    private void activateController() {
        controller.enterActiveMode().whenComplete((ignored, error) -> {
            if (error != null && !shutdown) {
                logger.error("Controller activation failure", error);
                deactivationCallback.accept(error);
            }
        });
    }

    private static String resolveIdentity() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Cannot resolve local host name: {}", e.getMessage());
            host = "unknown";
        }
        return host + '_' + UUID.randomUUID();
    }
}
