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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import com.netflix.cronsync.common.util.archaius2.Archaius2Ext;
import com.netflix.cronsync.server.controller.ImageSyncController;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElectionConfig;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class LeaderActivationCoordinatorTest {

    private final KubernetesClient kubernetesClient = mock(KubernetesClient.class);

    private final ImageSyncController controller = mock(ImageSyncController.class);

    private final List<Throwable> deactivationErrors = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        when(controller.enterActiveMode()).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    public void testControllerActivatedImmediatelyWhenElectionDisabled() {
        LeaderActivationCoordinator coordinator = newCoordinator("false");

        coordinator.start();

        verify(controller).enterActiveMode();
        verifyNoInteractions(kubernetesClient);
        assertThat(deactivationErrors).isEmpty();
    }

    @Test
    public void testControllerActivationFailureInvokesDeactivationCallback() {
        CompletableFuture<Void> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("informer failed to start"));
        when(controller.enterActiveMode()).thenReturn(failed);
        LeaderActivationCoordinator coordinator = newCoordinator("false");

        coordinator.start();

        assertThat(deactivationErrors).hasSize(1);
        assertThat(deactivationErrors.get(0)).hasMessage("informer failed to start");
    }

    @Test
    public void testLeaderElectionConfig() {
        LeaderActivationCoordinator coordinator = newCoordinator("true");

        LeaderElectionConfig config = coordinator.newLeaderElectionConfig();

        assertThat(config.getName()).isEqualTo("cronsync-test-lease");
        assertThat(config.getLeaseDuration()).isEqualTo(Duration.ofMillis(30_000));
        assertThat(config.getRenewDeadline()).isEqualTo(Duration.ofMillis(10_000));
        assertThat(config.getRetryPeriod()).isEqualTo(Duration.ofMillis(2_000));
        assertThat(coordinator.getIdentity()).isNotEmpty();
    }

    @Test
    public void testLeadershipAcquiredActivatesController() {
        LeaderActivationCoordinator coordinator = newCoordinator("true");

        coordinator.newLeaderElectionConfig().getLeaderCallbacks().onStartLeading();

        verify(controller).enterActiveMode();
        assertThat(deactivationErrors).isEmpty();
    }

    @Test
    public void testLeadershipLossShutsDownControllerAndInvokesDeactivationCallback() {
        LeaderActivationCoordinator coordinator = newCoordinator("true");
        LeaderElectionConfig config = coordinator.newLeaderElectionConfig();
        config.getLeaderCallbacks().onStartLeading();

        config.getLeaderCallbacks().onStopLeading();

        InOrder order = inOrder(controller);
        order.verify(controller).enterActiveMode();
        order.verify(controller).shutdown();
        assertThat(deactivationErrors).hasSize(1);
        assertThat(deactivationErrors.get(0)).hasMessage("Lost leadership");
    }

    @Test
    public void testLeadershipReleasedOnShutdownDoesNotInvokeDeactivationCallback() {
        LeaderActivationCoordinator coordinator = newCoordinator("true");
        LeaderElectionConfig config = coordinator.newLeaderElectionConfig();
        config.getLeaderCallbacks().onStartLeading();

        coordinator.shutdown();
        config.getLeaderCallbacks().onStopLeading();

        assertThat(deactivationErrors).isEmpty();
    }

    @Test
    public void testShutdownStopsController() {
        LeaderActivationCoordinator coordinator = newCoordinator("false");
        coordinator.start();

        coordinator.shutdown();

        verify(controller).shutdown();
        assertThat(deactivationErrors).isEmpty();
    }

    private LeaderActivationCoordinator newCoordinator(String enabled) {
        LeaderElectionConfiguration configuration = Archaius2Ext.newConfiguration(LeaderElectionConfiguration.class,
                "cronsync.leaderElection.enabled", enabled,
                "cronsync.leaderElection.leaseName", "cronsync-test-lease",
                "cronsync.leaderElection.leaseDurationMs", "30000"
        );
        return new LeaderActivationCoordinator(configuration, kubernetesClient, controller, deactivationErrors::add);
    }
}
