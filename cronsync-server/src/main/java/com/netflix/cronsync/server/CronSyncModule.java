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

package com.netflix.cronsync.server;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.runtime.internal.DefaultCronSyncRuntime;
import com.netflix.cronsync.common.util.archaius2.Archaius2Ext;
import com.netflix.cronsync.runtime.connector.kubernetes.Fabric8IOClients;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeConnectorConfiguration;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeEventRecorder;
import com.netflix.cronsync.runtime.connector.kubernetes.fabric8io.Fabric8IOKubeApiFacade;
import com.netflix.cronsync.server.controller.CronJobMatcher;
import com.netflix.cronsync.server.controller.DefaultReconcileReporter;
import com.netflix.cronsync.server.controller.ImageSyncControllerConfiguration;
import com.netflix.cronsync.server.controller.ReconcileReporter;
import com.netflix.cronsync.server.leader.LeaderElectionConfiguration;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.client.KubernetesClient;

public class CronSyncModule extends AbstractModule {

    public static final String EVENT_SOURCE_COMPONENT = "cronsync-controller";

    private final Config config;

    public CronSyncModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(Config.class).toInstance(config);
        bind(Registry.class).toInstance(new DefaultRegistry());
        bind(CronSyncRuntime.class).to(DefaultCronSyncRuntime.class);
        bind(KubeApiFacade.class).to(Fabric8IOKubeApiFacade.class);
        bind(ReconcileReporter.class).to(DefaultReconcileReporter.class);
    }

    @Provides
    @Singleton
    public ConfigProxyFactory getConfigProxyFactory(Config config) {
        return Archaius2Ext.newConfigProxyFactory(config);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(KubeConnectorConfiguration.class, "cronsync.kubeClient");
    }

    @Provides
    @Singleton
    public ImageSyncControllerConfiguration getImageSyncControllerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(ImageSyncControllerConfiguration.class, "cronsync.controller");
    }

    @Provides
    @Singleton
    public LeaderElectionConfiguration getLeaderElectionConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(LeaderElectionConfiguration.class, "cronsync.leaderElection");
    }

    @Provides
    @Singleton
    public KubernetesClient getKubernetesClient(KubeConnectorConfiguration configuration) {
        return Fabric8IOClients.createFabric8IOClient(configuration);
    }

    @Provides
    @Singleton
    public KubeEventRecorder getKubeEventRecorder(KubeApiFacade kubeApiFacade, CronSyncRuntime runtime) {
        return new KubeEventRecorder(kubeApiFacade, EVENT_SOURCE_COMPONENT, runtime);
    }

    @Provides
    @Singleton
    public CronJobMatcher getCronJobMatcher(ImageSyncControllerConfiguration configuration) {
        return new CronJobMatcher(configuration.isSharedImageMatchEnabled());
    }
}
