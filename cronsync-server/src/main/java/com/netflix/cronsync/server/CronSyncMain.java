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

import java.util.concurrent.CountDownLatch;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.api.Config;
import com.netflix.cronsync.common.util.archaius2.Archaius2Ext;
import com.netflix.cronsync.runtime.connector.kubernetes.Fabric8IOClients;
import com.netflix.cronsync.runtime.connector.kubernetes.fabric8io.Fabric8IOKubeApiFacade;
import com.netflix.cronsync.server.leader.LeaderActivationCoordinator;
import com.sampullara.cli.Args;
import com.sampullara.cli.Argument;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CronSyncMain {

    private static final Logger logger = LoggerFactory.getLogger(CronSyncMain.class);

    @Argument(alias = "p", description = "Specify a properties file")
    private static String propertiesFile;

    public static void main(String[] args) {
        try {
            Args.parse(CronSyncMain.class, args);
        } catch (IllegalArgumentException e) {
            Args.usage(CronSyncMain.class);
            System.exit(1);
        }

        try {
            Config config = CronSyncConfigLoader.load(propertiesFile);
            logger.info("Configuration: {}", Archaius2Ext.toString(config));

            Injector injector = Guice.createInjector(new CronSyncModule(config));
            KubernetesClient kubernetesClient = Fabric8IOClients.mustHaveKubeConnectivity(injector.getInstance(KubernetesClient.class));
            LeaderActivationCoordinator coordinator = injector.getInstance(LeaderActivationCoordinator.class);
            Fabric8IOKubeApiFacade kubeApiFacade = injector.getInstance(Fabric8IOKubeApiFacade.class);

            CountDownLatch terminated = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down");
                coordinator.shutdown();
                kubeApiFacade.shutdown();
                kubernetesClient.close();
                terminated.countDown();
            }, "cronsync-shutdown"));

            coordinator.start();
            terminated.await();
        } catch (Exception e) {
            // unexpected to get a RuntimeException, will exit
            logger.error("Unexpected error: {}", e.getMessage(), e);
            System.exit(2);
        }
    }
}
