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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;

import com.google.common.base.Strings;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

public final class Fabric8IOClients {

    private Fabric8IOClients() {
    }

    public static KubernetesClient createFabric8IOClient(KubeConnectorConfiguration configuration) {
        return createFabric8IOClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                configuration.getRequestTimeoutMs()
        );
    }

    public static KubernetesClient createFabric8IOClient(String kubeApiServerUrl, String kubeConfigPath, long requestTimeoutMs) {
        Config config;
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            if (Strings.isNullOrEmpty(kubeConfigPath)) {
                config = Config.autoConfigure(null);
            } else {
                config = Config.fromKubeconfig(null, readKubeConfig(kubeConfigPath), kubeConfigPath);
            }
        } else {
            config = Config.autoConfigure(null);
            config.setMasterUrl(kubeApiServerUrl);
        }
        config.setRequestTimeout((int) requestTimeoutMs);
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    public static Optional<Throwable> checkKubeConnectivity(KubernetesClient fabric8IOClient) {
        try {
            fabric8IOClient.getKubernetesVersion();
        } catch (Throwable e) {
            return Optional.of(e);
        }
        return Optional.empty();
    }

    public static KubernetesClient mustHaveKubeConnectivity(KubernetesClient fabric8IOClient) {
        checkKubeConnectivity(fabric8IOClient).ifPresent(error -> {
            throw new IllegalStateException("Kube client connectivity error", error);
        });
        return fabric8IOClient;
    }

    private static String readKubeConfig(String kubeConfigPath) {
        try {
            return new String(Files.readAllBytes(Paths.get(kubeConfigPath)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read kube config file: " + kubeConfigPath, e);
        }
    }
}
