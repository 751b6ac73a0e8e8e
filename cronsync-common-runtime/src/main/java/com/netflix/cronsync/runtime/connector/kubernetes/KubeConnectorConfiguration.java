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

import com.netflix.archaius.api.annotations.DefaultValue;

public interface KubeConnectorConfiguration {

    /**
     * Kubernetes API server URL. If not set, the client is configured from the kube config file or the
     * in-cluster service account.
     */
    @DefaultValue("")
    String getKubeApiServerUrl();

    /**
     * Path to a kube config file. Ignored if {@link #getKubeApiServerUrl()} is set.
     */
    @DefaultValue("")
    String getKubeConfigPath();

    @DefaultValue("60000")
    long getRequestTimeoutMs();
}
