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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "cronsync.controller")
public interface ImageSyncControllerConfiguration {

    /**
     * @return whether or not the controller is enabled
     */
    @DefaultValue("true")
    boolean isControllerEnabled();

    /**
     * @return namespace in which deployments are watched. An empty value means all namespaces.
     */
    @DefaultValue("default")
    String getWatchNamespace();

    @DefaultValue("2")
    int getMaxConcurrentReconciles();

    /**
     * @return informer resync interval, or 0 to disable periodic resync
     */
    @DefaultValue("0")
    long getInformerResyncIntervalMs();

    /**
     * @return delay before the first retry of a failed reconcile. The delay doubles with each consecutive failure.
     */
    @DefaultValue("5")
    long getRetryInitialDelayMs();

    @DefaultValue("1000000")
    long getRetryMaxDelayMs();

    /**
     * @return whether a CronJob sharing a container image with a deployment is considered managed by it, in
     * addition to the label and annotation matches
     */
    @DefaultValue("true")
    boolean isSharedImageMatchEnabled();
}
