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

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeEventRecorder;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.api.model.HasMetadata;

@Singleton
public class DefaultReconcileReporter implements ReconcileReporter {

    private static final String METRIC_ROOT = "cronsync.imageSync.";

    private final Registry registry;
    private final KubeEventRecorder eventRecorder;

    @Inject
    public DefaultReconcileReporter(CronSyncRuntime runtime, KubeEventRecorder eventRecorder) {
        this.registry = runtime.getRegistry();
        this.eventRecorder = eventRecorder;
    }

    @Override
    public void incrementCounter(ReconcileCounter counter, String namespace, String name) {
        registry.counter(registry.createId(METRIC_ROOT + counter.getMetricName())
                .withTag("namespace", namespace)
                .withTag(counter.getObjectTag(), name)
        ).increment();
    }

    @Override
    public void recordEvent(HasMetadata target, EventSeverity severity, String reason, String message) {
        eventRecorder.record(target, severity, reason, message);
    }
}
