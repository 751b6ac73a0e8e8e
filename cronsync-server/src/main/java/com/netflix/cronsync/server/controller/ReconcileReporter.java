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

import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Metrics and Kubernetes events emitted while reconciling. Implementations must never throw.
 */
public interface ReconcileReporter {

    void incrementCounter(ReconcileCounter counter, String namespace, String name);

    void recordEvent(HasMetadata target, EventSeverity severity, String reason, String message);
}
