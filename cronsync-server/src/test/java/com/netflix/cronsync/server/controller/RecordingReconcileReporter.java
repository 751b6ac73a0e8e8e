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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeUtil;
import io.fabric8.kubernetes.api.model.HasMetadata;

class RecordingReconcileReporter implements ReconcileReporter {

    private final List<String> counters = new CopyOnWriteArrayList<>();
    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void incrementCounter(ReconcileCounter counter, String namespace, String name) {
        counters.add(counter + ":" + namespace + '/' + name);
    }

    @Override
    public void recordEvent(HasMetadata target, EventSeverity severity, String reason, String message) {
        events.add(new RecordedEvent(target.getKind(), KubeUtil.formatObjectRef(target), severity, reason, message));
    }

    /**
     * Counter increments formatted as "COUNTER:namespace/name".
     */
    List<String> getCounters() {
        return counters;
    }

    long getCount(ReconcileCounter counter) {
        return counters.stream().filter(c -> c.startsWith(counter + ":")).count();
    }

    List<RecordedEvent> getEvents() {
        return events;
    }

    List<String> getEventReasons() {
        return events.stream().map(RecordedEvent::getReason).collect(Collectors.toList());
    }

    void clear() {
        counters.clear();
        events.clear();
    }

    static class RecordedEvent {

        private final String targetKind;
        private final String targetRef;
        private final EventSeverity severity;
        private final String reason;
        private final String message;

        RecordedEvent(String targetKind, String targetRef, EventSeverity severity, String reason, String message) {
            this.targetKind = targetKind;
            this.targetRef = targetRef;
            this.severity = severity;
            this.reason = reason;
            this.message = message;
        }

        String getTargetKind() {
            return targetKind;
        }

        String getTargetRef() {
            return targetRef;
        }

        EventSeverity getSeverity() {
            return severity;
        }

        String getReason() {
            return reason;
        }

        String getMessage() {
            return message;
        }
    }
}
