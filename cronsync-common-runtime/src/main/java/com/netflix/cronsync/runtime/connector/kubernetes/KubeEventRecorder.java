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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.runtime.connector.kubernetes.fabric8io.Fabric8IOUtil;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records Kubernetes events attached to a Kube object. Recording is best effort: failures are logged, and never
 * reported to the caller.
 */
public class KubeEventRecorder {

    private static final Logger logger = LoggerFactory.getLogger(KubeEventRecorder.class);

    private final KubeApiFacade kubeApiFacade;
    private final String component;
    private final CronSyncRuntime runtime;

    private final AtomicLong lastEventNanos = new AtomicLong();

    public KubeEventRecorder(KubeApiFacade kubeApiFacade, String component, CronSyncRuntime runtime) {
        this.kubeApiFacade = kubeApiFacade;
        this.component = component;
        this.runtime = runtime;
    }

    public void record(HasMetadata target, EventSeverity severity, String reason, String message) {
        try {
            kubeApiFacade.createEvent(newEvent(target, severity, reason, message));
            logger.debug("Recorded event: target={}, type={}, reason={}, message={}",
                    KubeUtil.formatObjectRef(target), severity.getKubeType(), reason, message);
        } catch (RuntimeException e) {
            logger.warn("Cannot record event: target={}, reason={}, error={}", KubeUtil.formatObjectRef(target), reason, e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    @VisibleForTesting
    Event newEvent(HasMetadata target, EventSeverity severity, String reason, String message) {
        long wallTimeMs = runtime.getClock().wallTime();
        String timestamp = Fabric8IOUtil.formatTimestamp(wallTimeMs);
        long eventNanos = lastEventNanos.updateAndGet(last -> Math.max(last + 1, TimeUnit.MILLISECONDS.toNanos(wallTimeMs)));

        String targetName = KubeUtil.getMetadataName(target.getMetadata());
        String targetNamespace = KubeUtil.getMetadataNamespace(target.getMetadata());

        return new EventBuilder()
                .withNewMetadata()
                .withName(String.format("%s.%x", targetName, eventNanos))
                .withNamespace(targetNamespace)
                .endMetadata()
                .withInvolvedObject(new ObjectReferenceBuilder()
                        .withApiVersion(target.getApiVersion())
                        .withKind(target.getKind())
                        .withName(targetName)
                        .withNamespace(targetNamespace)
                        .withUid(target.getMetadata().getUid())
                        .withResourceVersion(target.getMetadata().getResourceVersion())
                        .build()
                )
                .withType(severity.getKubeType())
                .withReason(reason)
                .withMessage(message)
                .withNewSource()
                .withComponent(component)
                .endSource()
                .withFirstTimestamp(timestamp)
                .withLastTimestamp(timestamp)
                .withCount(1)
                .build();
    }
}
