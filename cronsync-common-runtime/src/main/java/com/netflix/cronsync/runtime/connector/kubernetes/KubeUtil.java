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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.netflix.cronsync.common.util.CollectionsExt;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobSpec;
import io.fabric8.kubernetes.api.model.batch.v1.JobTemplateSpec;

public final class KubeUtil {

    private KubeUtil() {
    }

    /**
     * Get Kube object name
     */
    public static String getMetadataName(ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }
        return metadata.getName();
    }

    public static String getMetadataNamespace(ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }
        return metadata.getNamespace();
    }

    /**
     * Returns "namespace/name" of a Kube object.
     */
    public static String formatObjectRef(HasMetadata object) {
        return getMetadataNamespace(object.getMetadata()) + '/' + getMetadataName(object.getMetadata());
    }

    public static Optional<String> findLabel(HasMetadata object, String key) {
        if (object.getMetadata() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CollectionsExt.nonNull(object.getMetadata().getLabels()).get(key));
    }

    public static Optional<String> findAnnotation(HasMetadata object, String key) {
        if (object.getMetadata() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CollectionsExt.nonNull(object.getMetadata().getAnnotations()).get(key));
    }

    /**
     * Containers of the Deployment pod template, in declaration order. Empty list if the template has no pod spec.
     */
    public static List<Container> getDeploymentContainers(Deployment deployment) {
        if (deployment.getSpec() == null) {
            return Collections.emptyList();
        }
        return getContainers(deployment.getSpec().getTemplate());
    }

    /**
     * Pod spec of the job template of a CronJob (spec.jobTemplate.spec.template.spec).
     */
    public static Optional<PodSpec> findCronJobPodSpec(CronJob cronJob) {
        CronJobSpec spec = cronJob.getSpec();
        if (spec == null) {
            return Optional.empty();
        }
        JobTemplateSpec jobTemplate = spec.getJobTemplate();
        if (jobTemplate == null || jobTemplate.getSpec() == null || jobTemplate.getSpec().getTemplate() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobTemplate.getSpec().getTemplate().getSpec());
    }

    public static List<Container> getCronJobContainers(CronJob cronJob) {
        return findCronJobPodSpec(cronJob)
                .map(podSpec -> CollectionsExt.nonNull(podSpec.getContainers()))
                .orElse(Collections.emptyList());
    }

    private static List<Container> getContainers(PodTemplateSpec template) {
        if (template == null || template.getSpec() == null) {
            return Collections.emptyList();
        }
        return CollectionsExt.nonNull(template.getSpec().getContainers());
    }
}
