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
import java.util.Set;
import java.util.stream.Collectors;

import com.netflix.cronsync.runtime.connector.kubernetes.KubeUtil;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;

/**
 * Decides which CronJobs follow a deployment. A CronJob matches if any of the following holds:
 * <ul>
 *     <li>its {@value #MANAGED_BY_LABEL} label is the deployment name,</li>
 *     <li>its {@value #MANAGED_BY_ANNOTATION} annotation is "namespace/name" of the deployment,</li>
 *     <li>it uses at least one container image the deployment uses (if shared image matching is enabled).</li>
 * </ul>
 * The shared image rule is a heuristic. Two unrelated workloads built from the same base image match each other.
 */
public class CronJobMatcher {

    public static final String MANAGED_BY_LABEL = "managed-by-deployment";

    public static final String MANAGED_BY_ANNOTATION = "controller.example.com/managed-by-deployment";

    private final boolean sharedImageMatchEnabled;

    public CronJobMatcher(boolean sharedImageMatchEnabled) {
        this.sharedImageMatchEnabled = sharedImageMatchEnabled;
    }

    /**
     * Returns the matching CronJobs in the order of the candidate list. Each CronJob is returned once, even if it
     * satisfies more than one rule.
     */
    public List<CronJob> findMatching(Deployment deployment, List<CronJob> candidates) {
        return candidates.stream()
                .filter(cronJob -> matches(deployment, cronJob))
                .collect(Collectors.toList());
    }

    public boolean matches(Deployment deployment, CronJob cronJob) {
        return isLabelMatch(deployment, cronJob)
                || isAnnotationMatch(deployment, cronJob)
                || (sharedImageMatchEnabled && isSharedImageMatch(deployment, cronJob));
    }

    static boolean isLabelMatch(Deployment deployment, CronJob cronJob) {
        String deploymentName = KubeUtil.getMetadataName(deployment.getMetadata());
        return KubeUtil.findLabel(cronJob, MANAGED_BY_LABEL)
                .map(value -> value.equals(deploymentName))
                .orElse(false);
    }

    static boolean isAnnotationMatch(Deployment deployment, CronJob cronJob) {
        String deploymentRef = KubeUtil.formatObjectRef(deployment);
        return KubeUtil.findAnnotation(cronJob, MANAGED_BY_ANNOTATION)
                .map(value -> value.equals(deploymentRef))
                .orElse(false);
    }

    static boolean isSharedImageMatch(Deployment deployment, CronJob cronJob) {
        Set<String> deploymentImages = toImageSet(KubeUtil.getDeploymentContainers(deployment));
        if (deploymentImages.isEmpty()) {
            return false;
        }
        return KubeUtil.getCronJobContainers(cronJob).stream()
                .map(Container::getImage)
                .anyMatch(deploymentImages::contains);
    }

    private static Set<String> toImageSet(List<Container> containers) {
        return containers.stream()
                .map(Container::getImage)
                .filter(image -> image != null)
                .collect(Collectors.toSet());
    }
}
