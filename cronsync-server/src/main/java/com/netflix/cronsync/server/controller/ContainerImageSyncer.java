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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;

/**
 * Computes CronJob job template containers with images taken from a deployment. A container is updated from the
 * deployment container with the same name. A container with no same-named counterpart gets the image of the first
 * deployment container. Only the image field is ever changed.
 */
public final class ContainerImageSyncer {

    private ContainerImageSyncer() {
    }

    public static ImageSyncResult sync(List<Container> deploymentContainers, List<Container> cronJobContainers) {
        Map<String, String> imagesByName = new HashMap<>();
        for (Container container : deploymentContainers) {
            imagesByName.put(container.getName(), container.getImage());
        }
        String fallbackImage = deploymentContainers.isEmpty() ? null : deploymentContainers.get(0).getImage();

        List<Container> result = new ArrayList<>(cronJobContainers.size());
        boolean mutated = false;
        for (Container container : cronJobContainers) {
            String targetImage;
            if (imagesByName.containsKey(container.getName())) {
                targetImage = imagesByName.get(container.getName());
            } else if (!deploymentContainers.isEmpty()) {
                targetImage = fallbackImage;
            } else {
                result.add(container);
                continue;
            }

            if (Objects.equals(container.getImage(), targetImage)) {
                result.add(container);
            } else {
                result.add(new ContainerBuilder(container).withImage(targetImage).build());
                mutated = true;
            }
        }
        return new ImageSyncResult(result, mutated);
    }
}
