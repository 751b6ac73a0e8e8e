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

import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.Container;

public class ImageSyncResult {

    private final List<Container> containers;
    private final boolean mutated;

    public ImageSyncResult(List<Container> containers, boolean mutated) {
        this.containers = Collections.unmodifiableList(containers);
        this.mutated = mutated;
    }

    /**
     * Container list with the synchronized images. If nothing changed, containers are equal to the input ones.
     */
    public List<Container> getContainers() {
        return containers;
    }

    public boolean isMutated() {
        return mutated;
    }

    @Override
    public String toString() {
        return "ImageSyncResult{" +
                "containers=" + containers.size() +
                ", mutated=" + mutated +
                '}';
    }
}
