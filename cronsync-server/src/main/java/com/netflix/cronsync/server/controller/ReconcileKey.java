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

import java.util.Objects;

import com.netflix.cronsync.runtime.connector.kubernetes.KubeUtil;
import io.fabric8.kubernetes.api.model.apps.Deployment;

/**
 * Identity of a deployment to reconcile.
 */
public final class ReconcileKey {

    private final String namespace;
    private final String name;

    public ReconcileKey(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public static ReconcileKey of(Deployment deployment) {
        return new ReconcileKey(
                KubeUtil.getMetadataNamespace(deployment.getMetadata()),
                KubeUtil.getMetadataName(deployment.getMetadata())
        );
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconcileKey that = (ReconcileKey) o;
        return Objects.equals(namespace, that.namespace) &&
                Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + '/' + name;
    }
}
