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

package com.netflix.cronsync.runtime.connector.kubernetes.fabric8io;

import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.util.StringExt;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

class Fabric8IOInformerMetrics<T> {

    private static final String ROOT = "cronsync.kubeClient.fabric8io.informer.";

    private final Registry registry;

    private final Id syncedId;
    private final Id watchingId;
    private final Id resourceVersionId;
    private final Id sizeId;

    Fabric8IOInformerMetrics(String name, SharedIndexInformer<T> informer, CronSyncRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.syncedId = registry.createId(ROOT + "synced").withTag("informer", name);
        this.watchingId = registry.createId(ROOT + "watching").withTag("informer", name);
        this.resourceVersionId = registry.createId(ROOT + "resourceVersion").withTag("informer", name);
        this.sizeId = registry.createId(ROOT + "size").withTag("informer", name);
        PolledMeter.using(registry)
                .withId(syncedId)
                .monitorValue(informer, i -> i.hasSynced() ? 1 : 0);
        PolledMeter.using(registry)
                .withId(watchingId)
                .monitorValue(informer, i -> i.isWatching() ? 1 : 0);
        PolledMeter.using(registry)
                .withId(resourceVersionId)
                .monitorValue(informer, i -> toLong(i.lastSyncResourceVersion()));
        PolledMeter.using(registry)
                .withId(sizeId)
                .monitorValue(informer, i -> i.getIndexer().list().size());
    }

    void close() {
        PolledMeter.remove(registry, syncedId);
        PolledMeter.remove(registry, watchingId);
        PolledMeter.remove(registry, resourceVersionId);
        PolledMeter.remove(registry, sizeId);
    }

    private static long toLong(String lastSyncResourceVersion) {
        if (StringExt.isEmpty(lastSyncResourceVersion)) {
            return 0;
        }
        try {
            return Long.parseLong(lastSyncResourceVersion);
        } catch (NumberFormatException e) {
            // Resource versions are opaque; non-numeric values are reported as 0.
            return 0;
        }
    }
}
