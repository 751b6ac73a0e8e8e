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

package com.netflix.cronsync.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.util.time.Clock;
import com.netflix.cronsync.common.util.time.Clocks;
import com.netflix.spectator.api.Registry;

@Singleton
public class DefaultCronSyncRuntime implements CronSyncRuntime {

    private final Registry registry;
    private final Clock clock;

    @Inject
    public DefaultCronSyncRuntime(Registry registry) {
        this(registry, Clocks.system());
    }

    public DefaultCronSyncRuntime(Registry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }
}
