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

package com.netflix.cronsync.server.leader;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "cronsync.leaderElection")
public interface LeaderElectionConfiguration {

    /**
     * @return if false, the controller is activated immediately
     */
    @DefaultValue("false")
    boolean isEnabled();

    @DefaultValue("default")
    String getNamespace();

    @DefaultValue("cronsync-controller.netflix.com")
    String getLeaseName();

    @DefaultValue("15000")
    long getLeaseDurationMs();

    @DefaultValue("10000")
    long getRenewDeadlineMs();

    @DefaultValue("2000")
    long getRetryPeriodMs();
}
