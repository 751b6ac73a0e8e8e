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

public enum ReconcileCounter {

    RECONCILES_STARTED("reconciles", "deployment"),
    CRONJOBS_UPDATED("cronJobsUpdated", "cronJob"),
    JOBS_DELETED("jobsDeleted", "cronJob"),
    ERRORS("errors", "deployment");

    private final String metricName;
    private final String objectTag;

    ReconcileCounter(String metricName, String objectTag) {
        this.metricName = metricName;
        this.objectTag = objectTag;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * Tag name under which the object name is reported.
     */
    public String getObjectTag() {
        return objectTag;
    }
}
