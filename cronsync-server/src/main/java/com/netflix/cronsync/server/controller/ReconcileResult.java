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

/**
 * Outcome of a successful reconcile. Failures are reported as exceptions.
 */
public class ReconcileResult {

    public enum Status {
        /**
         * The deployment no longer exists. Nothing was done.
         */
        DeploymentNotFound,
        Completed
    }

    private static final ReconcileResult NOT_FOUND = new ReconcileResult(Status.DeploymentNotFound, 0, 0, 0);

    private final Status status;
    private final int matchedCronJobs;
    private final int updatedCronJobs;
    private final int deletedJobs;

    private ReconcileResult(Status status, int matchedCronJobs, int updatedCronJobs, int deletedJobs) {
        this.status = status;
        this.matchedCronJobs = matchedCronJobs;
        this.updatedCronJobs = updatedCronJobs;
        this.deletedJobs = deletedJobs;
    }

    public static ReconcileResult deploymentNotFound() {
        return NOT_FOUND;
    }

    public static ReconcileResult completed(int matchedCronJobs, int updatedCronJobs, int deletedJobs) {
        return new ReconcileResult(Status.Completed, matchedCronJobs, updatedCronJobs, deletedJobs);
    }

    public Status getStatus() {
        return status;
    }

    public int getMatchedCronJobs() {
        return matchedCronJobs;
    }

    public int getUpdatedCronJobs() {
        return updatedCronJobs;
    }

    public int getDeletedJobs() {
        return deletedJobs;
    }

    @Override
    public String toString() {
        return "ReconcileResult{" +
                "status=" + status +
                ", matchedCronJobs=" + matchedCronJobs +
                ", updatedCronJobs=" + updatedCronJobs +
                ", deletedJobs=" + deletedJobs +
                '}';
    }
}
