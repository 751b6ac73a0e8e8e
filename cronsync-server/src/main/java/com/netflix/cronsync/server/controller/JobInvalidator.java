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
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiFacade;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes the Jobs spawned by a CronJob, together with their pods, so that the next runs are created from the
 * updated job template.
 */
@Singleton
public class JobInvalidator {

    private static final Logger logger = LoggerFactory.getLogger(JobInvalidator.class);

    static final String JOB_NAME_LABEL = "job-name";

    static final String EVENT_JOB_DELETED = "JobDeleted";

    private final KubeApiFacade kubeApiFacade;
    private final ReconcileReporter reporter;

    @Inject
    public JobInvalidator(KubeApiFacade kubeApiFacade, ReconcileReporter reporter) {
        this.kubeApiFacade = kubeApiFacade;
        this.reporter = reporter;
    }

    /**
     * Deletes all Jobs owned by the given CronJob. The first failure stops the processing of the remaining Jobs,
     * and is propagated to the caller.
     *
     * @return number of deleted Jobs
     */
    public int invalidate(CronJob cronJob) {
        String namespace = cronJob.getMetadata().getNamespace();
        String cronJobName = cronJob.getMetadata().getName();
        OwnerIdentity owner = OwnerIdentity.of(cronJob);

        List<Job> ownedJobs = kubeApiFacade.listJobs(namespace).stream()
                .filter(owner::owns)
                .collect(Collectors.toList());

        int deleted = 0;
        for (Job job : ownedJobs) {
            String jobName = job.getMetadata().getName();

            kubeApiFacade.deleteJob(job, DeletionPropagation.FOREGROUND);
            // Pods not yet removed by the garbage collector.
            kubeApiFacade.deletePods(namespace, Collections.singletonMap(JOB_NAME_LABEL, jobName));

            deleted++;
            reporter.incrementCounter(ReconcileCounter.JOBS_DELETED, namespace, cronJobName);
            reporter.recordEvent(cronJob, EventSeverity.NORMAL, EVENT_JOB_DELETED, String.format(
                    "Deleted Job %s and its Pods for CronJob %s to allow new runs with updated image", jobName, cronJobName
            ));
            logger.info("Deleted job {}/{} owned by CronJob {}", namespace, jobName, cronJobName);
        }
        return deleted;
    }
}
