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
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiException;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiFacade;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeUtil;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the CronJobs following a deployment in line with its container images, and deletes the Jobs of each
 * updated CronJob.
 * <p>
 * Processing is fail-fast: the first failed CronJob update or Job deletion ends the reconcile with an exception,
 * and the remaining CronJobs are not visited. CronJobs updated before the failure are not rolled back. The next
 * reconcile finds them in sync and skips them.
 * <p>
 * Nothing records that Job deletion is pending once a CronJob update is persisted. If the process stops between the
 * update and the deletion, or the deletion fails, the next reconcile sees the CronJob in sync and does not delete the
 * remaining Jobs. They stay until the next image change.
 */
@Singleton
public class DeploymentReconciler {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentReconciler.class);

    static final String EVENT_CRON_JOB_UPDATED = "CronJobUpdated";
    static final String EVENT_UPDATE_FAILED = "UpdateFailed";
    static final String EVENT_DELETE_JOBS_FAILED = "DeleteJobsFailed";

    private final KubeApiFacade kubeApiFacade;
    private final CronJobMatcher matcher;
    private final JobInvalidator jobInvalidator;
    private final ReconcileReporter reporter;

    @Inject
    public DeploymentReconciler(KubeApiFacade kubeApiFacade,
                                CronJobMatcher matcher,
                                JobInvalidator jobInvalidator,
                                ReconcileReporter reporter) {
        this.kubeApiFacade = kubeApiFacade;
        this.matcher = matcher;
        this.jobInvalidator = jobInvalidator;
        this.reporter = reporter;
    }

    /**
     * @throws KubeApiException if a Kube API call fails
     */
    public ReconcileResult reconcile(ReconcileKey key) {
        Optional<Deployment> deploymentOpt = kubeApiFacade.findDeployment(key.getNamespace(), key.getName());
        if (!deploymentOpt.isPresent()) {
            logger.debug("Deployment not found, nothing to do: {}", key);
            return ReconcileResult.deploymentNotFound();
        }
        Deployment deployment = deploymentOpt.get();

        logger.info("Reconciling deployment: {}", key);
        reporter.incrementCounter(ReconcileCounter.RECONCILES_STARTED, key.getNamespace(), key.getName());

        List<CronJob> matched = matcher.findMatching(deployment, kubeApiFacade.listCronJobs(key.getNamespace()));
        List<Container> deploymentContainers = KubeUtil.getDeploymentContainers(deployment);

        int updated = 0;
        int deletedJobs = 0;
        for (CronJob cronJob : matched) {
            ImageSyncResult syncResult = ContainerImageSyncer.sync(deploymentContainers, KubeUtil.getCronJobContainers(cronJob));
            if (!syncResult.isMutated()) {
                logger.debug("CronJob already up to date: {}", KubeUtil.formatObjectRef(cronJob));
                continue;
            }

            CronJob updatedCronJob = updateCronJob(deployment, cronJob, syncResult);
            updated++;

            // Stale jobs are stranded if the process stops here (see the class comment).
            int cronJobDeletedJobs = deleteJobs(deployment, updatedCronJob);
            deletedJobs += cronJobDeletedJobs;
            logger.info("Updated CronJob image and deleted related jobs: cronJob={}, deletedJobs={}",
                    KubeUtil.formatObjectRef(updatedCronJob), cronJobDeletedJobs);
        }
        return ReconcileResult.completed(matched.size(), updated, deletedJobs);
    }

    private CronJob updateCronJob(Deployment deployment, CronJob cronJob, ImageSyncResult syncResult) {
        String cronJobName = cronJob.getMetadata().getName();
        CronJob updated;
        try {
            updated = kubeApiFacade.updateCronJob(withContainers(cronJob, syncResult.getContainers()));
        } catch (KubeApiException e) {
            logger.warn("Failed to update CronJob {}/{}: errorCode={}, error={}",
                    cronJob.getMetadata().getNamespace(), cronJobName, e.getErrorCode(), e.getMessage());
            reporter.incrementCounter(ReconcileCounter.ERRORS, deployment.getMetadata().getNamespace(), deployment.getMetadata().getName());
            reporter.recordEvent(deployment, EventSeverity.WARNING, EVENT_UPDATE_FAILED,
                    String.format("failed to update CronJob %s: %s", cronJobName, e.getMessage())
            );
            throw e;
        }

        reporter.incrementCounter(ReconcileCounter.CRONJOBS_UPDATED, updated.getMetadata().getNamespace(), updated.getMetadata().getName());
        reporter.recordEvent(updated, EventSeverity.NORMAL, EVENT_CRON_JOB_UPDATED,
                String.format("Updated job template images from Deployment %s", KubeUtil.formatObjectRef(deployment))
        );
        return updated;
    }

    private int deleteJobs(Deployment deployment, CronJob cronJob) {
        try {
            return jobInvalidator.invalidate(cronJob);
        } catch (KubeApiException e) {
            logger.warn("Failed to delete jobs of CronJob {}: errorCode={}, error={}",
                    KubeUtil.formatObjectRef(cronJob), e.getErrorCode(), e.getMessage());
            reporter.incrementCounter(ReconcileCounter.ERRORS, deployment.getMetadata().getNamespace(), deployment.getMetadata().getName());
            reporter.recordEvent(cronJob, EventSeverity.WARNING, EVENT_DELETE_JOBS_FAILED,
                    String.format("failed to delete Jobs for CronJob %s: %s", cronJob.getMetadata().getName(), e.getMessage())
            );
            throw e;
        }
    }

    /**
     * Returns a copy of the CronJob with the given job template containers. Everything else, including the
     * resource version used for the optimistic concurrency check, is kept.
     */
    private static CronJob withContainers(CronJob cronJob, List<Container> containers) {
        CronJob copy = new CronJobBuilder(cronJob).build();
        KubeUtil.findCronJobPodSpec(copy).ifPresent(podSpec -> podSpec.setContainers(new ArrayList<>(containers)));
        return copy;
    }
}
