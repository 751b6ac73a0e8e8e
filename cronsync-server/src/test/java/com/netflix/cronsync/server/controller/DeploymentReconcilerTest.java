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

import java.util.List;
import java.util.Optional;

import com.netflix.cronsync.runtime.connector.kubernetes.EventSeverity;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeApiException;
import com.netflix.cronsync.runtime.connector.kubernetes.KubeUtil;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import org.junit.Test;

import static com.netflix.cronsync.server.controller.KubeObjectGenerator.NAMESPACE;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.container;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.cronJob;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.cronJobWithLabel;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.deployment;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.jobOwnedBy;
import static com.netflix.cronsync.server.controller.KubeObjectGenerator.podOfJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeploymentReconcilerTest {

    private static final ReconcileKey WEB = new ReconcileKey(NAMESPACE, "web");

    private final KubeApiFacadeStub kubeApiFacade = new KubeApiFacadeStub();

    private final RecordingReconcileReporter reporter = new RecordingReconcileReporter();

    private final DeploymentReconciler reconciler = new DeploymentReconciler(
            kubeApiFacade,
            new CronJobMatcher(true),
            new JobInvalidator(kubeApiFacade, reporter),
            reporter
    );

    @Test
    public void testMissingDeploymentIsNoOp() {
        kubeApiFacade.addCronJob(cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21")));

        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getStatus()).isEqualTo(ReconcileResult.Status.DeploymentNotFound);
        assertThat(kubeApiFacade.getCronJobUpdates()).isZero();
        assertThat(reporter.getCounters()).isEmpty();
        assertThat(reporter.getEvents()).isEmpty();
    }

    @Test
    public void testCronJobInSyncIsNotTouched() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.21")));
        CronJob cronJob = cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(cronJob);
        kubeApiFacade.addJob(jobOwnedBy("nightly-1", cronJob));

        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getMatchedCronJobs()).isEqualTo(1);
        assertThat(result.getUpdatedCronJobs()).isZero();
        assertThat(kubeApiFacade.getCronJobUpdates()).isZero();
        assertThat(kubeApiFacade.getDeletedJobs()).isEmpty();
        assertThat(reporter.getEvents()).isEmpty();
        assertThat(reporter.getCounters()).containsExactly("RECONCILES_STARTED:default/web");
    }

    @Test
    public void testImageChangeUpdatesCronJobAndDeletesItsJobs() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        CronJob cronJob = cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(cronJob);
        kubeApiFacade.addJob(jobOwnedBy("nightly-1", cronJob));
        kubeApiFacade.addPod(podOfJob("nightly-1-abc", "nightly-1"));

        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getStatus()).isEqualTo(ReconcileResult.Status.Completed);
        assertThat(result.getUpdatedCronJobs()).isEqualTo(1);
        assertThat(result.getDeletedJobs()).isEqualTo(1);

        CronJob stored = kubeApiFacade.getCronJob(NAMESPACE, "nightly");
        assertThat(KubeUtil.getCronJobContainers(stored).get(0).getImage()).isEqualTo("nginx:1.22");
        assertThat(stored.getMetadata().getLabels()).isEqualTo(cronJob.getMetadata().getLabels());
        assertThat(stored.getMetadata().getUid()).isEqualTo(cronJob.getMetadata().getUid());
        assertThat(stored.getSpec().getSchedule()).isEqualTo(cronJob.getSpec().getSchedule());

        assertThat(kubeApiFacade.getJobNames()).isEmpty();
        assertThat(kubeApiFacade.getPodNames()).isEmpty();

        assertThat(reporter.getCount(ReconcileCounter.CRONJOBS_UPDATED)).isEqualTo(1);
        assertThat(reporter.getCount(ReconcileCounter.JOBS_DELETED)).isEqualTo(1);
        assertThat(reporter.getCount(ReconcileCounter.ERRORS)).isZero();
        assertThat(reporter.getEventReasons()).containsExactly(
                DeploymentReconciler.EVENT_CRON_JOB_UPDATED,
                JobInvalidator.EVENT_JOB_DELETED
        );
        RecordingReconcileReporter.RecordedEvent updateEvent = reporter.getEvents().get(0);
        assertThat(updateEvent.getTargetRef()).isEqualTo("default/nightly");
        assertThat(updateEvent.getSeverity()).isEqualTo(EventSeverity.NORMAL);
        assertThat(updateEvent.getMessage()).contains("default/web");
    }

    @Test
    public void testSecondReconcileIsNoOp() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        CronJob cronJob = cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(cronJob);
        kubeApiFacade.addJob(jobOwnedBy("nightly-1", cronJob));

        reconciler.reconcile(WEB);
        int updates = kubeApiFacade.getCronJobUpdates();
        int deletes = kubeApiFacade.getDeletedJobs().size();
        reporter.clear();

        // A job created by the scheduler after the update must survive the second pass.
        kubeApiFacade.addJob(jobOwnedBy("nightly-2", cronJob));
        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getUpdatedCronJobs()).isZero();
        assertThat(kubeApiFacade.getCronJobUpdates()).isEqualTo(updates);
        assertThat(kubeApiFacade.getDeletedJobs()).hasSize(deletes);
        assertThat(kubeApiFacade.getJobNames()).containsExactly("nightly-2");
        assertThat(reporter.getEvents()).isEmpty();
        assertThat(reporter.getCounters()).containsExactly("RECONCILES_STARTED:default/web");
    }

    @Test
    public void testConflictAbortsWithoutDeletingJobs() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        CronJob cronJob = cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(cronJob);
        kubeApiFacade.addJob(jobOwnedBy("nightly-1", cronJob));
        kubeApiFacade.failUpdateCronJob(new KubeApiException("updateCronJob failed: conflict", KubeApiException.ErrorCode.CONFLICT));

        assertThatThrownBy(() -> reconciler.reconcile(WEB))
                .isInstanceOf(KubeApiException.class)
                .satisfies(e -> assertThat(((KubeApiException) e).getErrorCode()).isEqualTo(KubeApiException.ErrorCode.CONFLICT));

        assertThat(kubeApiFacade.getDeletedJobs()).isEmpty();
        assertThat(reporter.getCounters()).containsExactly(
                "RECONCILES_STARTED:default/web",
                "ERRORS:default/web"
        );
        assertThat(reporter.getEvents()).hasSize(1);
        RecordingReconcileReporter.RecordedEvent event = reporter.getEvents().get(0);
        assertThat(event.getReason()).isEqualTo(DeploymentReconciler.EVENT_UPDATE_FAILED);
        assertThat(event.getSeverity()).isEqualTo(EventSeverity.WARNING);
        assertThat(event.getTargetKind()).isEqualTo("Deployment");
    }

    @Test
    public void testConcurrentModificationIsReportedAsConflict() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        kubeApiFacade.addCronJob(cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21")));

        KubeApiFacadeStub racingFacade = new KubeApiFacadeStub() {
            @Override
            public synchronized List<CronJob> listCronJobs(String namespace) {
                List<CronJob> result = kubeApiFacade.listCronJobs(namespace);
                kubeApiFacade.touchCronJob(NAMESPACE, "nightly");
                return result;
            }

            @Override
            public synchronized Optional<Deployment> findDeployment(String namespace, String name) {
                return kubeApiFacade.findDeployment(namespace, name);
            }

            @Override
            public synchronized CronJob updateCronJob(CronJob cronJob) {
                return kubeApiFacade.updateCronJob(cronJob);
            }
        };
        DeploymentReconciler racingReconciler = new DeploymentReconciler(
                racingFacade,
                new CronJobMatcher(true),
                new JobInvalidator(racingFacade, reporter),
                reporter
        );

        assertThatThrownBy(() -> racingReconciler.reconcile(WEB))
                .isInstanceOf(KubeApiException.class)
                .satisfies(e -> assertThat(((KubeApiException) e).getErrorCode()).isEqualTo(KubeApiException.ErrorCode.CONFLICT));
        assertThat(KubeUtil.getCronJobContainers(kubeApiFacade.getCronJob(NAMESPACE, "nightly")).get(0).getImage())
                .isEqualTo("nginx:1.21");
    }

    @Test
    public void testFirstFailureSkipsRemainingCronJobs() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        CronJob first = cronJobWithLabel("first", "web", container("nginx", "nginx:1.21"));
        CronJob second = cronJobWithLabel("second", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(first);
        kubeApiFacade.addCronJob(second);
        kubeApiFacade.addJob(jobOwnedBy("first-1", first));
        kubeApiFacade.addJob(jobOwnedBy("second-1", second));
        kubeApiFacade.failDeleteJob("first-1", new KubeApiException("deleteJob failed", KubeApiException.ErrorCode.INTERNAL));

        assertThatThrownBy(() -> reconciler.reconcile(WEB)).isInstanceOf(KubeApiException.class);

        // The first CronJob is updated, its job deletion fails, and the second CronJob is not visited.
        assertThat(KubeUtil.getCronJobContainers(kubeApiFacade.getCronJob(NAMESPACE, "first")).get(0).getImage()).isEqualTo("nginx:1.22");
        assertThat(KubeUtil.getCronJobContainers(kubeApiFacade.getCronJob(NAMESPACE, "second")).get(0).getImage()).isEqualTo("nginx:1.21");
        assertThat(kubeApiFacade.getJobNames()).containsExactly("first-1", "second-1");
        assertThat(reporter.getCount(ReconcileCounter.ERRORS)).isEqualTo(1);
        assertThat(reporter.getEventReasons()).containsExactly(
                DeploymentReconciler.EVENT_CRON_JOB_UPDATED,
                DeploymentReconciler.EVENT_DELETE_JOBS_FAILED
        );
    }

    @Test
    public void testJobsLeftByFailedDeletionAreNotRetried() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        CronJob cronJob = cronJobWithLabel("nightly", "web", container("nginx", "nginx:1.21"));
        kubeApiFacade.addCronJob(cronJob);
        kubeApiFacade.addJob(jobOwnedBy("nightly-1", cronJob));
        kubeApiFacade.failDeleteJob("nightly-1", new KubeApiException("deleteJob failed", KubeApiException.ErrorCode.INTERNAL));

        assertThatThrownBy(() -> reconciler.reconcile(WEB)).isInstanceOf(KubeApiException.class);

        kubeApiFacade.failDeleteJob(null, null);
        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getUpdatedCronJobs()).isZero();
        assertThat(kubeApiFacade.getJobNames()).containsExactly("nightly-1");
    }

    @Test
    public void testUnrelatedCronJobSharingImageIsUpdated() {
        kubeApiFacade.addDeployment(deployment("web", container("app", "alpine:3.19"), container("base", "alpine:3.18")));
        kubeApiFacade.addCronJob(cronJob("unrelated", container("cleanup", "alpine:3.18")));
        kubeApiFacade.addCronJob(cronJob("other", container("cleanup", "redis:7")));

        ReconcileResult result = reconciler.reconcile(WEB);

        assertThat(result.getMatchedCronJobs()).isEqualTo(1);
        assertThat(KubeUtil.getCronJobContainers(kubeApiFacade.getCronJob(NAMESPACE, "unrelated")).get(0).getImage())
                .isEqualTo("alpine:3.19");
        assertThat(KubeUtil.getCronJobContainers(kubeApiFacade.getCronJob(NAMESPACE, "other")).get(0).getImage())
                .isEqualTo("redis:7");
    }

    @Test
    public void testListFailureIsPropagated() {
        kubeApiFacade.addDeployment(deployment("web", container("nginx", "nginx:1.22")));
        kubeApiFacade.failListCronJobs(new KubeApiException("listCronJobs failed", KubeApiException.ErrorCode.INTERNAL));

        assertThatThrownBy(() -> reconciler.reconcile(WEB)).isInstanceOf(KubeApiException.class);
        assertThat(reporter.getEvents()).isEmpty();
    }
}
