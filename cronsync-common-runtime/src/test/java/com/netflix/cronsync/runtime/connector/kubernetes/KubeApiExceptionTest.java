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

package com.netflix.cronsync.runtime.connector.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class KubeApiExceptionTest {

    @Test
    public void testNotFound() {
        KubeApiException error = new KubeApiException("getDeployment", new KubernetesClientException("not found", 404, null));
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.NOT_FOUND);
        assertThat(error.getMessage()).contains("getDeployment").contains("404");
    }

    @Test
    public void testConflict() {
        KubeApiException error = new KubeApiException("updateCronJob", new KubernetesClientException("conflict", 409, null));
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.CONFLICT);
    }

    @Test
    public void testOtherStatusCodesAreInternal() {
        assertThat(new KubeApiException("listJobs", new KubernetesClientException("forbidden", 403, null)).getErrorCode())
                .isEqualTo(KubeApiException.ErrorCode.INTERNAL);
        assertThat(new KubeApiException("listJobs", new KubernetesClientException("connection refused")).getErrorCode())
                .isEqualTo(KubeApiException.ErrorCode.INTERNAL);
    }

    @Test
    public void testNonKubernetesCauseIsInternal() {
        KubeApiException error = new KubeApiException("boom", new IllegalStateException("boom"));
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.INTERNAL);
    }
}
