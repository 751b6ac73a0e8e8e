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

public class KubeApiException extends RuntimeException {

    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_CONFLICT = 409;

    public enum ErrorCode {
        CONFLICT,
        INTERNAL,
        NOT_FOUND,
    }

    private final ErrorCode errorCode;

    public KubeApiException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = cause instanceof KubernetesClientException ? toErrorCode((KubernetesClientException) cause) : ErrorCode.INTERNAL;
    }

    public KubeApiException(String operation, KubernetesClientException cause) {
        this(String.format("%s failed: httpStatus=%s, error=%s", operation, cause.getCode(), cause.getMessage()), (Throwable) cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    private static ErrorCode toErrorCode(KubernetesClientException e) {
        switch (e.getCode()) {
            case HTTP_NOT_FOUND:
                return ErrorCode.NOT_FOUND;
            case HTTP_CONFLICT:
                return ErrorCode.CONFLICT;
            default:
                return ErrorCode.INTERNAL;
        }
    }
}
