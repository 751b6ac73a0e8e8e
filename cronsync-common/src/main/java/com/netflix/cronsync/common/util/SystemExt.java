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

package com.netflix.cronsync.common.util;

/**
 * System/process helper methods.
 */
public final class SystemExt {

    private SystemExt() {
    }

    /**
     * Terminate the JVM process. Shutdown hooks are not run.
     */
    public static void forcedProcessExit(int status) {
        System.err.println("Forced exit: statusCode=" + status);
        new Exception().printStackTrace(System.err);
        System.err.flush();

        Runtime.getRuntime().halt(status);
    }
}
