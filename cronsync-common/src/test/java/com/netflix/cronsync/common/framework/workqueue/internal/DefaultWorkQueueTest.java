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

package com.netflix.cronsync.common.framework.workqueue.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.runtime.CronSyncRuntimes;
import com.netflix.cronsync.common.util.retry.Retryers;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.patterns.PolledMeter;
import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public class DefaultWorkQueueTest {

    private static final long TIMEOUT_MS = 5_000;

    private final CronSyncRuntime runtime = CronSyncRuntimes.internal();

    private final DefaultWorkQueue<String> queue = new DefaultWorkQueue<>(
            "test", Retryers.exponentialBackoff(1, 10, TimeUnit.MILLISECONDS), runtime
    );

    @After
    public void tearDown() {
        queue.shutdown();
    }

    @Test
    public void testPendingKeysAreDeduplicated() throws Exception {
        queue.add("a");
        queue.add("b");
        queue.add("a");

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.take()).isEqualTo("a");
        assertThat(queue.take()).isEqualTo("b");
        assertThat(queue.size()).isZero();
    }

    @Test
    public void testKeyAddedWhileProcessingIsRequeuedOnDone() throws Exception {
        queue.add("a");
        assertThat(queue.take()).isEqualTo("a");

        queue.add("a");
        assertThat(queue.size()).isZero();

        queue.done("a");
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.take()).isEqualTo("a");
    }

    @Test
    public void testKeyNotRequeuedWhenNotDirty() throws Exception {
        queue.add("a");
        assertThat(queue.take()).isEqualTo("a");
        queue.done("a");
        assertThat(queue.size()).isZero();
    }

    @Test
    public void testKeyIsNotHandedToTwoWorkers() throws Exception {
        queue.add("a");
        assertThat(queue.take()).isEqualTo("a");
        queue.add("a");

        CompletableFuture<String> second = CompletableFuture.supplyAsync(this::takeUnchecked);
        try {
            second.get(100, TimeUnit.MILLISECONDS);
            fail("Key handed out while still being processed");
        } catch (TimeoutException expected) {
            // Still processing.
        }

        queue.done("a");
        assertThat(second.get(TIMEOUT_MS, TimeUnit.MILLISECONDS)).isEqualTo("a");
    }

    @Test
    public void testAddAfter() throws Exception {
        queue.addAfter("a", 50);
        assertThat(queue.size()).isZero();
        assertThat(takeWithTimeout()).isEqualTo("a");
    }

    @Test
    public void testAddRateLimited() throws Exception {
        queue.addRateLimited("a");
        assertThat(takeWithTimeout()).isEqualTo("a");
        queue.done("a");

        queue.addRateLimited("a");
        assertThat(takeWithTimeout()).isEqualTo("a");
        queue.done("a");

        queue.forget("a");
        queue.addRateLimited("a");
        assertThat(takeWithTimeout()).isEqualTo("a");
    }

    @Test
    public void testTakeReturnsNullAfterShutdown() throws Exception {
        CompletableFuture<String> pending = CompletableFuture.supplyAsync(this::takeUnchecked);
        queue.shutdown();

        assertThat(pending.get(TIMEOUT_MS, TimeUnit.MILLISECONDS)).isNull();
        assertThat(queue.isShutdown()).isTrue();

        queue.add("a");
        assertThat(queue.take()).isNull();
    }

    @Test
    public void testQueueDepthIsReported() {
        queue.add("a");
        queue.add("b");
        PolledMeter.update(runtime.getRegistry());

        Id depthId = runtime.getRegistry().createId("cronsync.workQueue.depth").withTag("queue", "test");
        assertThat(runtime.getRegistry().gauge(depthId).value()).isEqualTo(2.0);
    }

    private String takeWithTimeout() throws InterruptedException, ExecutionException, TimeoutException {
        return CompletableFuture.supplyAsync(this::takeUnchecked).get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }

    private String takeUnchecked() {
        try {
            return queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
