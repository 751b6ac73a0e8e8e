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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.netflix.cronsync.common.framework.workqueue.WorkQueue;
import com.netflix.cronsync.common.runtime.CronSyncRuntime;
import com.netflix.cronsync.common.util.ExecutorsExt;
import com.netflix.cronsync.common.util.retry.Retryer;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.patterns.PolledMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultWorkQueue<K> implements WorkQueue<K> {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkQueue.class);

    private static final String METRIC_ROOT = "cronsync.workQueue.";

    private final String name;
    private final Retryer initialRetryer;
    private final CronSyncRuntime runtime;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    // Guarded by lock.
    private final Deque<K> queue = new ArrayDeque<>();
    private final Set<K> dirty = new HashSet<>();
    private final Set<K> processing = new HashSet<>();

    private final ConcurrentMap<K, Retryer> retryers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService delayExecutor;
    private final Id depthId;

    private volatile boolean shutdown;

    public DefaultWorkQueue(String name, Retryer initialRetryer, CronSyncRuntime runtime) {
        this.name = name;
        this.initialRetryer = initialRetryer;
        this.runtime = runtime;
        this.delayExecutor = ExecutorsExt.namedSingleThreadScheduledExecutor(name + "-delayed");
        this.depthId = runtime.getRegistry().createId(METRIC_ROOT + "depth").withTag("queue", name);
        PolledMeter.using(runtime.getRegistry())
                .withId(depthId)
                .monitorValue(this, DefaultWorkQueue::size);
    }

    @Override
    public void add(K key) {
        lock.lock();
        try {
            if (shutdown || dirty.contains(key)) {
                return;
            }
            dirty.add(key);
            if (processing.contains(key)) {
                return;
            }
            queue.addLast(key);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addAfter(K key, long delayMs) {
        if (shutdown) {
            return;
        }
        if (delayMs <= 0) {
            add(key);
            return;
        }
        try {
            delayExecutor.schedule(() -> add(key), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Work queue {} is shut down; dropping delayed key: {}", name, key);
        }
    }

    @Override
    public void addRateLimited(K key) {
        Retryer retryer = retryers.compute(key, (k, current) -> current == null ? initialRetryer : current.retry());
        Optional<Long> delayMs = retryer.getDelayMs();
        if (!delayMs.isPresent()) {
            logger.warn("Retry limit reached in work queue {}; dropping key: {}", name, key);
            retryers.remove(key);
            return;
        }
        logger.debug("Re-queueing key {} in work queue {} after {}ms", key, name, delayMs.get());
        addAfter(key, delayMs.get());
    }

    @Override
    public void forget(K key) {
        retryers.remove(key);
    }

    @Override
    public K take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !shutdown) {
                notEmpty.await();
            }
            if (shutdown) {
                return null;
            }
            K key = queue.pollFirst();
            processing.add(key);
            dirty.remove(key);
            return key;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void done(K key) {
        lock.lock();
        try {
            processing.remove(key);
            if (dirty.contains(key) && !shutdown) {
                queue.addLast(key);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            this.shutdown = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        delayExecutor.shutdownNow();
        PolledMeter.remove(runtime.getRegistry(), depthId);
        logger.info("Work queue {} shut down", name);
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }
}
