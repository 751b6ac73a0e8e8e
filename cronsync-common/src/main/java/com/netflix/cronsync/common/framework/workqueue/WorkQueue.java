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

package com.netflix.cronsync.common.framework.workqueue;

/**
 * A queue of keys to be processed by a pool of workers, with the following guarantees:
 * <ul>
 *     <li>a key is stored at most once while it waits to be processed,</li>
 *     <li>a key is handed to at most one worker at a time; if it is added again while being processed, it is
 *     queued again only after the worker calls {@link #done(Object)}.</li>
 * </ul>
 * Failed keys can be re-queued with a per-key exponential backoff ({@link #addRateLimited(Object)}), which is
 * reset with {@link #forget(Object)}.
 */
public interface WorkQueue<K> {

    void add(K key);

    /**
     * Adds the key after the given delay. A non-positive delay adds the key immediately.
     */
    void addAfter(K key, long delayMs);

    /**
     * Adds the key after a delay that grows with each consecutive call for the same key.
     */
    void addRateLimited(K key);

    /**
     * Clears the backoff state of the key. Does not remove the key from the queue.
     */
    void forget(K key);

    /**
     * Blocks until a key is available, and marks it as being processed. Returns null if the queue is shut down.
     */
    K take() throws InterruptedException;

    /**
     * Marks the processing of the key as completed.
     */
    void done(K key);

    /**
     * Number of keys waiting to be processed.
     */
    int size();

    void shutdown();

    boolean isShutdown();
}
