/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.leadmind.core.utils;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per key mutual exclusion. Locks are fair so waiters on a key are served in arrival order. A lock stays in the map
 * only while some thread references it, so idle keys cost nothing.
 * <p>
 * Lock ordering used across the code base: lead lock, then scenario lock, then record lock. Never the other way
 * round.
 */
public class KeyedLocks {
    private final LoadingCache<String, ReentrantLock> locks = CacheBuilder.newBuilder()
            .weakValues()
            .build(CacheLoader.from(key -> new ReentrantLock(true)));

    public static String leadKey(String leadId) {
        return "lead:" + leadId;
    }

    public static String scenarioKey(String scenarioTag) {
        return "scenario:" + scenarioTag;
    }

    public static String recordKey(String tier, String key) {
        return "record:%s:%s".formatted(tier, key);
    }

    public <T> T withLock(String key, Supplier<T> action) {
        final var lock = locks.getUnchecked(key);
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String key) {
        return locks.getUnchecked(key).isHeldByCurrentThread();
    }
}
