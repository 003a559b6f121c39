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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyedLocksTest {

    @Test
    void testSameKeyIsMutuallyExclusive() throws Exception {
        final var locks = new KeyedLocks();
        final var inside = new AtomicInteger();
        final var maxInside = new AtomicInteger();
        final var executorService = Executors.newFixedThreadPool(8);
        final var latch = new CountDownLatch(1);
        try {
            final var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 50; i++) {
                futures.add(executorService.submit(() -> {
                    latch.await();
                    locks.withLock(KeyedLocks.leadKey("L1"), () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            latch.countDown();
            for (final var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        }
        finally {
            executorService.shutdownNow();
        }
        assertEquals(1, maxInside.get());
    }

    @Test
    void testDifferentKeysProceedInParallel() throws Exception {
        final var locks = new KeyedLocks();
        final var bothInside = new CountDownLatch(2);
        final var executorService = Executors.newFixedThreadPool(2);
        final var reached = Collections.synchronizedList(new ArrayList<String>());
        try {
            final var first = executorService.submit(() -> locks.withLock(KeyedLocks.leadKey("L1"), () -> {
                bothInside.countDown();
                awaitQuietly(bothInside);
                reached.add("L1");
            }));
            final var second = executorService.submit(() -> locks.withLock(KeyedLocks.leadKey("L2"), () -> {
                bothInside.countDown();
                awaitQuietly(bothInside);
                reached.add("L2");
            }));
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        }
        finally {
            executorService.shutdownNow();
        }
        assertEquals(2, reached.size());
    }

    @Test
    void testReentrantAndHeldCheck() {
        final var locks = new KeyedLocks();
        final var key = KeyedLocks.recordKey("short_term", "c1");
        assertFalse(locks.isHeldByCurrentThread(key));
        final var result = locks.withLock(key, () -> locks.withLock(key, () -> locks.isHeldByCurrentThread(key)));
        assertTrue(result);
        assertEquals("record:short_term:c1", key);
        assertEquals("scenario:pricing", KeyedLocks.scenarioKey("pricing"));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
