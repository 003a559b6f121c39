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

package com.phonepe.leadmind.memory.stores;

import com.google.common.base.Preconditions;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.store.ShortTermStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map backed short term store. Expired records are invisible to reads and scans and are physically removed lazily or
 * by {@link #purgeExpired(Instant)}.
 */
@Slf4j
public class InMemoryShortTermStore implements ShortTermStore {
    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryShortTermStore() {
        this(Clock.systemUTC());
    }

    public InMemoryShortTermStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Tier tier() {
        return Tier.SHORT_TERM;
    }

    @Override
    public void write(MemoryRecord memoryRecord) {
        Preconditions.checkArgument(memoryRecord.getExpiresAt() != null,
                                    "Short term record %s has no expiry", memoryRecord.getKey());
        records.put(memoryRecord.getKey(), memoryRecord);
    }

    @Override
    public Optional<MemoryRecord> read(String key) {
        final var memoryRecord = records.get(key);
        if (memoryRecord == null) {
            return Optional.empty();
        }
        if (memoryRecord.isExpired(clock.instant())) {
            records.remove(key, memoryRecord);
            return Optional.empty();
        }
        return Optional.of(memoryRecord);
    }

    @Override
    public void touch(String key, Instant accessedAt) {
        records.computeIfPresent(key, (k, existing) -> existing.withLastAccessedAt(accessedAt));
    }

    @Override
    public List<MemoryRecord> scanLive(Instant now) {
        return records.values()
                .stream()
                .filter(memoryRecord -> !memoryRecord.isExpired(now))
                .sorted(InMemoryLongTermStore.MOST_RECENT_FIRST)
                .toList();
    }

    @Override
    public int purgeExpired(Instant now) {
        final var expired = records.values()
                .stream()
                .filter(memoryRecord -> memoryRecord.isExpired(now))
                .toList();
        expired.forEach(memoryRecord -> records.remove(memoryRecord.getKey(), memoryRecord));
        if (!expired.isEmpty()) {
            log.debug("Purged {} expired short term records", expired.size());
        }
        return expired.size();
    }
}
