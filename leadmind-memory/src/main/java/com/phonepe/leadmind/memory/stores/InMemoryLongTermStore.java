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

import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.store.LongTermStore;
import com.phonepe.leadmind.core.store.RecordFilter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map backed long term store. Not durable across restarts.
 */
public class InMemoryLongTermStore implements LongTermStore {
    public static final Comparator<MemoryRecord> MOST_RECENT_FIRST = Comparator.comparing(
            MemoryRecord::getLastAccessedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();

    @Override
    public Tier tier() {
        return Tier.LONG_TERM;
    }

    @Override
    public void write(MemoryRecord memoryRecord) {
        records.put(memoryRecord.getKey(), memoryRecord);
    }

    @Override
    public Optional<MemoryRecord> read(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public void touch(String key, Instant accessedAt) {
        records.computeIfPresent(key, (k, existing) -> existing.withLastAccessedAt(accessedAt));
    }

    @Override
    public List<MemoryRecord> find(RecordFilter filter) {
        return records.values()
                .stream()
                .filter(filter::matches)
                .sorted(MOST_RECENT_FIRST)
                .limit(filter.getLimit())
                .toList();
    }
}
