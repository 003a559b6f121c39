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

package com.phonepe.leadmind.filesystem.longterm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.store.LongTermStore;
import com.phonepe.leadmind.core.store.RecordFilter;
import com.phonepe.leadmind.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.StampedLock;

/**
 * Long term store keeping one JSON document per record under a base directory. All records are cached in memory and
 * reloaded from disk on start. Meant for single process deployments.
 */
@Slf4j
public class FileSystemLongTermStore implements LongTermStore {
    private static final String RECORD_FILE_SUFFIX = ".json";
    private static final Comparator<MemoryRecord> MOST_RECENT_FIRST = Comparator.comparing(
            MemoryRecord::getLastAccessedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Path recordRoot;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, MemoryRecord> cache = new ConcurrentHashMap<>();
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemLongTermStore(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.recordRoot = FileUtils.ensurePath(baseDir, true, true);
        this.mapper = mapper;
        loadRecords();
    }

    @Override
    public Tier tier() {
        return Tier.LONG_TERM;
    }

    @Override
    public void write(MemoryRecord memoryRecord) {
        final byte[] data;
        try {
            data = mapper.writeValueAsBytes(memoryRecord);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize record " + memoryRecord.getKey(), e);
        }
        final var stamp = lock.writeLock();
        try {
            FileUtils.writeAtomically(fileFor(memoryRecord.getKey()), data);
            cache.put(memoryRecord.getKey(), memoryRecord);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Optional<MemoryRecord> read(String key) {
        return Optional.ofNullable(cache.get(key));
    }

    /**
     * Access times are kept in memory only. They are persisted with the next write of the record.
     */
    @Override
    public void touch(String key, Instant accessedAt) {
        cache.computeIfPresent(key, (k, existing) -> existing.withLastAccessedAt(accessedAt));
    }

    @Override
    public List<MemoryRecord> find(RecordFilter filter) {
        return cache.values()
                .stream()
                .filter(filter::matches)
                .sorted(MOST_RECENT_FIRST)
                .limit(filter.getLimit())
                .toList();
    }

    private Path fileFor(String key) {
        return recordRoot.resolve(UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)) + RECORD_FILE_SUFFIX);
    }

    @SneakyThrows
    private void loadRecords() {
        try (final var paths = Files.list(recordRoot)) {
            paths.filter(path -> path.getFileName().toString().endsWith(RECORD_FILE_SUFFIX))
                    .forEach(path -> {
                        try {
                            final var memoryRecord = mapper.readValue(path.toFile(), MemoryRecord.class);
                            cache.put(memoryRecord.getKey(), memoryRecord);
                        }
                        catch (Exception e) {
                            log.error("Failed to load record from path: {}", path, e);
                        }
                    });
        }
        log.info("Loaded {} long term records from {}", cache.size(), recordRoot);
    }
}
