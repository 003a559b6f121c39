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
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.store.EpisodicStore;
import com.phonepe.leadmind.core.store.ScoredRecord;
import com.phonepe.leadmind.core.utils.VectorUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute force cosine similarity search over episodes kept in memory
 */
public class InMemoryEpisodicStore implements EpisodicStore {
    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final int dimension;

    public InMemoryEpisodicStore(int dimension) {
        Preconditions.checkArgument(dimension > 0, "Fingerprint dimension must be positive");
        this.dimension = dimension;
    }

    @Override
    public Tier tier() {
        return Tier.EPISODIC;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void write(MemoryRecord memoryRecord) {
        final var episode = (Episode) memoryRecord.getPayload();
        Preconditions.checkArgument(episode.getContextFingerprint() != null
                                            && episode.getContextFingerprint().length == dimension,
                                    "Episode %s fingerprint must have dimension %s", memoryRecord.getKey(), dimension);
        records.put(memoryRecord.getKey(), memoryRecord);
    }

    @Override
    public Optional<MemoryRecord> read(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public List<ScoredRecord> nearest(float[] fingerprint, String scenarioTag, double minSimilarity, int limit) {
        return records.values()
                .stream()
                .filter(memoryRecord -> scenarioTag == null
                        || Objects.equals(scenarioTag, ((Episode) memoryRecord.getPayload()).getScenarioTag()))
                .map(memoryRecord -> new ScoredRecord(
                        memoryRecord,
                        VectorUtils.cosineSimilarity(fingerprint,
                                                     ((Episode) memoryRecord.getPayload()).getContextFingerprint())))
                .filter(scored -> scored.getScore() >= minSimilarity)
                .sorted(Comparator.comparingDouble(ScoredRecord::getScore).reversed())
                .limit(limit)
                .toList();
    }
}
