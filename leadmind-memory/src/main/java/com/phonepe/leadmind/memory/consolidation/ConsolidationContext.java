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

package com.phonepe.leadmind.memory.consolidation;

import com.phonepe.leadmind.core.events.EventBus;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.model.payloads.MemoryPayload;
import com.phonepe.leadmind.core.retry.RetryingExecutor;
import com.phonepe.leadmind.core.store.EpisodicStore;
import com.phonepe.leadmind.core.store.LongTermStore;
import com.phonepe.leadmind.core.store.SemanticStore;
import com.phonepe.leadmind.core.store.ShortTermStore;
import com.phonepe.leadmind.core.store.TierStore;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import com.phonepe.leadmind.memory.MemorySetup;
import com.phonepe.leadmind.memory.fingerprint.FingerprintModel;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything a rule needs to read from and write to the tiers. Store access goes through the retrying executor.
 */
@Value
@Builder
public class ConsolidationContext {
    @NonNull
    MemorySetup setup;
    @NonNull
    ShortTermStore shortTermStore;
    @NonNull
    LongTermStore longTermStore;
    @NonNull
    EpisodicStore episodicStore;
    @NonNull
    SemanticStore semanticStore;
    @NonNull
    RetryingExecutor retryingExecutor;
    @NonNull
    KeyedLocks keyedLocks;
    @NonNull
    FingerprintModel fingerprintModel;
    @NonNull
    EventBus eventBus;
    @NonNull
    Clock clock;
    /**
     * Single reference time for the pass, so every rule sees the same set of live records
     */
    @NonNull
    Instant startedAt;

    /**
     * @return Live conversation contexts, most recently accessed first
     */
    public List<MemoryRecord> liveConversations() {
        return retryingExecutor.call("scan short_term", () -> shortTermStore.scanLive(startedAt))
                .stream()
                .filter(memoryRecord -> memoryRecord.getPayload() instanceof ConversationContext)
                .toList();
    }

    public Optional<MemoryRecord> read(TierStore store, String key) {
        return retryingExecutor.call("read " + store.tier().wireName(), () -> store.read(key));
    }

    public void write(TierStore store, MemoryRecord memoryRecord) {
        retryingExecutor.run("write " + store.tier().wireName(), () -> store.write(memoryRecord));
    }

    /**
     * Builds a record for a derived payload, keeping the creation time of the record it replaces
     */
    public MemoryRecord derivedRecord(Tier tier, String key, MemoryPayload payload,
                                      Optional<MemoryRecord> existing) {
        final var now = clock.instant();
        return MemoryRecord.builder()
                .tier(tier)
                .key(key)
                .payload(payload)
                .createdAt(existing.map(MemoryRecord::getCreatedAt).orElse(now))
                .lastAccessedAt(now)
                .build();
    }
}
