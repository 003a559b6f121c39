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

package com.phonepe.leadmind.memory;

import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.ConversationEventType;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.retry.RetrySetup;
import com.phonepe.leadmind.core.retry.RetryingExecutor;
import com.phonepe.leadmind.memory.stores.InMemoryEpisodicStore;
import com.phonepe.leadmind.memory.stores.InMemoryLongTermStore;
import com.phonepe.leadmind.memory.stores.InMemorySemanticStore;
import com.phonepe.leadmind.memory.stores.InMemoryShortTermStore;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared fixtures for memory tests
 */
@UtilityClass
public class TestUtils {
    public static final Instant EPOCH = Instant.parse("2025-01-01T10:00:00Z");
    public static final RetrySetup FAST_RETRY = RetrySetup.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(10))
            .build();

    /**
     * A clock tests can move forward by hand
     */
    public static final class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    public static MemoryManager memoryManager(MutableClock clock) {
        return memoryManager(clock, MemorySetup.DEFAULT);
    }

    public static MemoryManager memoryManager(MutableClock clock, MemorySetup setup) {
        return MemoryManager.builder()
                .shortTermStore(new InMemoryShortTermStore(clock))
                .longTermStore(new InMemoryLongTermStore())
                .episodicStore(new InMemoryEpisodicStore(setup.getFingerprintDimension()))
                .semanticStore(new InMemorySemanticStore())
                .setup(setup)
                .retryingExecutor(new RetryingExecutor(FAST_RETRY))
                .clock(clock)
                .build();
    }

    /**
     * A conversation with one agent action per interaction, each mentioning the given concepts
     */
    public static ConversationContext conversation(
            String leadId,
            String conversationId,
            int interactions,
            double outcome,
            String scenarioTag,
            Set<String> concepts) {
        final var builder = ConversationContext.builder()
                .leadId(leadId)
                .conversationId(conversationId)
                .currentAgent("engagement")
                .interactionCount(interactions)
                .lastOutcomeScore(outcome)
                .scenarioTag(scenarioTag)
                .concepts(concepts);
        for (int i = 0; i < interactions; i++) {
            builder.event(ConversationEvent.builder()
                                  .sequence(i)
                                  .type(i % 2 == 0
                                        ? ConversationEventType.AGENT_ACTION
                                        : ConversationEventType.LEAD_MESSAGE)
                                  .actor(i % 2 == 0 ? "engagement" : leadId)
                                  .action(i % 2 == 0 ? "follow_up_" + i : "reply")
                                  .concepts(concepts)
                                  .timestamp(EPOCH.plusSeconds(i))
                                  .build());
        }
        return builder.build();
    }

    public static ConversationContext conversation(String leadId, String conversationId, int interactions,
                                                   double outcome) {
        return conversation(leadId, conversationId, interactions, outcome, "pricing", Set.of());
    }

    public static List<String> keys(Iterable<MemoryRecord> records) {
        final var keys = new ArrayList<String>();
        records.forEach(memoryRecord -> keys.add(memoryRecord.getKey()));
        return keys;
    }
}
