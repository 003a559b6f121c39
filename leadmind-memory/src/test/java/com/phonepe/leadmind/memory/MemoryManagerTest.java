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

import com.phonepe.leadmind.core.errors.UnavailableError;
import com.phonepe.leadmind.core.errors.ValidationError;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.AgentActionLog;
import com.phonepe.leadmind.core.model.payloads.ConceptEdge;
import com.phonepe.leadmind.core.model.payloads.ConceptNode;
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.model.payloads.HandoffAudit;
import com.phonepe.leadmind.core.model.payloads.LeadProfile;
import com.phonepe.leadmind.core.model.payloads.PayloadType;
import com.phonepe.leadmind.core.retry.RetryingExecutor;
import com.phonepe.leadmind.core.store.LongTermStore;
import com.phonepe.leadmind.memory.TestUtils.MutableClock;
import com.phonepe.leadmind.memory.stores.InMemoryEpisodicStore;
import com.phonepe.leadmind.memory.stores.InMemorySemanticStore;
import com.phonepe.leadmind.memory.stores.InMemoryShortTermStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phonepe.leadmind.memory.TestUtils.EPOCH;
import static com.phonepe.leadmind.memory.TestUtils.conversation;
import static com.phonepe.leadmind.memory.TestUtils.keys;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryManagerTest {
    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    private MutableClock clock;
    private MemoryManager memoryManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(EPOCH);
        memoryManager = TestUtils.memoryManager(clock);
    }

    @Test
    void testShortTermRecordExpires() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.2),
                          PutOptions.ttl(Duration.ofSeconds(1)));

        clock.advance(Duration.ofMillis(500));
        assertTrue(memoryManager.get(Tier.SHORT_TERM, "C1").isPresent());

        clock.advance(Duration.ofMillis(1500));
        assertTrue(memoryManager.get(Tier.SHORT_TERM, "C1").isEmpty());
        assertTrue(memoryManager.query(Tier.SHORT_TERM, QueryCriteria.all()).toList().isEmpty());
    }

    @Test
    void testPurgeRemovesExpiredRecords() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.2),
                          PutOptions.ttl(Duration.ofSeconds(1)));
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 1, 0.2), PutOptions.ttl(ONE_MINUTE));
        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, memoryManager.purgeExpired());
        assertEquals(0, memoryManager.purgeExpired());
        assertTrue(memoryManager.get(Tier.SHORT_TERM, "C2").isPresent());
    }

    @Test
    void testOverwriteKeepsCreationTime() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.2), PutOptions.ttl(ONE_MINUTE));
        clock.advance(Duration.ofSeconds(10));
        final var stored = memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 2, 0.3),
                                             PutOptions.ttl(ONE_MINUTE));
        assertEquals(EPOCH, stored.getCreatedAt());
        assertEquals(EPOCH.plusSeconds(10), stored.getLastAccessedAt());
        assertEquals(EPOCH.plusSeconds(70), stored.getExpiresAt());

        clock.advance(Duration.ofSeconds(5));
        final var read = memoryManager.get(Tier.SHORT_TERM, "C1").orElseThrow();
        assertEquals(EPOCH.plusSeconds(15), read.getLastAccessedAt());
    }

    @Test
    void testValidation() {
        final var context = conversation("L1", "C1", 1, 0.2);
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.SHORT_TERM, "C1", context, PutOptions.NONE));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.SHORT_TERM, "other-key", context, PutOptions.ttl(ONE_MINUTE)));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.LONG_TERM, "C1", context, PutOptions.NONE));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.LONG_TERM, "L1",
                                             LeadProfile.builder().leadId("L1").build(), PutOptions.NONE));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.LONG_TERM, "A1",
                                             AgentActionLog.builder()
                                                     .actionId("A1")
                                                     .agentId("scoring")
                                                     .actionType("score")
                                                     .build(),
                                             PutOptions.ttl(ONE_MINUTE)));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.EPISODIC, "E1",
                                             Episode.builder()
                                                     .episodeId("E1")
                                                     .contextFingerprint(new float[3])
                                                     .outcomeScore(0.9)
                                                     .build()));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.SEMANTIC, "edge:a|rel|",
                                             ConceptEdge.builder().fromConcept("a").relationType("rel").build()));
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 1.5),
                                             PutOptions.ttl(ONE_MINUTE)));
        assertTrue(memoryManager.get(Tier.SHORT_TERM, "C1").isEmpty());

        // Episodes only record successes
        assertThrows(ValidationError.class,
                     () -> memoryManager.put(Tier.EPISODIC, "E1",
                                             Episode.builder()
                                                     .episodeId("E1")
                                                     .scenarioTag("pricing")
                                                     .contextFingerprint(
                                                             new float[MemorySetup.DEFAULT_FINGERPRINT_DIMENSION])
                                                     .outcomeScore(0.1)
                                                     .build()));
        assertTrue(memoryManager.get(Tier.EPISODIC, "E1").isEmpty());
    }

    @Test
    void testLongTermQueryByPredicate() {
        memoryManager.put(Tier.LONG_TERM, "H1", audit("H1", "L1"), PutOptions.builder().tag("lead:L1").build());
        clock.advance(Duration.ofSeconds(1));
        memoryManager.put(Tier.LONG_TERM, "H2", audit("H2", "L2"), PutOptions.builder().tag("lead:L2").build());
        clock.advance(Duration.ofSeconds(1));
        memoryManager.put(Tier.LONG_TERM, "A1", AgentActionLog.builder()
                .actionId("A1")
                .agentId("scoring")
                .leadId("L1")
                .actionType("score")
                .detail("score", 82)
                .build());

        assertEquals(List.of("A1", "H2", "H1"), keys(memoryManager.query(Tier.LONG_TERM, QueryCriteria.all())));
        assertEquals(List.of("H2", "H1"),
                     keys(memoryManager.query(Tier.LONG_TERM, QueryCriteria.builder()
                             .payloadType(PayloadType.HANDOFF_AUDIT)
                             .build())));
        assertEquals(List.of("H1"),
                     keys(memoryManager.query(Tier.LONG_TERM, QueryCriteria.builder().tag("lead:L1").build())));
        assertEquals(List.of("A1"),
                     keys(memoryManager.query(Tier.LONG_TERM, QueryCriteria.builder().limit(1).build())));
    }

    @Test
    void testQueryIsLazyAndRestartable() {
        final var sequence = memoryManager.query(Tier.SHORT_TERM, QueryCriteria.all());
        assertTrue(sequence.toList().isEmpty());

        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.2), PutOptions.ttl(ONE_MINUTE));
        clock.advance(Duration.ofSeconds(1));
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 1, 0.2), PutOptions.ttl(ONE_MINUTE));

        assertEquals(List.of("C2", "C1"), keys(sequence));
        assertEquals(List.of("C2", "C1"), keys(sequence));
        assertEquals(2, sequence.stream().count());
    }

    @Test
    void testEpisodicQueryOrdersBySimilarity() {
        final var setup = MemorySetup.DEFAULT.withFingerprintDimension(2);
        final var manager = TestUtils.memoryManager(clock, setup);
        manager.put(Tier.EPISODIC, "E1", episode("E1", new float[]{1.0f, 0.0f}));
        manager.put(Tier.EPISODIC, "E2", episode("E2", new float[]{0.8f, 0.6f}));
        manager.put(Tier.EPISODIC, "E3", episode("E3", new float[]{0.0f, 1.0f}));

        final var hits = manager.query(Tier.EPISODIC, QueryCriteria.builder()
                .fingerprint(new float[]{1.0f, 0.0f})
                .build());
        assertEquals(List.of("E1", "E2"), keys(hits));

        assertThrows(ValidationError.class, () -> manager.query(Tier.EPISODIC, QueryCriteria.all()));
        assertThrows(ValidationError.class,
                     () -> manager.query(Tier.EPISODIC, QueryCriteria.builder().fingerprint(new float[3]).build()));
    }

    @Test
    void testSemanticQueryTraversesGraph() {
        memoryManager.put(Tier.SEMANTIC, ConceptNode.key("pricing"),
                          ConceptNode.builder().name("pricing").category("topic").build());
        putEdge("pricing", "discount", 0.9);
        putEdge("pricing", "budget", 0.75);
        putEdge("discount", "renewal", 0.8);
        putEdge("renewal", "churn", 0.8);

        final var edges = memoryManager.query(Tier.SEMANTIC, QueryCriteria.builder()
                .startConcept("pricing")
                .build());
        assertEquals(List.of(ConceptEdge.key("pricing", ConceptEdge.CO_OCCURS_WITH, "discount"),
                             ConceptEdge.key("pricing", ConceptEdge.CO_OCCURS_WITH, "budget"),
                             ConceptEdge.key("discount", ConceptEdge.CO_OCCURS_WITH, "renewal")),
                     keys(edges));
        assertEquals(1, memoryManager.query(Tier.SEMANTIC, QueryCriteria.builder()
                .startConcept("pricing")
                .maxDepth(1)
                .limit(1)
                .build()).toList().size());
        assertThrows(ValidationError.class, () -> memoryManager.query(Tier.SEMANTIC, QueryCriteria.all()));
    }

    @Test
    void testTransientStoreFailuresAreRetried() {
        final var longTermStore = mock(LongTermStore.class);
        when(longTermStore.tier()).thenReturn(Tier.LONG_TERM);
        when(longTermStore.read(anyString())).thenReturn(Optional.empty());
        doThrow(new UnavailableError("disk busy"))
                .doThrow(new UnavailableError("disk busy"))
                .doNothing()
                .when(longTermStore).write(any(MemoryRecord.class));
        final var manager = managerWith(longTermStore);

        manager.put(Tier.LONG_TERM, "H1", audit("H1", "L1"));
        verify(longTermStore, times(3)).write(any(MemoryRecord.class));
    }

    @Test
    void testPersistentStoreFailureSurfaces() {
        final var longTermStore = mock(LongTermStore.class);
        when(longTermStore.tier()).thenReturn(Tier.LONG_TERM);
        when(longTermStore.read(anyString())).thenThrow(new UnavailableError("disk gone"));
        final var manager = managerWith(longTermStore);

        final var error = assertThrows(UnavailableError.class, () -> manager.get(Tier.LONG_TERM, "H1"));
        assertTrue(error.isRetryable());
        verify(longTermStore, times(3)).read("H1");
    }

    @Test
    void testConcurrentWritesToDifferentKeys() throws Exception {
        final var executorService = Executors.newFixedThreadPool(8);
        try {
            final var tasks = new ArrayList<Callable<MemoryRecord>>();
            for (int i = 0; i < 100; i++) {
                final var conversationId = "C" + i;
                tasks.add(() -> memoryManager.put(Tier.SHORT_TERM, conversationId,
                                                  conversation("L" + (conversationId.hashCode() % 5), conversationId,
                                                               1, 0.1),
                                                  PutOptions.ttl(ONE_MINUTE)));
            }
            for (final var future : executorService.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                future.get();
            }
        }
        finally {
            executorService.shutdownNow();
        }
        assertEquals(100, memoryManager.query(Tier.SHORT_TERM, QueryCriteria.builder().limit(1000).build())
                .toList()
                .size());
    }

    private MemoryManager managerWith(LongTermStore longTermStore) {
        doNothing().when(longTermStore).touch(anyString(), any());
        return MemoryManager.builder()
                .shortTermStore(new InMemoryShortTermStore(clock))
                .longTermStore(longTermStore)
                .episodicStore(new InMemoryEpisodicStore(MemorySetup.DEFAULT_FINGERPRINT_DIMENSION))
                .semanticStore(new InMemorySemanticStore())
                .retryingExecutor(new RetryingExecutor(TestUtils.FAST_RETRY))
                .clock(clock)
                .build();
    }

    private void putEdge(String from, String to, double strength) {
        final var edge = ConceptEdge.builder()
                .fromConcept(from)
                .toConcept(to)
                .relationType(ConceptEdge.CO_OCCURS_WITH)
                .strength(strength)
                .build();
        memoryManager.put(Tier.SEMANTIC, edge.key(), edge);
    }

    private static HandoffAudit audit(String handoffId, String leadId) {
        return HandoffAudit.builder()
                .handoffId(handoffId)
                .leadId(leadId)
                .sourceAgent("scoring")
                .targetAgent("engagement")
                .recordedAt(EPOCH)
                .build();
    }

    private static Episode episode(String episodeId, float[] fingerprint) {
        return Episode.builder()
                .episodeId(episodeId)
                .scenarioTag("pricing")
                .contextFingerprint(fingerprint)
                .outcomeScore(0.9)
                .build();
    }
}
