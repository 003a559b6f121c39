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

import com.phonepe.leadmind.core.events.LeadEvent;
import com.phonepe.leadmind.core.events.LeadProcessedEvent;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConceptEdge;
import com.phonepe.leadmind.core.model.payloads.ConceptNode;
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.model.payloads.LeadProfile;
import com.phonepe.leadmind.core.model.payloads.PayloadType;
import com.phonepe.leadmind.memory.MemoryManager;
import com.phonepe.leadmind.memory.MemorySetup;
import com.phonepe.leadmind.memory.PutOptions;
import com.phonepe.leadmind.memory.QueryCriteria;
import com.phonepe.leadmind.memory.TestUtils;
import com.phonepe.leadmind.memory.TestUtils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.phonepe.leadmind.memory.TestUtils.EPOCH;
import static com.phonepe.leadmind.memory.TestUtils.conversation;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsolidationTest {
    private static final PutOptions TTL = PutOptions.ttl(Duration.ofHours(1));

    private MutableClock clock;
    private MemoryManager memoryManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(EPOCH);
        memoryManager = TestUtils.memoryManager(clock);
    }

    @Test
    void testSuccessfulConversationBecomesProfileAndEpisode() {
        final var events = new CopyOnWriteArrayList<LeadEvent>();
        memoryManager.getEventBus().subscribe(events::add);
        final var context = conversation("L1", "C1", 5, 0.9).toBuilder()
                .preference("budget", 5000)
                .preference("channels", List.of("email"))
                .build();
        memoryManager.put(Tier.SHORT_TERM, "C1", context, TTL);

        final var summary = memoryManager.consolidate();
        assertEquals(0, summary.getFailed());
        assertEquals(1, summary.resultFor(ShortToLongTermRule.NAME).getMigrated());
        assertEquals(1, summary.resultFor(EpisodeExtractionRule.NAME).getMigrated());

        final var profile = (LeadProfile) memoryManager.get(Tier.LONG_TERM, "L1").orElseThrow().getPayload();
        assertEquals(5000.0, ((Number) profile.getPreferences().get("budget")).doubleValue());
        assertEquals(List.of("email"), profile.getPreferences().get("channels"));
        assertEquals(5, profile.foldedInteractions());
        assertTrue(profile.getRfmScore() > 0.0);

        final var episodes = memoryManager.query(Tier.EPISODIC, QueryCriteria.builder()
                .fingerprint(((Episode) memoryManager.get(Tier.EPISODIC, EpisodeExtractionRule.episodeId("C1"))
                        .orElseThrow()
                        .getPayload()).getContextFingerprint())
                .build()).toList();
        assertEquals(1, episodes.size());
        final var episode = (Episode) episodes.get(0).getPayload();
        assertEquals(List.of("follow_up_0", "follow_up_2", "follow_up_4"), episode.getActionSequence());
        assertEquals("L1", episode.getMetadata().get(Episode.LEAD_ID));
        assertEquals("engagement", episode.getMetadata().get(Episode.AGENTS));

        await().atMost(Duration.ofSeconds(5)).until(() -> !events.isEmpty());
        assertEquals("L1", ((LeadProcessedEvent) events.get(0)).getLeadId());

        //The short term copy is left alone
        assertTrue(memoryManager.get(Tier.SHORT_TERM, "C1").isPresent());
    }

    @Test
    void testConsolidationIsIdempotent() {
        memoryManager.put(Tier.SHORT_TERM, "C1",
                          conversation("L1", "C1", 6, 0.95, "pricing", Set.of("pricing", "discount"))
                                  .withCompleted(true), TTL);
        final var first = memoryManager.consolidate();
        assertEquals(4, first.getMigrated());

        final var profileBefore = memoryManager.get(Tier.LONG_TERM, "L1").orElseThrow().getPayload();
        final var edgeKey = ConceptEdge.key("pricing", ConceptEdge.CO_OCCURS_WITH, "discount");
        final var edgeBefore = memoryManager.get(Tier.SEMANTIC, edgeKey).orElseThrow().getPayload();

        clock.advance(Duration.ofMinutes(1));
        final var second = memoryManager.consolidate();
        assertEquals(0, second.getMigrated());
        assertEquals(4, second.getSkipped());
        assertEquals(profileBefore, memoryManager.get(Tier.LONG_TERM, "L1").orElseThrow().getPayload());
        assertEquals(edgeBefore, memoryManager.get(Tier.SEMANTIC, edgeKey).orElseThrow().getPayload());
        assertEquals(1, memoryManager.query(Tier.LONG_TERM, QueryCriteria.builder()
                .payloadType(PayloadType.LEAD_PROFILE)
                .build()).toList().size());
    }

    @Test
    void testEpisodicThresholdBoundary() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.79, "s1", Set.of()), TTL);
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 1, 0.80, "s2", Set.of()), TTL);

        final var summary = memoryManager.consolidate();
        assertEquals(1, summary.resultFor(EpisodeExtractionRule.NAME).getMigrated());
        assertTrue(memoryManager.get(Tier.EPISODIC, EpisodeExtractionRule.episodeId("C1")).isEmpty());
        assertTrue(memoryManager.get(Tier.EPISODIC, EpisodeExtractionRule.episodeId("C2")).isPresent());
    }

    @Test
    void testInteractionThreshold() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 4, 0.5), TTL);
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 5, 0.5), TTL);

        memoryManager.consolidate();
        assertTrue(memoryManager.get(Tier.LONG_TERM, "L1").isEmpty());
        assertTrue(memoryManager.get(Tier.LONG_TERM, "L2").isPresent());
    }

    @Test
    void testOutcomeAloneFoldsOnlyWhenEnabled() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.9), TTL);
        memoryManager.consolidate();
        assertTrue(memoryManager.get(Tier.LONG_TERM, "L1").isEmpty());

        final var manager = TestUtils.memoryManager(clock, MemorySetup.DEFAULT.withLongTermOutcomeThreshold(0.8));
        manager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.9), TTL);
        final var summary = manager.consolidate();
        assertEquals(1, summary.resultFor(ShortToLongTermRule.NAME).getMigrated());
        assertTrue(manager.get(Tier.LONG_TERM, "L1").isPresent());
    }

    @Test
    void testGrownConversationFoldsOnlyTheDelta() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 5, 0.5).toBuilder()
                .preference("budget", 1000)
                .build(), TTL);
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L1", "C2", 5, 0.5).toBuilder()
                .preference("budget", 3000)
                .build(), TTL);
        memoryManager.consolidate();
        var profile = (LeadProfile) memoryManager.get(Tier.LONG_TERM, "L1").orElseThrow().getPayload();
        assertEquals(2000.0, ((Number) profile.getPreferences().get("budget")).doubleValue(), 1e-9);

        //Five more interactions on C1 now lean towards 6000
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 10, 0.5).toBuilder()
                .preference("budget", 6000)
                .build(), TTL);
        final var summary = memoryManager.consolidate();
        assertEquals(1, summary.resultFor(ShortToLongTermRule.NAME).getMigrated());
        assertEquals(1, summary.resultFor(ShortToLongTermRule.NAME).getSkipped());
        profile = (LeadProfile) memoryManager.get(Tier.LONG_TERM, "L1").orElseThrow().getPayload();
        assertEquals((2000.0 * 10 + 6000.0 * 5) / 15, ((Number) profile.getPreferences().get("budget")).doubleValue(),
                     1e-9);
        assertEquals(15, profile.foldedInteractions());
        assertEquals(2, profile.getInteractionSummaries().size());
    }

    @Test
    void testNearIdenticalEpisodesAreDeduplicated() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 3, 0.9), TTL);
        memoryManager.put(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 3, 0.85), TTL);
        memoryManager.put(Tier.SHORT_TERM, "C3", conversation("L3", "C3", 3, 0.85, "renewal", Set.of()), TTL);

        final var result = memoryManager.consolidate().resultFor(EpisodeExtractionRule.NAME);
        assertEquals(2, result.getMigrated());
        assertEquals(1, result.getSkipped());
    }

    @Test
    void testConceptAssociation() {
        final var setup = MemorySetup.DEFAULT;
        memoryManager.put(Tier.SHORT_TERM, "C1",
                          conversation("L1", "C1", 2, 0.9, "pricing", Set.of("pricing", "discount"))
                                  .withCompleted(true), TTL);
        //Not completed, ignored
        memoryManager.put(Tier.SHORT_TERM, "C2",
                          conversation("L2", "C2", 2, 0.9, "pricing", Set.of("pricing", "budget")), TTL);
        //Too weak
        memoryManager.put(Tier.SHORT_TERM, "C3",
                          conversation("L3", "C3", 2, 0.6, "pricing", Set.of("pricing", "budget"))
                                  .withCompleted(true), TTL);

        final var result = memoryManager.consolidate().resultFor(ConceptAssociationRule.NAME);
        assertEquals(2, result.getMigrated());
        final var forward = edge("pricing", "discount");
        final var backward = edge("discount", "pricing");
        assertEquals(0.9, forward.getStrength(), 1e-9);
        assertEquals(0.9, backward.getStrength(), 1e-9);
        assertEquals(Set.of("C1"), forward.getObservations());
        assertTrue(memoryManager.get(Tier.SEMANTIC, ConceptNode.key("pricing")).isPresent());
        assertTrue(memoryManager.get(Tier.SEMANTIC, ConceptEdge.key("pricing", ConceptEdge.CO_OCCURS_WITH,
                                                                    "budget")).isEmpty());

        //A second conversation moves the strength by the smoothing factor
        memoryManager.put(Tier.SHORT_TERM, "C4",
                          conversation("L4", "C4", 2, 0.8, "pricing", Set.of("pricing", "discount"))
                                  .withCompleted(true), TTL);
        memoryManager.consolidate();
        final var alpha = setup.getStrengthSmoothing();
        assertEquals(alpha * 0.8 + (1 - alpha) * 0.9, edge("pricing", "discount").getStrength(), 1e-9);
        assertEquals(Set.of("C1", "C4"), edge("pricing", "discount").getObservations());
    }

    @Test
    void testAssociationStrength() {
        final List<Set<String>> events = List.of(Set.of("a", "b"), Set.of("a"), Set.of("b", "c"), Set.of("a", "b"));
        assertEquals(0.9 * 2 / 4, ConceptAssociationRule.associationStrength(events, "a", "b", 0.9), 1e-9);
        assertEquals(0.0, ConceptAssociationRule.associationStrength(events, "a", "z", 0.9));
        assertEquals(0.0, ConceptAssociationRule.associationStrength(List.of(), "a", "b", 0.9));
    }

    @Test
    void testThresholdsAreIndependent() {
        final var manager = TestUtils.memoryManager(clock, MemorySetup.DEFAULT
                .withEpisodicThreshold(0.5)
                .withLongTermInteractionThreshold(2));
        manager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 2, 0.6), TTL);
        final var summary = manager.consolidate();
        assertEquals(1, summary.resultFor(ShortToLongTermRule.NAME).getMigrated());
        assertEquals(1, summary.resultFor(EpisodeExtractionRule.NAME).getMigrated());
    }

    @Test
    void testExpiredConversationsAreNotConsolidated() {
        memoryManager.put(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 5, 0.9),
                          PutOptions.ttl(Duration.ofSeconds(1)));
        clock.advance(Duration.ofSeconds(2));
        assertEquals(0, memoryManager.consolidate().getMigrated());
    }

    private ConceptEdge edge(String from, String to) {
        return (ConceptEdge) memoryManager.get(Tier.SEMANTIC, ConceptEdge.key(from, ConceptEdge.CO_OCCURS_WITH, to))
                .orElseThrow()
                .getPayload();
    }
}
