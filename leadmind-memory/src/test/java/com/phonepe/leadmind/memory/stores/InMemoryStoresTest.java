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
import com.phonepe.leadmind.core.model.payloads.ConceptEdge;
import com.phonepe.leadmind.core.model.payloads.ConceptNode;
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.model.payloads.MemoryPayload;
import com.phonepe.leadmind.core.store.ScoredRecord;
import com.phonepe.leadmind.core.store.TraversalHit;
import com.phonepe.leadmind.memory.TestUtils.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.phonepe.leadmind.memory.TestUtils.EPOCH;
import static com.phonepe.leadmind.memory.TestUtils.conversation;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStoresTest {

    @Test
    void testShortTermScanAndPurge() {
        final var clock = new MutableClock(EPOCH);
        final var store = new InMemoryShortTermStore(clock);
        store.write(record(Tier.SHORT_TERM, "C1", conversation("L1", "C1", 1, 0.1), EPOCH, EPOCH.plusSeconds(10)));
        store.write(record(Tier.SHORT_TERM, "C2", conversation("L2", "C2", 1, 0.1), EPOCH.plusSeconds(1),
                           EPOCH.plusSeconds(60)));
        assertEquals(List.of("C2", "C1"), store.scanLive(EPOCH.plusSeconds(5)).stream()
                .map(MemoryRecord::getKey)
                .toList());

        store.touch("C1", EPOCH.plusSeconds(6));
        assertEquals("C1", store.scanLive(EPOCH.plusSeconds(7)).get(0).getKey());

        assertEquals(List.of("C2"), store.scanLive(EPOCH.plusSeconds(10)).stream()
                .map(MemoryRecord::getKey)
                .toList());
        assertEquals(1, store.purgeExpired(EPOCH.plusSeconds(10)));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(store.read("C2").isEmpty());
        assertThrows(IllegalArgumentException.class,
                     () -> store.write(record(Tier.SHORT_TERM, "C3", conversation("L3", "C3", 1, 0.1), EPOCH, null)));
    }

    @Test
    void testEpisodicScenarioFilterAndOrdering() {
        final var store = new InMemoryEpisodicStore(2);
        store.write(record(Tier.EPISODIC, "E1", episode("E1", "pricing", 1.0f, 0.0f), EPOCH, null));
        store.write(record(Tier.EPISODIC, "E2", episode("E2", "pricing", 0.9f, 0.1f), EPOCH, null));
        store.write(record(Tier.EPISODIC, "E3", episode("E3", "renewal", 1.0f, 0.0f), EPOCH, null));

        final var hits = store.nearest(new float[]{0.9f, 0.1f}, "pricing", 0.5, 10);
        assertEquals(List.of("E2", "E1"), hits.stream().map(hit -> hit.getMemoryRecord().getKey()).toList());
        assertEquals(1.0, hits.get(0).getScore(), 1e-6);

        assertEquals(3, store.nearest(new float[]{1.0f, 0.0f}, null, 0.5, 10).size());
        assertEquals(1, store.nearest(new float[]{1.0f, 0.0f}, null, 0.5, 1).size());
        assertEquals(List.of(), store.nearest(new float[]{0.0f, 1.0f}, "renewal", 0.5, 10)
                .stream()
                .map(ScoredRecord::getScore)
                .toList());
        assertThrows(IllegalArgumentException.class,
                     () -> store.write(record(Tier.EPISODIC, "E4", episode("E4", "pricing", 1.0f, 0.0f, 0.0f),
                                              EPOCH, null)));
    }

    @Test
    void testSemanticTraversal() {
        final var store = new InMemorySemanticStore();
        store.write(edge("a", "b", "co_occurs_with", 0.7));
        store.write(edge("a", "c", "co_occurs_with", 0.9));
        store.write(edge("a", "d", "leads_to", 0.95));
        store.write(edge("b", "a", "co_occurs_with", 0.7));
        store.write(edge("c", "e", "co_occurs_with", 0.8));

        final var all = store.traverse("a", 2, Set.of(), 10);
        assertEquals(List.of("a>d", "a>c", "a>b", "c>e"), names(all));
        assertEquals(List.of(1, 1, 1, 2), all.stream().map(TraversalHit::getDepth).toList());

        assertEquals(List.of("a>c", "a>b"), names(store.traverse("a", 1, Set.of("co_occurs_with"), 10)));
        assertEquals(List.of("a>d"), names(store.traverse("a", 2, Set.of(), 1)));
        assertTrue(store.traverse("unknown", 2, Set.of(), 10).isEmpty());

        final var node = store.read(ConceptNode.key("e")).orElseThrow();
        assertEquals(ConceptNode.DEFAULT_CATEGORY, ((ConceptNode) node.getPayload()).getCategory());
    }

    private static List<String> names(List<TraversalHit> hits) {
        return hits.stream()
                .map(hit -> (ConceptEdge) hit.getEdge().getPayload())
                .map(edge -> edge.getFromConcept() + ">" + edge.getToConcept())
                .toList();
    }

    private static MemoryRecord edge(String from, String to, String relation, double strength) {
        final var edge = ConceptEdge.builder()
                .fromConcept(from)
                .toConcept(to)
                .relationType(relation)
                .strength(strength)
                .build();
        return record(Tier.SEMANTIC, edge.key(), edge, EPOCH, null);
    }

    private static Episode episode(String episodeId, String scenario, float... fingerprint) {
        return Episode.builder()
                .episodeId(episodeId)
                .scenarioTag(scenario)
                .contextFingerprint(fingerprint)
                .outcomeScore(0.9)
                .build();
    }

    private static MemoryRecord record(Tier tier, String key, MemoryPayload payload, Instant accessedAt,
                                       Instant expiresAt) {
        return MemoryRecord.builder()
                .tier(tier)
                .key(key)
                .payload(payload)
                .createdAt(accessedAt)
                .lastAccessedAt(accessedAt)
                .expiresAt(expiresAt)
                .build();
    }
}
