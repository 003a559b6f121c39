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
import com.phonepe.leadmind.core.store.SemanticStore;
import com.phonepe.leadmind.core.store.TraversalHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adjacency list graph kept in memory
 */
public class InMemorySemanticStore implements SemanticStore {
    private static final Comparator<MemoryRecord> STRONGEST_FIRST = Comparator.comparingDouble(
            (MemoryRecord memoryRecord) -> ((ConceptEdge) memoryRecord.getPayload()).getStrength()).reversed();

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> outgoing = new ConcurrentHashMap<>();

    @Override
    public Tier tier() {
        return Tier.SEMANTIC;
    }

    @Override
    public void write(MemoryRecord memoryRecord) {
        if (memoryRecord.getPayload() instanceof ConceptEdge edge) {
            ensureNode(edge.getFromConcept(), memoryRecord);
            ensureNode(edge.getToConcept(), memoryRecord);
            outgoing.computeIfAbsent(edge.getFromConcept(), concept -> ConcurrentHashMap.newKeySet())
                    .add(memoryRecord.getKey());
        }
        records.put(memoryRecord.getKey(), memoryRecord);
    }

    @Override
    public Optional<MemoryRecord> read(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public List<TraversalHit> traverse(String startConcept, int maxDepth, Set<String> relationTypes, int limit) {
        final var hits = new ArrayList<TraversalHit>();
        final var visited = new HashSet<String>();
        visited.add(startConcept);
        var frontier = List.of(startConcept);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty() && hits.size() < limit; depth++) {
            final var next = new ArrayList<String>();
            final var edges = frontier.stream()
                    .flatMap(concept -> outgoing.getOrDefault(concept, Set.of()).stream())
                    .map(records::get)
                    .filter(edgeRecord -> edgeRecord != null && (relationTypes.isEmpty()
                            || relationTypes.contains(((ConceptEdge) edgeRecord.getPayload()).getRelationType())))
                    .sorted(STRONGEST_FIRST)
                    .toList();
            for (final var edgeRecord : edges) {
                if (hits.size() >= limit) {
                    break;
                }
                final var target = ((ConceptEdge) edgeRecord.getPayload()).getToConcept();
                //Edges leading back into already reached concepts are cycles
                if (visited.contains(target)) {
                    continue;
                }
                hits.add(new TraversalHit(edgeRecord, depth));
                if (!next.contains(target)) {
                    next.add(target);
                }
            }
            visited.addAll(next);
            frontier = next;
        }
        return hits;
    }

    private void ensureNode(String name, MemoryRecord edgeRecord) {
        records.computeIfAbsent(ConceptNode.key(name), key -> MemoryRecord.builder()
                .tier(Tier.SEMANTIC)
                .key(key)
                .payload(ConceptNode.builder()
                                 .name(name)
                                 .category(ConceptNode.DEFAULT_CATEGORY)
                                 .build())
                .createdAt(edgeRecord.getCreatedAt())
                .lastAccessedAt(edgeRecord.getLastAccessedAt())
                .build());
    }
}
