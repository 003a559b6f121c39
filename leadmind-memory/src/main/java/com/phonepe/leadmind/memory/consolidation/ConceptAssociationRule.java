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

import com.phonepe.leadmind.core.errors.LeadmindException;
import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConceptEdge;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Strengthens {@code co_occurs_with} edges between concepts that appear together in completed conversations.
 * <p>
 * For a pair (a, b) the association strength of one conversation is its outcome score multiplied by the share of
 * concept bearing events that mention both, among those mentioning either. Strong enough pairs are blended into the
 * existing edge in both directions with an exponential moving average. Each edge remembers the conversations it has
 * seen, so a conversation contributes to an edge only once.
 */
@Slf4j
public class ConceptAssociationRule implements ConsolidationRule {
    public static final String NAME = "concept_association";

    private enum Outcome {
        STRENGTHENED,
        ALREADY_OBSERVED,
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleResult apply(ConsolidationContext context) {
        int migrated = 0;
        int skipped = 0;
        int failed = 0;
        final var errors = new ArrayList<String>();
        for (final var conversationRecord : context.liveConversations()) {
            final var conversation = (ConversationContext) conversationRecord.getPayload();
            if (!conversation.isCompleted()) {
                continue;
            }
            try {
                final var outcomes = context.getKeyedLocks()
                        .withLock(KeyedLocks.leadKey(conversation.getLeadId()),
                                  () -> associate(context, conversation));
                for (final var outcome : outcomes) {
                    if (outcome == Outcome.STRENGTHENED) {
                        migrated++;
                    }
                    else {
                        skipped++;
                    }
                }
            }
            catch (LeadmindException e) {
                failed++;
                errors.add("%s: conversation %s: %s".formatted(NAME, conversation.getConversationId(), e.getMessage()));
                log.error("Error associating concepts of conversation {} for lead {}: {}",
                          conversation.getConversationId(), conversation.getLeadId(), e.getMessage());
            }
        }
        return RuleResult.builder()
                .ruleName(NAME)
                .migrated(migrated)
                .skipped(skipped)
                .failed(failed)
                .errors(errors)
                .build();
    }

    /**
     * Association strength of a concept pair within one set of events
     */
    public static double associationStrength(
            List<Set<String>> eventConcepts,
            String first,
            String second,
            double outcomeScore) {
        int both = 0;
        int either = 0;
        for (final var concepts : eventConcepts) {
            final var hasFirst = concepts.contains(first);
            final var hasSecond = concepts.contains(second);
            if (hasFirst && hasSecond) {
                both++;
            }
            if (hasFirst || hasSecond) {
                either++;
            }
        }
        return either == 0 ? 0.0 : outcomeScore * both / either;
    }

    private List<Outcome> associate(ConsolidationContext context, ConversationContext conversation) {
        final var eventConcepts = conversation.getHistory()
                .stream()
                .map(ConversationEvent::getConcepts)
                .filter(concepts -> !concepts.isEmpty())
                .toList();
        final var allConcepts = new ArrayList<>(new TreeSet<>(eventConcepts.stream()
                                                                     .flatMap(Set::stream)
                                                                     .toList()));
        final var outcomes = new ArrayList<Outcome>();
        final var threshold = context.getSetup().getSemanticThreshold();
        for (int i = 0; i < allConcepts.size(); i++) {
            for (int j = i + 1; j < allConcepts.size(); j++) {
                final var first = allConcepts.get(i);
                final var second = allConcepts.get(j);
                final var strength = associationStrength(eventConcepts, first, second,
                                                         conversation.getLastOutcomeScore());
                if (strength < threshold) {
                    continue;
                }
                outcomes.add(upsertEdge(context, first, second, strength, conversation.getConversationId()));
                outcomes.add(upsertEdge(context, second, first, strength, conversation.getConversationId()));
            }
        }
        return outcomes;
    }

    private Outcome upsertEdge(
            ConsolidationContext context,
            String from,
            String to,
            double observedStrength,
            String conversationId) {
        final var semanticStore = context.getSemanticStore();
        final var key = ConceptEdge.key(from, ConceptEdge.CO_OCCURS_WITH, to);
        return context.getKeyedLocks().withLock(KeyedLocks.recordKey(Tier.SEMANTIC.wireName(), key), () -> {
            final var existingRecord = context.read(semanticStore, key);
            final var existing = existingRecord.map(MemoryRecord::getPayload)
                    .filter(ConceptEdge.class::isInstance)
                    .map(ConceptEdge.class::cast);
            if (existing.map(edge -> edge.getObservations().contains(conversationId)).orElse(false)) {
                return Outcome.ALREADY_OBSERVED;
            }
            final var alpha = context.getSetup().getStrengthSmoothing();
            final var edge = existing
                    .map(current -> current.toBuilder()
                            .strength(alpha * observedStrength + (1 - alpha) * current.getStrength())
                            .observation(conversationId)
                            .build())
                    .orElseGet(() -> ConceptEdge.builder()
                            .fromConcept(from)
                            .toConcept(to)
                            .relationType(ConceptEdge.CO_OCCURS_WITH)
                            .strength(observedStrength)
                            .observation(conversationId)
                            .build());
            context.write(semanticStore, context.derivedRecord(Tier.SEMANTIC, key, edge, existingRecord));
            log.debug("Edge {} strength now {}", key, edge.getStrength());
            return Outcome.STRENGTHENED;
        });
    }
}
