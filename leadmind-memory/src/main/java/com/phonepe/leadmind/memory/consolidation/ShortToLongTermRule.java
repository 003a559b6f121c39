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
import com.phonepe.leadmind.core.events.LeadProcessedEvent;
import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.InteractionSummary;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.model.payloads.LeadProfile;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds conversations that crossed the interaction threshold (or the optional outcome threshold) into the lead's
 * long term profile. A conversation folded at some interaction count is folded again only once it has grown, and
 * then only with the interactions added since. The short term copy is left to expire on its own.
 */
@Slf4j
public class ShortToLongTermRule implements ConsolidationRule {
    public static final String NAME = "short_to_long_term";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RuleResult apply(ConsolidationContext context) {
        final var setup = context.getSetup();
        int migrated = 0;
        int skipped = 0;
        int failed = 0;
        final var errors = new ArrayList<String>();
        for (final var conversationRecord : context.liveConversations()) {
            final var conversation = (ConversationContext) conversationRecord.getPayload();
            if (conversation.getInteractionCount() < setup.getLongTermInteractionThreshold()
                    && conversation.getLastOutcomeScore() < setup.getLongTermOutcomeThreshold()) {
                continue;
            }
            try {
                final var folded = context.getKeyedLocks()
                        .withLock(KeyedLocks.leadKey(conversation.getLeadId()), () -> fold(context, conversation));
                if (folded) {
                    migrated++;
                }
                else {
                    skipped++;
                }
            }
            catch (LeadmindException e) {
                failed++;
                errors.add("%s: conversation %s: %s".formatted(NAME, conversation.getConversationId(), e.getMessage()));
                log.error("Error folding conversation {} for lead {}: {}",
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

    private boolean fold(ConsolidationContext context, ConversationContext conversation) {
        final var longTermStore = context.getLongTermStore();
        final var existingRecord = context.read(longTermStore, conversation.getLeadId());
        final var existing = existingRecord
                .map(MemoryRecord::getPayload)
                .filter(LeadProfile.class::isInstance)
                .map(LeadProfile.class::cast)
                .orElseGet(() -> LeadProfile.builder()
                        .leadId(conversation.getLeadId())
                        .build());
        final var previousCount = existing.summaryFor(conversation.getConversationId())
                .map(InteractionSummary::getInteractionCount)
                .orElse(0);
        if (existing.summaryFor(conversation.getConversationId()).isPresent()
                && previousCount >= conversation.getInteractionCount()) {
            log.debug("Conversation {} already folded at {} interactions", conversation.getConversationId(),
                      previousCount);
            return false;
        }
        final var now = context.getClock().instant();
        final var deltaWeight = Math.max(1, conversation.getInteractionCount() - previousCount);
        final Map<String, Object> preferences = PreferenceMerger.merge(existing.getPreferences(),
                                                                       existing.foldedInteractions(),
                                                                       conversation.getPreferences(),
                                                                       deltaWeight);
        final var summaries = new ArrayList<InteractionSummary>();
        existing.getInteractionSummaries()
                .stream()
                .filter(summary -> !summary.getConversationId().equals(conversation.getConversationId()))
                .forEach(summaries::add);
        summaries.add(InteractionSummary.builder()
                              .conversationId(conversation.getConversationId())
                              .interactionCount(conversation.getInteractionCount())
                              .outcomeScore(conversation.getLastOutcomeScore())
                              .summary(describe(conversation))
                              .recordedAt(now)
                              .build());
        final var rfmScore = RfmCalculator.score(summaries, now);
        final var profile = existing.toBuilder()
                .clearPreferences()
                .preferences(preferences)
                .clearInteractionSummaries()
                .interactionSummaries(summaries)
                .rfmScore(rfmScore)
                .updatedAt(now)
                .build();
        context.write(longTermStore,
                      context.derivedRecord(Tier.LONG_TERM, conversation.getLeadId(), profile, existingRecord));
        log.info("Folded conversation {} into profile of lead {}. Interactions: {}, RFM: {}",
                 conversation.getConversationId(), conversation.getLeadId(), conversation.getInteractionCount(),
                 rfmScore);
        context.getEventBus().notify(LeadProcessedEvent.builder()
                                             .leadId(conversation.getLeadId())
                                             .conversationId(conversation.getConversationId())
                                             .interactionCount(conversation.getInteractionCount())
                                             .rfmScore(rfmScore)
                                             .build());
        return true;
    }

    private static String describe(ConversationContext conversation) {
        final List<String> agents = conversation.agentActions()
                .stream()
                .map(ConversationEvent::getActor)
                .distinct()
                .toList();
        return "%d interactions with %s, outcome %.2f".formatted(
                conversation.getInteractionCount(),
                agents.isEmpty() ? "no agents" : String.join(", ", agents),
                conversation.getLastOutcomeScore());
    }
}
