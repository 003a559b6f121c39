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

import com.google.common.base.Strings;
import com.phonepe.leadmind.core.errors.LeadmindException;
import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.utils.KeyedLocks;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns successful conversations into episodes. A conversation yields at most one episode, and an episode is not
 * created when a near identical one already exists for the same scenario.
 */
@Slf4j
public class EpisodeExtractionRule implements ConsolidationRule {
    public static final String NAME = "episode_extraction";
    public static final String DEFAULT_SCENARIO = "general";

    private enum Outcome {
        CREATED,
        EXISTS,
        DUPLICATE,
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
            if (conversation.getLastOutcomeScore() < context.getSetup().getEpisodicThreshold()) {
                continue;
            }
            try {
                final var outcome = context.getKeyedLocks().withLock(
                        KeyedLocks.leadKey(conversation.getLeadId()),
                        () -> context.getKeyedLocks().withLock(
                                KeyedLocks.scenarioKey(scenarioOf(conversation)),
                                () -> extract(context, conversation)));
                if (outcome == Outcome.CREATED) {
                    migrated++;
                }
                else {
                    skipped++;
                }
            }
            catch (LeadmindException e) {
                failed++;
                errors.add("%s: conversation %s: %s".formatted(NAME, conversation.getConversationId(), e.getMessage()));
                log.error("Error extracting episode from conversation {} for lead {}: {}",
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
     * Episode ids are derived from the conversation id so that re-running extraction finds its own earlier output
     */
    public static String episodeId(String conversationId) {
        return "episode-" + UUID.nameUUIDFromBytes(conversationId.getBytes(StandardCharsets.UTF_8));
    }

    private Outcome extract(ConsolidationContext context, ConversationContext conversation) {
        final var setup = context.getSetup();
        final var episodicStore = context.getEpisodicStore();
        final var episodeId = episodeId(conversation.getConversationId());
        if (context.read(episodicStore, episodeId).isPresent()) {
            return Outcome.EXISTS;
        }
        final var scenario = scenarioOf(conversation);
        final var fingerprint = context.getFingerprintModel()
                .fingerprint(conversation, episodicStore.dimension());
        final var duplicates = context.getRetryingExecutor()
                .call("nearest episodic",
                      () -> episodicStore.nearest(fingerprint, scenario, setup.getEpisodeDuplicateSimilarity(), 1));
        if (!duplicates.isEmpty()) {
            log.debug("Conversation {} matches existing episode {} with similarity {}",
                      conversation.getConversationId(),
                      duplicates.get(0).getMemoryRecord().getKey(),
                      duplicates.get(0).getScore());
            return Outcome.DUPLICATE;
        }
        final var actions = conversation.agentActions();
        final var episode = Episode.builder()
                .episodeId(episodeId)
                .scenarioTag(scenario)
                .contextFingerprint(fingerprint)
                .actionSequence(actions.stream().map(ConversationEvent::getAction).toList())
                .outcomeScore(conversation.getLastOutcomeScore())
                .metadataEntry(Episode.LEAD_ID, conversation.getLeadId())
                .metadataEntry(Episode.CONVERSATION_ID, conversation.getConversationId())
                .metadataEntry(Episode.AGENTS, String.join(",", actions.stream()
                        .map(ConversationEvent::getActor)
                        .distinct()
                        .toList()))
                .build();
        context.write(episodicStore, context.derivedRecord(Tier.EPISODIC, episodeId, episode, Optional.empty()));
        log.info("Created episode {} for scenario {} from conversation {}. Outcome: {}",
                 episodeId, scenario, conversation.getConversationId(), conversation.getLastOutcomeScore());
        return Outcome.CREATED;
    }

    private static String scenarioOf(ConversationContext conversation) {
        return Strings.isNullOrEmpty(conversation.getScenarioTag())
               ? DEFAULT_SCENARIO
               : conversation.getScenarioTag();
    }
}
