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

import com.google.common.base.Strings;
import com.phonepe.leadmind.core.errors.ValidationError;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.AgentActionLog;
import com.phonepe.leadmind.core.model.payloads.ConceptEdge;
import com.phonepe.leadmind.core.model.payloads.ConceptNode;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.model.payloads.Episode;
import com.phonepe.leadmind.core.model.payloads.HandoffAudit;
import com.phonepe.leadmind.core.model.payloads.LeadProfile;
import com.phonepe.leadmind.core.model.payloads.MemoryPayload;
import com.phonepe.leadmind.core.model.payloads.PayloadVisitor;
import lombok.AllArgsConstructor;

import java.time.Duration;
import java.util.Objects;

/**
 * Checks an agent's write before it reaches a tier store. Every check failure is a {@link ValidationError}.
 */
@AllArgsConstructor
public class PayloadValidator {
    private final int fingerprintDimension;
    private final double episodicThreshold;

    public void validate(Tier tier, String key, MemoryPayload payload, PutOptions options) {
        if (tier == null) {
            throw new ValidationError("Tier is required");
        }
        if (Strings.isNullOrEmpty(key)) {
            throw new ValidationError("Key is required");
        }
        if (payload == null) {
            throw new ValidationError("Payload is required for key " + key);
        }
        if (payload.getType().getTier() != tier) {
            throw new ValidationError("Payload of type %s cannot be stored in tier %s"
                                              .formatted(payload.getType(), tier.wireName()));
        }
        validateTtl(tier, key, options.getTtl());
        final var naturalKey = payload.accept(new FieldChecker());
        if (!Objects.equals(naturalKey, key)) {
            throw new ValidationError("Key %s does not match payload key %s".formatted(key, naturalKey));
        }
    }

    private static void validateTtl(Tier tier, String key, Duration ttl) {
        if (tier == Tier.SHORT_TERM) {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new ValidationError("A positive TTL is required for short term record " + key);
            }
        }
        else if (ttl != null) {
            throw new ValidationError("TTL is only supported on the short term tier. Key: " + key);
        }
    }

    private static String required(String value, String field) {
        if (Strings.isNullOrEmpty(value)) {
            throw new ValidationError("Missing required field: " + field);
        }
        return value;
    }

    private static void score(double value, String field) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new ValidationError("%s must be between 0 and 1, got %s".formatted(field, value));
        }
    }

    /**
     * Validates the variant specific fields and returns the key the payload must be stored under
     */
    private final class FieldChecker implements PayloadVisitor<String> {
        @Override
        public String visit(ConversationContext conversationContext) {
            required(conversationContext.getLeadId(), "leadId");
            required(conversationContext.getCurrentAgent(), "currentAgent");
            score(conversationContext.getLastOutcomeScore(), "lastOutcomeScore");
            if (conversationContext.getInteractionCount() < 0) {
                throw new ValidationError("interactionCount cannot be negative");
            }
            return required(conversationContext.getConversationId(), "conversationId");
        }

        @Override
        public String visit(LeadProfile leadProfile) {
            throw new ValidationError("Lead profiles are derived by consolidation and cannot be written directly");
        }

        @Override
        public String visit(HandoffAudit handoffAudit) {
            required(handoffAudit.getLeadId(), "leadId");
            return required(handoffAudit.getHandoffId(), "handoffId");
        }

        @Override
        public String visit(AgentActionLog agentActionLog) {
            required(agentActionLog.getAgentId(), "agentId");
            required(agentActionLog.getActionType(), "actionType");
            return required(agentActionLog.getActionId(), "actionId");
        }

        @Override
        public String visit(Episode episode) {
            final var fingerprint = episode.getContextFingerprint();
            if (fingerprint == null || fingerprint.length != fingerprintDimension) {
                throw new ValidationError("Episode fingerprint must have dimension %d, got %s"
                                                  .formatted(fingerprintDimension,
                                                             fingerprint == null ? "none" : fingerprint.length));
            }
            score(episode.getOutcomeScore(), "outcomeScore");
            if (episode.getOutcomeScore() < episodicThreshold) {
                throw new ValidationError("Only successful episodes are kept. outcomeScore %s is below %s"
                                                  .formatted(episode.getOutcomeScore(), episodicThreshold));
            }
            return required(episode.getEpisodeId(), "episodeId");
        }

        @Override
        public String visit(ConceptNode conceptNode) {
            return ConceptNode.key(required(conceptNode.getName(), "name"));
        }

        @Override
        public String visit(ConceptEdge conceptEdge) {
            required(conceptEdge.getFromConcept(), "fromConcept");
            required(conceptEdge.getToConcept(), "toConcept");
            required(conceptEdge.getRelationType(), "relationType");
            score(conceptEdge.getStrength(), "strength");
            return conceptEdge.key();
        }
    }
}
