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

package com.phonepe.leadmind.core.model.payloads;

import com.phonepe.leadmind.core.model.InteractionSummary;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Long lived per lead aggregate. Only consolidation writes these.
 */
@Value
@With
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LeadProfile extends MemoryPayload {
    String leadId;
    Map<String, Object> preferences;
    double rfmScore;
    List<InteractionSummary> interactionSummaries;
    Instant updatedAt;

    @Builder(toBuilder = true)
    @Jacksonized
    public LeadProfile(
            String leadId,
            @Singular Map<String, Object> preferences,
            double rfmScore,
            @Singular List<InteractionSummary> interactionSummaries,
            Instant updatedAt) {
        super(PayloadType.LEAD_PROFILE);
        this.leadId = leadId;
        this.preferences = preferences;
        this.rfmScore = rfmScore;
        this.interactionSummaries = interactionSummaries;
        this.updatedAt = updatedAt;
    }

    public Optional<InteractionSummary> summaryFor(String conversationId) {
        return interactionSummaries.stream()
                .filter(summary -> summary.getConversationId().equals(conversationId))
                .findFirst();
    }

    /**
     * @return Total interactions merged into this profile. Used as the weight of existing numeric preferences.
     */
    public int foldedInteractions() {
        return interactionSummaries.stream()
                .mapToInt(InteractionSummary::getInteractionCount)
                .sum();
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
