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

import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.ConversationEventType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live working state for one lead's conversation. Lives in the short term tier and is owned by whichever agent
 * currently holds the conversation.
 */
@Value
@With
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConversationContext extends MemoryPayload {
    String leadId;
    String conversationId;
    String currentAgent;
    int interactionCount;
    double lastOutcomeScore;
    String scenarioTag;
    Map<String, Object> preferences;
    Set<String> concepts;
    List<ConversationEvent> history;
    boolean completed;

    @Builder(toBuilder = true)
    @Jacksonized
    public ConversationContext(
            String leadId,
            String conversationId,
            String currentAgent,
            int interactionCount,
            double lastOutcomeScore,
            String scenarioTag,
            @Singular Map<String, Object> preferences,
            @Singular Set<String> concepts,
            @Singular("event") List<ConversationEvent> history,
            boolean completed) {
        super(PayloadType.CONVERSATION_CONTEXT);
        this.leadId = leadId;
        this.conversationId = conversationId;
        this.currentAgent = currentAgent;
        this.interactionCount = interactionCount;
        this.lastOutcomeScore = lastOutcomeScore;
        this.scenarioTag = scenarioTag;
        this.preferences = preferences;
        this.concepts = concepts;
        this.history = history;
        this.completed = completed;
    }

    /**
     * @return The history filtered down to actions taken by agents, in order
     */
    public List<ConversationEvent> agentActions() {
        return history.stream()
                .filter(event -> event.getType() == ConversationEventType.AGENT_ACTION)
                .toList();
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
