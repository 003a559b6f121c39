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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * An action an agent wants kept beyond the life of the conversation
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AgentActionLog extends MemoryPayload {
    String actionId;
    String agentId;
    String leadId;
    String conversationId;
    String actionType;
    Map<String, Object> details;
    Instant recordedAt;

    @Builder
    @Jacksonized
    public AgentActionLog(
            String actionId,
            String agentId,
            String leadId,
            String conversationId,
            String actionType,
            @Singular Map<String, Object> details,
            Instant recordedAt) {
        super(PayloadType.AGENT_ACTION_LOG);
        this.actionId = actionId;
        this.agentId = agentId;
        this.leadId = leadId;
        this.conversationId = conversationId;
        this.actionType = actionType;
        this.details = details;
        this.recordedAt = recordedAt;
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
