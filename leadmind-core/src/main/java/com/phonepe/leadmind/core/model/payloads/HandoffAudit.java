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
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Record of a committed handoff, kept for analysis and for reconstructing failures
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class HandoffAudit extends MemoryPayload {
    String handoffId;
    String leadId;
    String conversationId;
    String sourceAgent;
    String targetAgent;
    String ticketId;
    String fromState;
    String toState;
    String reason;
    Instant recordedAt;

    @Builder
    @Jacksonized
    public HandoffAudit(
            String handoffId,
            String leadId,
            String conversationId,
            String sourceAgent,
            String targetAgent,
            String ticketId,
            String fromState,
            String toState,
            String reason,
            Instant recordedAt) {
        super(PayloadType.HANDOFF_AUDIT);
        this.handoffId = handoffId;
        this.leadId = leadId;
        this.conversationId = conversationId;
        this.sourceAgent = sourceAgent;
        this.targetAgent = targetAgent;
        this.ticketId = ticketId;
        this.fromState = fromState;
        this.toState = toState;
        this.reason = reason;
        this.recordedAt = recordedAt;
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
