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

package com.phonepe.leadmind.core.events;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Handoff delivery exhausted its retries and the conversation was parked
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class HandoffFailedEvent extends LeadEvent {
    String handoffId;
    String leadId;
    String conversationId;
    String destination;
    String reason;

    @Builder
    @Jacksonized
    public HandoffFailedEvent(
            @NonNull String handoffId,
            @NonNull String leadId,
            @NonNull String conversationId,
            String destination,
            String reason) {
        super(EventType.HANDOFF_FAILED);
        this.handoffId = handoffId;
        this.leadId = leadId;
        this.conversationId = conversationId;
        this.destination = destination;
        this.reason = reason;
    }

    @Override
    public <T> T accept(LeadEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
