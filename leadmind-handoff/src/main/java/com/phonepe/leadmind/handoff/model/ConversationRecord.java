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

package com.phonepe.leadmind.handoff.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Coordinator's view of a conversation. Immutable; every change produces a new instance with the change appended to
 * the history.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class ConversationRecord {
    String conversationId;
    String leadId;
    /**
     * Agent currently holding the conversation. Null while a human holds it.
     */
    String owner;
    ConversationState state;
    @Builder.Default
    DeliveryStatus deliveryStatus = DeliveryStatus.NONE;
    String lastHandoffId;
    String activeTicketId;
    @Singular("transition")
    List<StateTransition> history;
    Instant createdAt;
    Instant updatedAt;

    public boolean isOwnedBy(String agentId) {
        return owner != null && owner.equals(agentId);
    }

    public boolean isHandoffFailed() {
        return deliveryStatus == DeliveryStatus.FAILED;
    }

    /**
     * @return A copy moved to {@code toState} with the move recorded in the history
     */
    public ConversationRecord moveTo(
            ConversationState toState,
            String toOwner,
            String actor,
            String reason,
            String handoffId,
            Instant now) {
        return toBuilder()
                .transition(StateTransition.builder()
                                    .sequence(history.size() + 1)
                                    .fromState(state)
                                    .toState(toState)
                                    .fromOwner(owner)
                                    .toOwner(toOwner)
                                    .actor(actor)
                                    .reason(reason)
                                    .handoffId(handoffId)
                                    .timestamp(now)
                                    .build())
                .state(toState)
                .owner(toOwner)
                .updatedAt(now)
                .build();
    }
}
