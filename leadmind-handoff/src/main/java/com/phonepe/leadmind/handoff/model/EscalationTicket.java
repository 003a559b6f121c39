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
 * Work item for a human. Tickets raised without a conversation concern the lead as a whole.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class EscalationTicket {
    String ticketId;
    String leadId;
    String conversationId;
    String raisedBy;
    String reason;
    @Singular
    List<String> recommendedActions;
    TicketState state;
    String resolvedBy;
    Instant createdAt;
    Instant resolvedAt;
}
