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

package com.phonepe.leadmind.handoff.registry;

import com.phonepe.leadmind.handoff.model.ConversationRecord;
import com.phonepe.leadmind.handoff.model.EscalationTicket;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current conversation and ticket state. Callers serialize writes per lead.
 */
public class ConversationRegistry {
    private final Map<String, ConversationRecord> conversations = new ConcurrentHashMap<>();
    private final Map<String, EscalationTicket> tickets = new ConcurrentHashMap<>();

    public Optional<ConversationRecord> conversation(String conversationId) {
        return Optional.ofNullable(conversationId).map(conversations::get);
    }

    public void save(ConversationRecord conversation) {
        conversations.put(conversation.getConversationId(), conversation);
    }

    public Optional<EscalationTicket> ticket(String ticketId) {
        return Optional.ofNullable(ticketId).map(tickets::get);
    }

    public void save(EscalationTicket ticket) {
        tickets.put(ticket.getTicketId(), ticket);
    }

    public List<EscalationTicket> tickets(String leadId) {
        return tickets.values()
                .stream()
                .filter(ticket -> ticket.getLeadId().equals(leadId))
                .toList();
    }
}
