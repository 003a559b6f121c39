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

package com.phonepe.leadmind.handoff.delivery;

import com.phonepe.leadmind.core.errors.UnavailableError;
import com.phonepe.leadmind.handoff.model.EscalationTicket;
import com.phonepe.leadmind.handoff.model.HandoffRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In process delivery. Each agent has a bounded inbox and humans share one bounded queue. A full queue is reported as
 * unavailable.
 */
@Slf4j
public class InboxDelivery implements HandoffDelivery {
    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final Map<String, BlockingQueue<HandoffRequest>> inboxes = new ConcurrentHashMap<>();
    private final BlockingQueue<EscalationTicket> humanQueue;

    public InboxDelivery() {
        this(DEFAULT_CAPACITY);
    }

    public InboxDelivery(int capacity) {
        this.capacity = capacity;
        this.humanQueue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public void toAgent(String agentId, HandoffRequest request) {
        if (!inbox(agentId).offer(request)) {
            throw new UnavailableError("Inbox of agent " + agentId + " is full");
        }
        log.debug("Handoff {} delivered to inbox of {}", request.getHandoffId(), agentId);
    }

    @Override
    public void toHuman(EscalationTicket ticket) {
        if (!humanQueue.offer(ticket)) {
            throw new UnavailableError("Human queue is full");
        }
        log.debug("Ticket {} queued for human review", ticket.getTicketId());
    }

    /**
     * Next pending handoff for the agent, if any
     */
    public Optional<HandoffRequest> poll(String agentId) {
        return Optional.ofNullable(inbox(agentId).poll());
    }

    public Optional<EscalationTicket> pollHuman() {
        return Optional.ofNullable(humanQueue.poll());
    }

    public int pending(String agentId) {
        return inbox(agentId).size();
    }

    public int pendingHuman() {
        return humanQueue.size();
    }

    private BlockingQueue<HandoffRequest> inbox(String agentId) {
        return inboxes.computeIfAbsent(agentId, id -> new LinkedBlockingQueue<>(capacity));
    }
}
