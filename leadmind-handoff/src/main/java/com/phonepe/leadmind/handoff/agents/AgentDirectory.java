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

package com.phonepe.leadmind.handoff.agents;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.leadmind.core.events.AgentStatusEvent;
import com.phonepe.leadmind.core.events.EventBus;
import com.phonepe.leadmind.handoff.escalation.AgentCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registered agents and the number of conversations each one holds. Every load change is published as an
 * {@code agent.status} event.
 */
@Slf4j
public class AgentDirectory {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_AT_CAPACITY = "at_capacity";

    private final Map<String, AgentDescriptor> agents = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> loads = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    public AgentDirectory(EventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public AgentDirectory register(AgentDescriptor descriptor) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(descriptor.getAgentId()), "agentId is required");
        agents.put(descriptor.getAgentId(), descriptor);
        loads.computeIfAbsent(descriptor.getAgentId(), id -> new AtomicInteger());
        log.info("Registered agent {} with role {}", descriptor.getAgentId(), descriptor.getRole());
        return this;
    }

    public Optional<AgentDescriptor> agent(String agentId) {
        return Optional.ofNullable(agentId).map(agents::get);
    }

    public boolean isRegistered(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public int load(String agentId) {
        final var load = loads.get(agentId);
        return load == null ? 0 : load.get();
    }

    /**
     * Agents that can take a conversation from {@code sourceAgent}.
     *
     * @param sourceAgent Never offered to itself
     * @param target      Agent id or role to restrict to. Null for any agent.
     * @return Candidates in agent id order
     */
    public List<AgentCandidate> candidates(String sourceAgent, String target) {
        return agents.values()
                .stream()
                .filter(agent -> !agent.getAgentId().equals(sourceAgent))
                .filter(agent -> target == null
                        || target.equals(agent.getAgentId())
                        || target.equals(agent.getRole()))
                .filter(agent -> load(agent.getAgentId()) < agent.getCapacity())
                .sorted(Comparator.comparing(AgentDescriptor::getAgentId))
                .map(agent -> AgentCandidate.builder()
                        .agentId(agent.getAgentId())
                        .score(agent.getScore())
                        .load(load(agent.getAgentId()))
                        .build())
                .toList();
    }

    public void acquire(String agentId) {
        changeLoad(agentId, 1);
    }

    public void release(String agentId) {
        changeLoad(agentId, -1);
    }

    private void changeLoad(String agentId, int delta) {
        if (agentId == null) {
            return;
        }
        final var counter = loads.computeIfAbsent(agentId, id -> new AtomicInteger());
        final var updated = counter.updateAndGet(current -> Math.max(0, current + delta));
        final var capacity = agent(agentId).map(AgentDescriptor::getCapacity)
                .orElse(AgentDescriptor.DEFAULT_CAPACITY);
        eventBus.notify(AgentStatusEvent.builder()
                                .agentId(agentId)
                                .activeConversations(updated)
                                .status(updated >= capacity ? STATUS_AT_CAPACITY : STATUS_ACTIVE)
                                .build());
    }
}
