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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of a conversation as it moves between agents. Legal moves:
 * <pre>
 * CREATED -> TRIAGED -> ENGAGED -> ESCALATED | CLOSED
 * ESCALATED -> ENGAGED
 * </pre>
 */
public enum ConversationState {
    CREATED,
    TRIAGED,
    ENGAGED,
    ESCALATED,
    CLOSED,
    ;

    private static final Map<ConversationState, Set<ConversationState>> EDGES = new EnumMap<>(ConversationState.class);

    static {
        EDGES.put(CREATED, EnumSet.of(TRIAGED));
        EDGES.put(TRIAGED, EnumSet.of(ENGAGED));
        EDGES.put(ENGAGED, EnumSet.of(ESCALATED, CLOSED));
        EDGES.put(ESCALATED, EnumSet.of(ENGAGED));
        EDGES.put(CLOSED, EnumSet.noneOf(ConversationState.class));
    }

    public Set<ConversationState> next() {
        return Collections.unmodifiableSet(EDGES.get(this));
    }

    public boolean canTransitionTo(ConversationState target) {
        return EDGES.get(this).contains(target);
    }

    public boolean isTerminal() {
        return EDGES.get(this).isEmpty();
    }

    /**
     * Shortest sequence of legal moves from this state to the target
     *
     * @return States visited after this one, ending with the target. Empty list if already there. Empty optional if
     *         the target cannot be reached.
     */
    public Optional<List<ConversationState>> pathTo(ConversationState target) {
        if (this == target) {
            return Optional.of(List.of());
        }
        final var previous = new EnumMap<ConversationState, ConversationState>(ConversationState.class);
        final var queue = new ArrayDeque<ConversationState>();
        queue.add(this);
        while (!queue.isEmpty()) {
            final var current = queue.poll();
            for (final var next : EDGES.get(current)) {
                if (next == this || previous.containsKey(next)) {
                    continue;
                }
                previous.put(next, current);
                if (next == target) {
                    final var path = new ArrayList<ConversationState>();
                    for (var step = target; step != this; step = previous.get(step)) {
                        path.add(0, step);
                    }
                    return Optional.of(path);
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }
}
