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

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A registered agent. Agents are addressed by id everywhere else.
 */
@Value
@With
@Builder
public class AgentDescriptor {
    public static final int DEFAULT_CAPACITY = 50;

    String agentId;
    /**
     * Functional role such as {@code triage} or {@code engagement}. Handoffs may target a role instead of an id.
     */
    String role;
    /**
     * Base suitability used when ranking candidates
     */
    double score;
    /**
     * Agents at capacity are not offered new conversations
     */
    @Builder.Default
    int capacity = DEFAULT_CAPACITY;
}
