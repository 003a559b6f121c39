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

package com.phonepe.leadmind.handoff.escalation;

import com.phonepe.leadmind.handoff.model.Route;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoutingDecision {
    Route route;
    /**
     * Set when routed to an agent
     */
    String agentId;
    /**
     * Set when routed to a human
     */
    String reason;
    @Singular
    List<String> recommendedActions;

    public static RoutingDecision toAgent(String agentId) {
        return RoutingDecision.builder()
                .route(Route.AGENT)
                .agentId(agentId)
                .build();
    }

    public static RoutingDecision toHuman(String reason, List<String> recommendedActions) {
        return RoutingDecision.builder()
                .route(Route.HUMAN)
                .reason(reason)
                .recommendedActions(recommendedActions)
                .build();
    }
}
