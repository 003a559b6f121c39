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

import com.phonepe.leadmind.handoff.model.ContextSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Sends high value leads that agents are not confident about to a human. Everything else goes to the best scoring
 * candidate; ties go to the least loaded agent, then to the lowest agent id.
 */
public class DefaultEscalationPolicy implements EscalationPolicy {
    public static final String HIGH_VALUE_LOW_CONFIDENCE = "High value lead with low automation confidence";
    public static final String NO_CANDIDATE = "No eligible agent available";

    public static final List<String> HIGH_VALUE_ACTIONS = List.of(
            "Strategic account planning session",
            "Executive stakeholder engagement",
            "Custom solution development",
            "Priority support assignment");

    private static final Comparator<AgentCandidate> BEST_FIRST = Comparator
            .comparingDouble(AgentCandidate::getScore).reversed()
            .thenComparingInt(AgentCandidate::getLoad)
            .thenComparing(AgentCandidate::getAgentId);

    @Override
    public RoutingDecision decide(
            ContextSnapshot snapshot,
            List<AgentCandidate> candidates,
            EscalationThresholds thresholds) {
        if (snapshot.getPredictedValue() > thresholds.getHighValueThreshold()
                && snapshot.getAutomationConfidence() < thresholds.getConfidenceFloor()) {
            return RoutingDecision.toHuman(HIGH_VALUE_LOW_CONFIDENCE, HIGH_VALUE_ACTIONS);
        }
        return candidates.stream()
                .min(BEST_FIRST)
                .map(candidate -> RoutingDecision.toAgent(candidate.getAgentId()))
                .orElseGet(() -> RoutingDecision.toHuman(NO_CANDIDATE, List.of()));
    }
}
