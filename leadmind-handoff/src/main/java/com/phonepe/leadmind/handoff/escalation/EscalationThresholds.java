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

import com.phonepe.leadmind.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * When a lead is valuable enough, and agents are unsure enough, to need a human
 */
@Value
@Builder
@With
public class EscalationThresholds {
    public static final double DEFAULT_HIGH_VALUE_THRESHOLD = 10_000.0;
    public static final double DEFAULT_CONFIDENCE_FLOOR = 0.6;

    public static final EscalationThresholds DEFAULT = EscalationThresholds.builder().build();

    /**
     * Leads with a predicted value strictly above this are high value
     */
    @Builder.Default
    double highValueThreshold = DEFAULT_HIGH_VALUE_THRESHOLD;

    /**
     * High value leads with automation confidence strictly below this go to a human
     */
    @Builder.Default
    double confidenceFloor = DEFAULT_CONFIDENCE_FLOOR;

    public static EscalationThresholds fromEnv() {
        return EscalationThresholds.builder()
                .highValueThreshold(EnvLoader.readDouble("LEADMIND_HIGH_VALUE_THRESHOLD",
                                                         DEFAULT_HIGH_VALUE_THRESHOLD))
                .confidenceFloor(EnvLoader.readDouble("LEADMIND_CONFIDENCE_FLOOR", DEFAULT_CONFIDENCE_FLOOR))
                .build();
    }
}
