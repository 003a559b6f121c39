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
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * What the source agent knows about the lead at the time of the handoff. The escalation policy decides on this.
 */
@Value
@Builder
@Jacksonized
public class ContextSnapshot {
    /**
     * Expected value of the lead, in the pipeline's currency
     */
    double predictedValue;
    /**
     * Estimated probability that agents alone will convert the lead, 0 to 1
     */
    double automationConfidence;
    int interactionCount;
    double lastOutcomeScore;
    @Singular
    Map<String, Object> attributes;
}
