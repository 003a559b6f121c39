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

package com.phonepe.leadmind.memory.consolidation;

import com.phonepe.leadmind.core.model.InteractionSummary;
import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Recency, frequency and monetary score of a lead, each component in [0, 1] and the score their mean
 */
@UtilityClass
public class RfmCalculator {
    static final Duration RECENCY_WINDOW = Duration.ofDays(30);
    static final int FREQUENCY_SATURATION = 10;
    static final double UNKNOWN_MONETARY = 0.5;

    public static double score(Collection<InteractionSummary> summaries, Instant now) {
        return (recency(summaries, now) + frequency(summaries) + monetary(summaries)) / 3.0;
    }

    static double recency(Collection<InteractionSummary> summaries, Instant now) {
        return summaries.stream()
                .map(InteractionSummary::getRecordedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .map(latest -> {
                    final var age = Duration.between(latest, now);
                    if (age.isNegative()) {
                        return 1.0;
                    }
                    return Math.max(0.0, 1.0 - (double) age.toMillis() / RECENCY_WINDOW.toMillis());
                })
                .orElse(0.0);
    }

    static double frequency(Collection<InteractionSummary> summaries) {
        return Math.min(1.0, (double) summaries.size() / FREQUENCY_SATURATION);
    }

    static double monetary(Collection<InteractionSummary> summaries) {
        return summaries.stream()
                .mapToDouble(InteractionSummary::getOutcomeScore)
                .average()
                .orElse(UNKNOWN_MONETARY);
    }
}
