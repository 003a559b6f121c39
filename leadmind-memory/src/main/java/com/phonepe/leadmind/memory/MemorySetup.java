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

package com.phonepe.leadmind.memory;

import com.phonepe.leadmind.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Thresholds and defaults for the memory manager and its consolidation rules. Every threshold is independently
 * tunable.
 */
@Value
@Builder
@With
public class MemorySetup {
    public static final int DEFAULT_LONG_TERM_INTERACTION_THRESHOLD = 5;
    public static final double DEFAULT_LONG_TERM_OUTCOME_THRESHOLD = Double.POSITIVE_INFINITY;
    public static final double DEFAULT_EPISODIC_THRESHOLD = 0.8;
    public static final double DEFAULT_EPISODE_DUPLICATE_SIMILARITY = 0.95;
    public static final double DEFAULT_SEMANTIC_THRESHOLD = 0.7;
    public static final double DEFAULT_STRENGTH_SMOOTHING = 0.3;
    public static final int DEFAULT_FINGERPRINT_DIMENSION = 64;
    public static final double DEFAULT_EPISODIC_MIN_SIMILARITY = 0.7;
    public static final int DEFAULT_TRAVERSAL_DEPTH = 2;
    public static final int DEFAULT_QUERY_LIMIT = 100;

    public static final MemorySetup DEFAULT = MemorySetup.builder().build();

    /**
     * Conversations with at least these many interactions are folded into the lead profile
     */
    @Builder.Default
    int longTermInteractionThreshold = DEFAULT_LONG_TERM_INTERACTION_THRESHOLD;

    /**
     * Conversations with an outcome score at or above this are folded into the lead profile regardless of how many
     * interactions they had. Off by default: scores never exceed 1.
     */
    @Builder.Default
    double longTermOutcomeThreshold = DEFAULT_LONG_TERM_OUTCOME_THRESHOLD;

    /**
     * Conversations with an outcome score at or above this produce an episode
     */
    @Builder.Default
    double episodicThreshold = DEFAULT_EPISODIC_THRESHOLD;

    /**
     * An episode this similar to an existing one with the same scenario is treated as a duplicate
     */
    @Builder.Default
    double episodeDuplicateSimilarity = DEFAULT_EPISODE_DUPLICATE_SIMILARITY;

    /**
     * Concept pairs with association strength at or above this create or strengthen an edge
     */
    @Builder.Default
    double semanticThreshold = DEFAULT_SEMANTIC_THRESHOLD;

    /**
     * Weight of a new observation in the exponential moving average of edge strength
     */
    @Builder.Default
    double strengthSmoothing = DEFAULT_STRENGTH_SMOOTHING;

    @Builder.Default
    int fingerprintDimension = DEFAULT_FINGERPRINT_DIMENSION;

    /**
     * Similarity floor for episodic queries that do not specify one
     */
    @Builder.Default
    double episodicMinSimilarity = DEFAULT_EPISODIC_MIN_SIMILARITY;

    @Builder.Default
    int traversalDepth = DEFAULT_TRAVERSAL_DEPTH;

    @Builder.Default
    int queryLimit = DEFAULT_QUERY_LIMIT;

    /**
     * Build a setup from {@code LEADMIND_*} environment variables, using defaults for anything not set
     */
    public static MemorySetup fromEnv() {
        return MemorySetup.builder()
                .longTermInteractionThreshold(EnvLoader.readInt("LEADMIND_LONG_TERM_INTERACTION_THRESHOLD",
                                                                DEFAULT_LONG_TERM_INTERACTION_THRESHOLD))
                .longTermOutcomeThreshold(EnvLoader.readDouble("LEADMIND_LONG_TERM_OUTCOME_THRESHOLD",
                                                               DEFAULT_LONG_TERM_OUTCOME_THRESHOLD))
                .episodicThreshold(EnvLoader.readDouble("LEADMIND_EPISODIC_THRESHOLD", DEFAULT_EPISODIC_THRESHOLD))
                .episodeDuplicateSimilarity(EnvLoader.readDouble("LEADMIND_EPISODE_DUPLICATE_SIMILARITY",
                                                                 DEFAULT_EPISODE_DUPLICATE_SIMILARITY))
                .semanticThreshold(EnvLoader.readDouble("LEADMIND_SEMANTIC_THRESHOLD", DEFAULT_SEMANTIC_THRESHOLD))
                .strengthSmoothing(EnvLoader.readDouble("LEADMIND_STRENGTH_SMOOTHING", DEFAULT_STRENGTH_SMOOTHING))
                .fingerprintDimension(EnvLoader.readInt("LEADMIND_FINGERPRINT_DIMENSION",
                                                        DEFAULT_FINGERPRINT_DIMENSION))
                .build();
    }
}
