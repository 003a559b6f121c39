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

package com.phonepe.leadmind.memory.fingerprint;

import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.phonepe.leadmind.core.model.ConversationEvent;
import com.phonepe.leadmind.core.model.payloads.ConversationContext;
import com.phonepe.leadmind.core.utils.VectorUtils;

import java.nio.charset.StandardCharsets;

/**
 * Feature hashing over scenario, concepts and agent actions. Each feature lands in one bucket with a hash derived
 * sign, and the result is L2 normalised so cosine similarity reduces to a dot product.
 */
public class HashingFingerprintModel implements FingerprintModel {
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();

    private static final float SCENARIO_WEIGHT = 2.0f;
    private static final float CONCEPT_WEIGHT = 1.0f;
    private static final float ACTION_WEIGHT = 1.0f;
    private static final float AGENT_WEIGHT = 0.5f;

    @Override
    public float[] fingerprint(ConversationContext context, int dimension) {
        final var vector = new float[dimension];
        if (!Strings.isNullOrEmpty(context.getScenarioTag())) {
            addFeature(vector, "scenario=" + context.getScenarioTag(), SCENARIO_WEIGHT);
        }
        context.getConcepts().forEach(concept -> addFeature(vector, "concept=" + concept, CONCEPT_WEIGHT));
        for (final ConversationEvent event : context.agentActions()) {
            addFeature(vector, "action=" + event.getAction(), ACTION_WEIGHT);
            event.getConcepts().forEach(concept -> addFeature(vector, "concept=" + concept, CONCEPT_WEIGHT));
            if (!Strings.isNullOrEmpty(event.getActor())) {
                addFeature(vector, "agent=" + event.getActor(), AGENT_WEIGHT);
            }
        }
        return VectorUtils.normalize(vector);
    }

    private static void addFeature(float[] vector, String feature, float weight) {
        final var hash = HASH_FUNCTION.hashString(feature, StandardCharsets.UTF_8).asInt();
        final var bucket = Math.floorMod(hash, vector.length);
        final var sign = (hash & 0x40000000) == 0 ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }
}
