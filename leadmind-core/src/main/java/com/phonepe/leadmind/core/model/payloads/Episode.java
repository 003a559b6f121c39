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

package com.phonepe.leadmind.core.model.payloads;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A successful interaction pattern, searchable by the fingerprint of the context it happened in
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Episode extends MemoryPayload {
    public static final String LEAD_ID = "leadId";
    public static final String CONVERSATION_ID = "conversationId";
    public static final String AGENTS = "agents";

    String episodeId;
    String scenarioTag;
    float[] contextFingerprint;
    List<String> actionSequence;
    double outcomeScore;
    Map<String, String> metadata;

    @Builder
    @Jacksonized
    public Episode(
            String episodeId,
            String scenarioTag,
            float[] contextFingerprint,
            @Singular("action") List<String> actionSequence,
            double outcomeScore,
            @Singular("metadataEntry") Map<String, String> metadata) {
        super(PayloadType.EPISODE);
        this.episodeId = episodeId;
        this.scenarioTag = scenarioTag;
        this.contextFingerprint = contextFingerprint == null ? null : contextFingerprint.clone();
        this.actionSequence = actionSequence;
        this.outcomeScore = outcomeScore;
        this.metadata = metadata;
    }

    /**
     * @return A copy of the fingerprint. Stored episodes cannot be changed through it.
     */
    public float[] getContextFingerprint() {
        return contextFingerprint == null ? null : contextFingerprint.clone();
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
