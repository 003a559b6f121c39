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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Structured value stored in a {@link com.phonepe.leadmind.core.model.MemoryRecord}. The {@code type} property
 * decides the variant; unknown variants fail deserialization.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = PayloadType.Values.CONVERSATION_CONTEXT, value = ConversationContext.class),
        @JsonSubTypes.Type(name = PayloadType.Values.LEAD_PROFILE, value = LeadProfile.class),
        @JsonSubTypes.Type(name = PayloadType.Values.HANDOFF_AUDIT, value = HandoffAudit.class),
        @JsonSubTypes.Type(name = PayloadType.Values.AGENT_ACTION_LOG, value = AgentActionLog.class),
        @JsonSubTypes.Type(name = PayloadType.Values.EPISODE, value = Episode.class),
        @JsonSubTypes.Type(name = PayloadType.Values.CONCEPT_NODE, value = ConceptNode.class),
        @JsonSubTypes.Type(name = PayloadType.Values.CONCEPT_EDGE, value = ConceptEdge.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class MemoryPayload {
    private final PayloadType type;

    public abstract <T> T accept(final PayloadVisitor<T> visitor);
}
