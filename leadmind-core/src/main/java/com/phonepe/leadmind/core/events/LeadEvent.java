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

package com.phonepe.leadmind.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A fire and forget notification. Delivery is at least once, so listeners should de-duplicate on {@code eventId}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = EventType.Values.LEAD_PROCESSED, value = LeadProcessedEvent.class),
        @JsonSubTypes.Type(name = EventType.Values.AGENT_STATUS, value = AgentStatusEvent.class),
        @JsonSubTypes.Type(name = EventType.Values.HANDOFF_FAILED, value = HandoffFailedEvent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class LeadEvent {
    private final EventType type;
    private final String eventId = UUID.randomUUID().toString();
    private final Instant timestamp = Instant.now();

    public abstract <T> T accept(final LeadEventVisitor<T> visitor);
}
