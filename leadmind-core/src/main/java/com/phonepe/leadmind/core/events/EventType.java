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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.experimental.UtilityClass;

/**
 * Notification topics. Serialized by topic name.
 */
public enum EventType {
    LEAD_PROCESSED(Values.LEAD_PROCESSED),
    AGENT_STATUS(Values.AGENT_STATUS),
    HANDOFF_FAILED(Values.HANDOFF_FAILED),
    ;

    private final String type;

    EventType(String type) {
        this.type = type;
    }

    @JsonValue
    public String getType() {
        return type;
    }

    @UtilityClass
    public static final class Values {
        public static final String LEAD_PROCESSED = "lead.processed";
        public static final String AGENT_STATUS = "agent.status";
        public static final String HANDOFF_FAILED = "handoff.failed";
    }
}
