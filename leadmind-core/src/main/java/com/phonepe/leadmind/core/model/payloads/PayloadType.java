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

import com.phonepe.leadmind.core.model.Tier;
import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Closed set of payload variants and the tier each one belongs to
 */
@Getter
public enum PayloadType {
    CONVERSATION_CONTEXT(Values.CONVERSATION_CONTEXT, Tier.SHORT_TERM),
    LEAD_PROFILE(Values.LEAD_PROFILE, Tier.LONG_TERM),
    HANDOFF_AUDIT(Values.HANDOFF_AUDIT, Tier.LONG_TERM),
    AGENT_ACTION_LOG(Values.AGENT_ACTION_LOG, Tier.LONG_TERM),
    EPISODE(Values.EPISODE, Tier.EPISODIC),
    CONCEPT_NODE(Values.CONCEPT_NODE, Tier.SEMANTIC),
    CONCEPT_EDGE(Values.CONCEPT_EDGE, Tier.SEMANTIC),
    ;

    private final String type;
    private final Tier tier;

    PayloadType(String type, Tier tier) {
        this.type = type;
        this.tier = tier;
    }

    @UtilityClass
    public static final class Values {
        public static final String CONVERSATION_CONTEXT = "CONVERSATION_CONTEXT";
        public static final String LEAD_PROFILE = "LEAD_PROFILE";
        public static final String HANDOFF_AUDIT = "HANDOFF_AUDIT";
        public static final String AGENT_ACTION_LOG = "AGENT_ACTION_LOG";
        public static final String EPISODE = "EPISODE";
        public static final String CONCEPT_NODE = "CONCEPT_NODE";
        public static final String CONCEPT_EDGE = "CONCEPT_EDGE";
    }
}
