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

package com.phonepe.leadmind.core.store;

import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.Tier;
import com.phonepe.leadmind.core.model.payloads.AgentActionLog;
import com.phonepe.leadmind.core.model.payloads.HandoffAudit;
import com.phonepe.leadmind.core.model.payloads.PayloadType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordFilterTest {
    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    @Test
    void testAllConditionsMustHold() {
        final var audit = MemoryRecord.builder()
                .tier(Tier.LONG_TERM)
                .key("H1")
                .payload(HandoffAudit.builder().handoffId("H1").leadId("L1").build())
                .lastAccessedAt(NOW)
                .tag("lead:L1")
                .build();
        final var action = MemoryRecord.builder()
                .tier(Tier.LONG_TERM)
                .key("A1")
                .payload(AgentActionLog.builder().actionId("A1").agentId("scoring").actionType("score").build())
                .lastAccessedAt(NOW.minusSeconds(3600))
                .build();

        assertTrue(RecordFilter.builder().build().matches(audit));
        assertTrue(RecordFilter.builder().payloadType(PayloadType.HANDOFF_AUDIT).build().matches(audit));
        assertFalse(RecordFilter.builder().payloadType(PayloadType.HANDOFF_AUDIT).build().matches(action));
        assertTrue(RecordFilter.builder().keyPrefix("H").build().matches(audit));
        assertFalse(RecordFilter.builder().keyPrefix("H").build().matches(action));
        assertTrue(RecordFilter.builder().tag("lead:L1").build().matches(audit));
        assertFalse(RecordFilter.builder().tag("lead:L1").tag("vip").build().matches(audit));
        assertTrue(RecordFilter.builder().accessedSince(NOW.minusSeconds(60)).build().matches(audit));
        assertFalse(RecordFilter.builder().accessedSince(NOW.minusSeconds(60)).build().matches(action));
    }
}
