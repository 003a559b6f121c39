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
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Request by the owning agent to pass a conversation on. {@code handoffId} makes the request idempotent.
 */
@Value
@Builder
@Jacksonized
public class HandoffRequest {
    String handoffId;
    String leadId;
    String conversationId;
    String sourceAgent;
    /**
     * Preferred agent id or role. When null any registered agent other than the source may be chosen.
     */
    String targetAgent;
    ContextSnapshot context;
    int priority;
    Instant createdAt;
}
