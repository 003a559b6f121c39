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

package com.phonepe.leadmind.core.model;

import com.phonepe.leadmind.core.model.payloads.MemoryPayload;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

/**
 * A single entry in one of the memory tiers. Keys are unique within a tier.
 */
@Value
@With
@Builder
@Jacksonized
public class MemoryRecord {
    @NonNull
    Tier tier;

    @NonNull
    String key;

    @NonNull
    MemoryPayload payload;

    Instant createdAt;

    Instant lastAccessedAt;

    /**
     * Mandatory for short term records, null everywhere else
     */
    Instant expiresAt;

    @Singular
    Set<String> tags;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
