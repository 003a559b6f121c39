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

import com.google.common.base.Strings;
import com.phonepe.leadmind.core.model.MemoryRecord;
import com.phonepe.leadmind.core.model.payloads.PayloadType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

/**
 * Structured predicate for long term queries. All set conditions must hold.
 */
@Value
@Builder
@Jacksonized
public class RecordFilter {
    public static final int DEFAULT_LIMIT = 100;

    PayloadType payloadType;
    String keyPrefix;
    @Singular
    Set<String> tags;
    Instant accessedSince;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public boolean matches(MemoryRecord memoryRecord) {
        if (payloadType != null && memoryRecord.getPayload().getType() != payloadType) {
            return false;
        }
        if (!Strings.isNullOrEmpty(keyPrefix) && !memoryRecord.getKey().startsWith(keyPrefix)) {
            return false;
        }
        if (!tags.isEmpty() && !memoryRecord.getTags().containsAll(tags)) {
            return false;
        }
        return accessedSince == null
                || (memoryRecord.getLastAccessedAt() != null
                && !memoryRecord.getLastAccessedAt().isBefore(accessedSince));
    }
}
