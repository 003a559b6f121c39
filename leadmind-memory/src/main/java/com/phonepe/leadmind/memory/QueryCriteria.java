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

package com.phonepe.leadmind.memory;

import com.phonepe.leadmind.core.model.payloads.PayloadType;
import com.phonepe.leadmind.core.store.RecordFilter;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;

/**
 * Criteria for {@link MemoryManager#query}. Which fields apply depends on the tier:
 * <ul>
 *     <li>short and long term: payloadType, keyPrefix, tags, accessedSince</li>
 *     <li>episodic: fingerprint (required), scenarioTag, minSimilarity</li>
 *     <li>semantic: startConcept (required), maxDepth, relationTypes</li>
 * </ul>
 * Unset numeric fields fall back to {@link MemorySetup} defaults.
 */
@Value
@Builder
@Jacksonized
public class QueryCriteria {
    PayloadType payloadType;
    String keyPrefix;
    @Singular
    Set<String> tags;
    Instant accessedSince;

    float[] fingerprint;
    String scenarioTag;
    Double minSimilarity;

    String startConcept;
    Integer maxDepth;
    @Singular
    Set<String> relationTypes;

    Integer limit;

    public static QueryCriteria all() {
        return QueryCriteria.builder().build();
    }

    RecordFilter toFilter(int defaultLimit) {
        return RecordFilter.builder()
                .payloadType(payloadType)
                .keyPrefix(keyPrefix)
                .tags(tags)
                .accessedSince(accessedSince)
                .limit(limit == null ? defaultLimit : limit)
                .build();
    }
}
