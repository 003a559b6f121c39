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

import java.time.Instant;
import java.util.Optional;

/**
 * Keyed storage for one memory tier. Implementations signal transient failures by throwing
 * {@link com.phonepe.leadmind.core.errors.UnavailableError}; callers retry those.
 */
public interface TierStore {
    Tier tier();

    /**
     * Writes or overwrites the record with the same key. Returning normally means the write is durable for this
     * store's guarantees.
     */
    void write(MemoryRecord memoryRecord);

    Optional<MemoryRecord> read(String key);

    /**
     * Update last access time for a record. Stores that do not track access may ignore this.
     */
    default void touch(String key, Instant accessedAt) {
        //Nothing to do by default
    }
}
