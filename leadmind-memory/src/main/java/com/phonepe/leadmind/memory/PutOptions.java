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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Options for {@link MemoryManager#put}
 */
@Value
@Builder
public class PutOptions {
    public static final PutOptions NONE = PutOptions.builder().build();

    /**
     * Mandatory for the short term tier, rejected for all others
     */
    Duration ttl;

    @Singular
    Set<String> tags;

    public static PutOptions ttl(Duration ttl) {
        return PutOptions.builder().ttl(ttl).build();
    }
}
