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

package com.phonepe.leadmind.memory.consolidation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of applying one rule
 */
@Value
@Builder
public class RuleResult {
    String ruleName;
    int migrated;
    int skipped;
    int failed;
    @Singular
    List<String> errors;

    public static RuleResult failure(String ruleName, Throwable error) {
        return RuleResult.builder()
                .ruleName(ruleName)
                .failed(1)
                .error(ruleName + ": " + error.getMessage())
                .build();
    }
}
