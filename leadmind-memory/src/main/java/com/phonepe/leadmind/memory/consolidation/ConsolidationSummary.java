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

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate outcome of one consolidation pass
 */
@Value
public class ConsolidationSummary {
    Instant startedAt;
    Instant finishedAt;
    List<RuleResult> ruleResults;

    public int getMigrated() {
        return ruleResults.stream().mapToInt(RuleResult::getMigrated).sum();
    }

    public int getSkipped() {
        return ruleResults.stream().mapToInt(RuleResult::getSkipped).sum();
    }

    public int getFailed() {
        return ruleResults.stream().mapToInt(RuleResult::getFailed).sum();
    }

    public List<String> getErrors() {
        return ruleResults.stream()
                .flatMap(ruleResult -> ruleResult.getErrors().stream())
                .toList();
    }

    public RuleResult resultFor(String ruleName) {
        return ruleResults.stream()
                .filter(ruleResult -> ruleResult.getRuleName().equals(ruleName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No result for rule " + ruleName));
    }
}
