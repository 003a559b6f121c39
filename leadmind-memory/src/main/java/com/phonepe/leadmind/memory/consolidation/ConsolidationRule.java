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

/**
 * One step of a consolidation pass. Rules must be idempotent: applying a rule twice over unchanged inputs must not
 * change any tier the second time.
 */
public interface ConsolidationRule {
    String name();

    /**
     * Apply the rule to everything currently live in the source tier. Failures for individual items are recorded in
     * the result; an exception escaping this method fails the whole rule but not the pass.
     */
    RuleResult apply(ConsolidationContext context);
}
