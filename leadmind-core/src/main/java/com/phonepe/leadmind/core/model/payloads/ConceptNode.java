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

package com.phonepe.leadmind.core.model.payloads;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A node in the semantic graph
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConceptNode extends MemoryPayload {
    public static final String DEFAULT_CATEGORY = "concept";

    String name;
    String category;

    @Builder
    @Jacksonized
    public ConceptNode(String name, String category) {
        super(PayloadType.CONCEPT_NODE);
        this.name = name;
        this.category = category;
    }

    public static String key(String name) {
        return "node:" + name;
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
