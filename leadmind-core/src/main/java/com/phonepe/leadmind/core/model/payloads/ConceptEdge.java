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
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * A directed, typed relation between two concepts. {@code observations} holds the conversation ids already folded
 * into {@code strength}.
 */
@Value
@With
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConceptEdge extends MemoryPayload {
    public static final String CO_OCCURS_WITH = "co_occurs_with";

    String fromConcept;
    String toConcept;
    String relationType;
    double strength;
    Set<String> observations;

    @Builder(toBuilder = true)
    @Jacksonized
    public ConceptEdge(
            String fromConcept,
            String toConcept,
            String relationType,
            double strength,
            @Singular Set<String> observations) {
        super(PayloadType.CONCEPT_EDGE);
        this.fromConcept = fromConcept;
        this.toConcept = toConcept;
        this.relationType = relationType;
        this.strength = strength;
        this.observations = observations;
    }

    public String key() {
        return key(fromConcept, relationType, toConcept);
    }

    public static String key(String fromConcept, String relationType, String toConcept) {
        return "edge:%s|%s|%s".formatted(fromConcept, relationType, toConcept);
    }

    @Override
    public <T> T accept(PayloadVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
