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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four memory tiers. Each has its own consistency and latency profile and accepts its own payload variants.
 */
public enum Tier {
    /**
     * Live conversation contexts. Every record expires.
     */
    SHORT_TERM("short_term"),
    /**
     * Lead profiles, handoff audits and action logs. Queried with structured predicates.
     */
    LONG_TERM("long_term"),
    /**
     * Successful episodes, searched by fingerprint similarity.
     */
    EPISODIC("episodic"),
    /**
     * Concept graph, searched by bounded traversal.
     */
    SEMANTIC("semantic"),
    ;

    private final String wireName;

    Tier(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Tier> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(tier -> tier.wireName.equalsIgnoreCase(name) || tier.name().equalsIgnoreCase(name))
                .findFirst();
    }

    @JsonCreator
    static Tier fromJson(String name) {
        return fromWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tier: " + name));
    }
}
