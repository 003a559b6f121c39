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

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Merges conversation preferences into a profile. Numbers are averaged weighted by interaction counts, collections
 * are unioned and anything else takes the incoming value.
 */
@UtilityClass
public class PreferenceMerger {

    public static Map<String, Object> merge(
            Map<String, Object> existing,
            int existingWeight,
            Map<String, Object> incoming,
            int incomingWeight) {
        final var merged = new LinkedHashMap<>(existing);
        incoming.forEach((name, value) -> merged.merge(
                name, value, (current, update) -> mergeValue(current, existingWeight, update, incomingWeight)));
        return merged;
    }

    private static Object mergeValue(Object current, int currentWeight, Object update, int updateWeight) {
        if (current instanceof Number currentNumber && update instanceof Number updateNumber) {
            final var totalWeight = currentWeight + updateWeight;
            if (totalWeight <= 0) {
                return updateNumber.doubleValue();
            }
            return (currentNumber.doubleValue() * currentWeight + updateNumber.doubleValue() * updateWeight)
                    / totalWeight;
        }
        if (current instanceof Collection<?> currentValues && update instanceof Collection<?> updateValues) {
            final var union = new LinkedHashSet<Object>(currentValues);
            union.addAll(updateValues);
            return new ArrayList<>(union);
        }
        return update;
    }
}
