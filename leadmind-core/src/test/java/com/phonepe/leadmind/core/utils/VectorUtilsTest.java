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

package com.phonepe.leadmind.core.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VectorUtilsTest {

    @Test
    void testCosineSimilarity() {
        assertEquals(1.0, VectorUtils.cosineSimilarity(new float[]{1, 0}, new float[]{2, 0}), 1e-6);
        assertEquals(0.0, VectorUtils.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1}), 1e-6);
        assertEquals(-1.0, VectorUtils.cosineSimilarity(new float[]{1, 0}, new float[]{-1, 0}), 1e-6);
        assertEquals(0.0, VectorUtils.cosineSimilarity(new float[]{1, 0}, new float[]{1, 0, 0}));
        assertEquals(0.0, VectorUtils.cosineSimilarity(new float[]{0, 0}, new float[]{1, 0}));
        assertEquals(0.0, VectorUtils.cosineSimilarity(null, new float[]{1, 0}));
    }

    @Test
    void testNormalize() {
        assertArrayEquals(new float[]{0.6f, 0.8f}, VectorUtils.normalize(new float[]{3, 4}), 1e-6f);
        assertArrayEquals(new float[]{0, 0}, VectorUtils.normalize(new float[]{0, 0}));
    }
}
