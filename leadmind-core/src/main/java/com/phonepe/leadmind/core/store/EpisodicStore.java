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

import java.util.List;

/**
 * Store of episodes with nearest neighbour search over fixed dimension fingerprints
 */
public interface EpisodicStore extends TierStore {
    /**
     * Cosine similarity search.
     *
     * @param fingerprint   Query vector. Must have the store's dimension.
     * @param scenarioTag   If not null, only episodes with this tag are considered
     * @param minSimilarity Lower bound on similarity, inclusive
     * @param limit         Maximum hits
     * @return Hits ordered by descending similarity
     */
    List<ScoredRecord> nearest(float[] fingerprint, String scenarioTag, double minSimilarity, int limit);

    int dimension();
}
