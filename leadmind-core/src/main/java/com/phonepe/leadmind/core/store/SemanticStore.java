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
import java.util.Set;

/**
 * Concept graph store. Nodes and edges are written through {@link #write}; edges implicitly create missing nodes.
 */
public interface SemanticStore extends TierStore {
    /**
     * Breadth first traversal along outgoing edges.
     *
     * @param startConcept  Concept to start from
     * @param maxDepth      Maximum number of hops
     * @param relationTypes Relations to follow. Empty means all.
     * @param limit         Maximum hits
     * @return Edges traversed, ordered by depth and then by descending strength
     */
    List<TraversalHit> traverse(String startConcept, int maxDepth, Set<String> relationTypes, int limit);
}
