/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tokenflow.core.lineage;

import java.util.Map;

/**
 * Snapshot counters of a {@link TokenLineageTracker}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record LineageStatistics(int totalTokens, int relationships, int maxDepth, Map<LineageType, Long> tokensByType) {

    public LineageStatistics {
        tokensByType = Map.copyOf(tokensByType);
    }

    public long count(LineageType type) {
        return tokensByType.getOrDefault(type, 0L);
    }
}
