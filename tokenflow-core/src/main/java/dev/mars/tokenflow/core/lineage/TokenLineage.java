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

import java.util.List;

/**
 * Complete lineage view of one token. All lists are ordered by timestamp.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public record TokenLineage(
        TokenLineageNode token,
        List<TokenLineageNode> ancestors,
        List<TokenLineageNode> descendants,
        List<TokenLineageNode> siblings,
        List<TokenLineageNode> fullPath) {

    public TokenLineage {
        ancestors = List.copyOf(ancestors);
        descendants = List.copyOf(descendants);
        siblings = List.copyOf(siblings);
        fullPath = List.copyOf(fullPath);
    }
}
