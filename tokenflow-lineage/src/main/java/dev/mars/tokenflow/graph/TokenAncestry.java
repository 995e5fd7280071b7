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

package dev.mars.tokenflow.graph;

import java.util.List;
import java.util.Map;

/**
 * Where a token came from.
 *
 * @param ancestors   the token and its ancestors, depth-first
 * @param generations ancestors by hop distance, 0 being the token
 * @param roots       ancestors created by a DataSource
 */
public record TokenAncestry(List<String> ancestors, Map<Integer, List<String>> generations, List<String> roots) {

    public static TokenAncestry empty() {
        return new TokenAncestry(List.of(), Map.of(), List.of());
    }
}
