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
 * What a token went on to produce.
 *
 * @param descendants the token and its descendants, depth-first
 * @param generations descendants by hop distance, 0 being the token
 * @param leaves      descendants nothing was derived from
 */
public record TokenDescendants(List<String> descendants, Map<Integer, List<String>> generations,
                               List<String> leaves) {

    public static TokenDescendants empty() {
        return new TokenDescendants(List.of(), Map.of(), List.of());
    }
}
