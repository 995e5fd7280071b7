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

/**
 * An ancestor whose value fed into a token.
 *
 * @param contributionPath a shortest path of token ids from this ancestor down to the token, empty if
 *                         none was found within the path depth limit
 */
public record TokenContributor(
        String tokenId,
        Object value,
        String originNodeId,
        long createdAt,
        List<String> contributionPath,
        boolean directParent,
        boolean root) {

    public TokenContributor {
        contributionPath = List.copyOf(contributionPath);
    }
}
