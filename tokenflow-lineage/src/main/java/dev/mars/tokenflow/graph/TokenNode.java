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

import dev.mars.tokenflow.core.ActivityAction;

import java.util.List;
import java.util.Objects;

/**
 * A token as recorded by its creation entry.
 *
 * @param createdAt      simulation time of creation
 * @param action         the creating action, {@link ActivityAction#CREATED} or an aggregation
 * @param sourceTokenIds parents as declared by the creation entry, whether or not they exist
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public record TokenNode(
        String tokenId,
        Object value,
        long createdAt,
        String originNodeId,
        ActivityAction action,
        OperationType operationType,
        List<String> sourceTokenIds) {

    public TokenNode {
        Objects.requireNonNull(tokenId, "Token id cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(operationType, "Operation type cannot be null");
        sourceTokenIds = sourceTokenIds == null ? List.of() : List.copyOf(sourceTokenIds);
    }
}
