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

package dev.mars.tokenflow.workflow.model;

import java.util.List;

/**
 * Emits one sampled token every {@code interval} time units.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record DataSourceNode(
        String nodeId,
        String displayName,
        Long interval,
        Double valueMin,
        Double valueMax,
        String destinationNodeId) implements NodeDefinition {

    @Override
    public NodeType nodeType() {
        return NodeType.DATA_SOURCE;
    }

    @Override
    public List<String> destinationNodeIds() {
        return destinationNodeId == null ? List.of() : List.of(destinationNodeId);
    }
}
