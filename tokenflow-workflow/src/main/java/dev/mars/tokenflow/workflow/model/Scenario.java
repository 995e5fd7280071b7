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
import java.util.Optional;

/**
 * A scenario document: {@code {"version": "1.0", "nodes": [...]}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record Scenario(String version, List<NodeDefinition> nodes) {

    public static final String CURRENT_VERSION = "1.0";

    public Scenario {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public Optional<NodeDefinition> node(String nodeId) {
        for (NodeDefinition node : nodes) {
            if (node.nodeId() != null && node.nodeId().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
