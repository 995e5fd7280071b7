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
 * Finite-state machine node. Incoming tokens are read as messages; entry actions may emit tokens to
 * {@code destinationNodeId}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record FsmNode(
        String nodeId,
        String displayName,
        List<String> inputs,
        FsmDefinition fsm,
        String destinationNodeId) implements NodeDefinition {

    public FsmNode {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FSM;
    }

    @Override
    public List<String> destinationNodeIds() {
        return destinationNodeId == null ? List.of() : List.of(destinationNodeId);
    }

    @Override
    public List<String> inputNodeIds() {
        return inputs;
    }
}
