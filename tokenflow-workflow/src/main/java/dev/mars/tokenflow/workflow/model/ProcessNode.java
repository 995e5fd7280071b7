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

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates output formulas over named input tokens.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record ProcessNode(
        String nodeId,
        String displayName,
        List<ProcessInput> inputs,
        List<ProcessOutput> outputs) implements NodeDefinition {

    public ProcessNode {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PROCESS_NODE;
    }

    @Override
    public List<String> destinationNodeIds() {
        List<String> ids = new ArrayList<>();
        for (ProcessOutput output : outputs) {
            if (output.destinationNodeId() != null) {
                ids.add(output.destinationNodeId());
            }
        }
        return ids;
    }

    @Override
    public List<String> inputNodeIds() {
        List<String> ids = new ArrayList<>();
        for (ProcessInput input : inputs) {
            if (input.nodeId() != null) {
                ids.add(input.nodeId());
            }
        }
        return ids;
    }
}
