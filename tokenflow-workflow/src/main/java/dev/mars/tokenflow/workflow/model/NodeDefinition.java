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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * One node of a scenario. The set of node kinds is closed; the JSON {@code type} property selects
 * the variant when a scenario is loaded.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DataSourceNode.class, name = "DataSource"),
        @JsonSubTypes.Type(value = QueueNode.class, name = "Queue"),
        @JsonSubTypes.Type(value = ProcessNode.class, name = "ProcessNode"),
        @JsonSubTypes.Type(value = FsmNode.class, name = "FSM"),
        @JsonSubTypes.Type(value = StateMultiplexerNode.class, name = "StateMultiplexer"),
        @JsonSubTypes.Type(value = SinkNode.class, name = "Sink")
})
public sealed interface NodeDefinition
        permits DataSourceNode, QueueNode, ProcessNode, FsmNode, StateMultiplexerNode, SinkNode {

    String nodeId();

    String displayName();

    NodeType nodeType();

    /**
     * Every node id this node sends tokens to, in declaration order. Null references are left out.
     */
    List<String> destinationNodeIds();

    /**
     * Upstream node ids this node declares as explicit inputs.
     */
    default List<String> inputNodeIds() {
        return List.of();
    }
}
