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

package dev.mars.tokenflow.workflow.runtime;

import dev.mars.tokenflow.config.TokenflowConfiguration;
import dev.mars.tokenflow.workflow.model.DataSourceNode;
import dev.mars.tokenflow.workflow.model.FsmNode;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.model.ProcessNode;
import dev.mars.tokenflow.workflow.model.QueueNode;
import dev.mars.tokenflow.workflow.model.SinkNode;
import dev.mars.tokenflow.workflow.model.StateMultiplexerNode;

import java.util.Map;

/**
 * Creates the runtime for each node kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class NodeRuntimeFactory {

    private final TokenflowConfiguration configuration;
    private final Map<String, ValueGenerator> generators;

    /**
     * @param generators value generators by DataSource node id; other DataSources get a seeded
     *                   {@link RandomValueGenerator}
     */
    public NodeRuntimeFactory(TokenflowConfiguration configuration, Map<String, ValueGenerator> generators) {
        this.configuration = configuration;
        this.generators = Map.copyOf(generators);
    }

    public NodeRuntime create(NodeDefinition node) {
        if (node instanceof DataSourceNode dataSource) {
            ValueGenerator generator = generators.get(node.nodeId());
            if (generator == null) {
                generator = RandomValueGenerator.forNode(configuration.getSeed(), node.nodeId());
            }
            return new DataSourceRuntime(dataSource, generator);
        }
        if (node instanceof QueueNode queue) {
            return new QueueRuntime(queue);
        }
        if (node instanceof ProcessNode process) {
            return new ProcessNodeRuntime(process);
        }
        if (node instanceof FsmNode fsm) {
            return new StateMachineRuntime(fsm);
        }
        if (node instanceof StateMultiplexerNode multiplexer) {
            return new StateMultiplexerRuntime(multiplexer);
        }
        if (node instanceof SinkNode sink) {
            return new SinkRuntime(sink, configuration.getSinkRetainedTokens());
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }
}
