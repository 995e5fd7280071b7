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

package dev.mars.tokenflow.workflow;

import dev.mars.tokenflow.workflow.expression.CompiledExpression;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.model.Scenario;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A scenario that passed validation, with its execution order and every formula and condition
 * already compiled. Only {@link ScenarioValidator} creates instances.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class ValidatedScenario {

    private final Scenario scenario;
    private final List<NodeDefinition> executionOrder;
    private final Map<String, CompiledExpression> expressions;
    private final boolean cyclic;

    ValidatedScenario(Scenario scenario, List<String> executionOrder,
                      Map<String, CompiledExpression> expressions, boolean cyclic) {
        this.scenario = scenario;
        List<NodeDefinition> ordered = new ArrayList<>();
        for (String nodeId : executionOrder) {
            scenario.node(nodeId).ifPresent(ordered::add);
        }
        this.executionOrder = List.copyOf(ordered);
        this.expressions = Map.copyOf(expressions);
        this.cyclic = cyclic;
    }

    public Scenario getScenario() {
        return scenario;
    }

    /**
     * Nodes with producers ahead of their consumers.
     */
    public List<NodeDefinition> getExecutionOrder() {
        return executionOrder;
    }

    public Optional<NodeDefinition> getNode(String nodeId) {
        return scenario.node(nodeId);
    }

    /**
     * The compiled form of a formula or condition that appears in the scenario.
     *
     * @throws IllegalArgumentException if the text does not appear in the scenario
     */
    public CompiledExpression expression(String source) {
        CompiledExpression compiled = expressions.get(source);
        if (compiled == null) {
            throw new IllegalArgumentException("Expression was not part of the validated scenario: " + source);
        }
        return compiled;
    }

    public boolean hasFeedbackLoops() {
        return cyclic;
    }
}
