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

import dev.mars.tokenflow.workflow.model.DataSourceNode;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.model.ProcessInput;
import dev.mars.tokenflow.workflow.model.ProcessNode;
import dev.mars.tokenflow.workflow.model.ProcessOutput;
import dev.mars.tokenflow.workflow.model.QueueNode;
import dev.mars.tokenflow.workflow.model.Scenario;
import dev.mars.tokenflow.workflow.model.SinkNode;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Scenario fixtures shared by the workflow tests.
 */
public final class TestScenarios {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-09-10T09:00:00Z"), ZoneOffset.UTC);

    private TestScenarios() {
    }

    public static Scenario scenario(NodeDefinition... nodes) {
        return new Scenario(Scenario.CURRENT_VERSION, List.of(nodes));
    }

    /**
     * Validates the nodes and fails the calling test if the scenario has errors.
     */
    public static ValidatedScenario validated(NodeDefinition... nodes) {
        ScenarioValidation validation = new ScenarioValidator().validate(scenario(nodes));
        if (!validation.isValid()) {
            throw new AssertionError("Fixture scenario is invalid: " + validation.result().getErrors());
        }
        return validation.scenario();
    }

    public static ValidatedScenario fsmPipeline() throws ScenarioParseException {
        Scenario scenario = new ClasspathScenarioTemplateSource().findTemplate("fsm-pipeline")
                .orElseThrow(() -> new AssertionError("fsm-pipeline template missing"));
        ScenarioValidation validation = new ScenarioValidator().validate(scenario);
        if (!validation.isValid()) {
            throw new AssertionError("fsm-pipeline is invalid: " + validation.result().getErrors());
        }
        return validation.scenario();
    }

    public static DataSourceNode source(String id, long interval, double min, double max, String destination) {
        return new DataSourceNode(id, "Source " + id, interval, min, max, destination);
    }

    public static QueueNode queue(String id, long timeWindow, String method, Integer capacity, String destination) {
        return new QueueNode(id, "Queue " + id, timeWindow, method, capacity, destination);
    }

    public static ProcessNode process(String id, List<ProcessInput> inputs, List<ProcessOutput> outputs) {
        return new ProcessNode(id, "Process " + id, inputs, outputs);
    }

    public static SinkNode sink(String id) {
        return new SinkNode(id, "Sink " + id);
    }
}
