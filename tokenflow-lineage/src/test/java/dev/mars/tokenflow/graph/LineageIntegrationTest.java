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

import dev.mars.tokenflow.core.HistoryEntry;
import dev.mars.tokenflow.core.lineage.TokenLineageNode;
import dev.mars.tokenflow.workflow.ClasspathScenarioTemplateSource;
import dev.mars.tokenflow.workflow.ScenarioParseException;
import dev.mars.tokenflow.workflow.ScenarioValidation;
import dev.mars.tokenflow.workflow.ScenarioValidator;
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.engine.ExecutionStateCodec;
import dev.mars.tokenflow.workflow.engine.ExecutionStateException;
import dev.mars.tokenflow.workflow.engine.SimulationEngine;
import dev.mars.tokenflow.workflow.model.DataSourceNode;
import dev.mars.tokenflow.workflow.model.QueueNode;
import dev.mars.tokenflow.workflow.model.Scenario;
import dev.mars.tokenflow.workflow.model.SinkNode;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import dev.mars.tokenflow.workflow.runtime.SequenceValueGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Builds token graphs from the activity log of real simulation runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
class LineageIntegrationTest {

    private static ValidatedScenario validate(Scenario scenario) {
        ScenarioValidation validation = new ScenarioValidator().validate(scenario);
        return validation.validated()
                .orElseThrow(() -> new AssertionError("Invalid scenario: " + validation.result().getErrors()));
    }

    private static SimulationEngine pipelineRun() throws ScenarioParseException {
        Scenario scenario = new ClasspathScenarioTemplateSource().findTemplate("fsm-pipeline").orElseThrow();
        SimulationEngine engine = SimulationEngine.builder(validate(scenario))
                .metrics(SimulationMetrics.noop())
                .valueGenerator("generator", SequenceValueGenerator.of(2, 5, 9))
                .build();
        engine.run(5);
        return engine;
    }

    @Test
    void testPipelineGraph() throws ScenarioParseException {
        SimulationEngine engine = pipelineRun();
        TokenGraph graph = TokenGraphBuilder.buildFromHistory(engine.getActivityLog().entries());

        assertEquals(new GraphStatistics(9, 6, 3, 3, 2, false), graph.getGraphStats());
        assertEquals(List.of("tok-1", "tok-4", "tok-7"), graph.findRootTokens());
        assertEquals(List.of("tok-3", "tok-6", "tok-9"), graph.findLeafTokens());
        assertEquals(List.of("tok-9", "tok-8", "tok-7"), graph.dfsAncestryTraversal("tok-9"));
    }

    @Test
    void testAnalyzerFollowsTheLiveLog() throws ScenarioParseException {
        SimulationEngine engine = pipelineRun();
        LineageAnalyzer analyzer = new LineageAnalyzer();

        assertEquals(9, analyzer.analyzeTokenLineage(engine.getActivityLog().entries()).totalTokens());
        analyzer.getTokenAncestry("tok-9", engine.getActivityLog().entries());
        assertEquals(1, analyzer.getGraphCache().getHits());

        engine.reset();
        engine.run(1);
        assertEquals(3, analyzer.analyzeTokenLineage(engine.getActivityLog().entries()).totalTokens());
        assertEquals(2, analyzer.getGraphCache().getMisses());
    }

    @Test
    void testGraphAgreesWithLiveTracker() throws ScenarioParseException {
        SimulationEngine engine = pipelineRun();
        TokenGraph graph = TokenGraphBuilder.buildFromHistory(engine.getActivityLog().entries());

        assertEquals(engine.getLineageTracker().size(), graph.size());
        for (String tokenId : graph.getAllTokenIds()) {
            TokenLineageNode tracked = engine.getLineageTracker().getNode(tokenId).orElseThrow();
            assertEquals(tracked.getParentTokens(), graph.getParents(tokenId), tokenId);
            assertEquals(tracked.getValue(), graph.getNode(tokenId).orElseThrow().value(), tokenId);
        }
    }

    @Test
    void testPipelineIntegrityAndAncestry() throws ScenarioParseException {
        List<HistoryEntry> entries = pipelineRun().getActivityLog().entries();
        LineageAnalyzer analyzer = new LineageAnalyzer();

        IntegrityReport report = analyzer.validateIntegrity(entries);
        assertTrue(report.isValid(), () -> report.errors().toString());
        assertFalse(report.hasWarnings());

        TokenAncestry ancestry = analyzer.getTokenAncestry("tok-9", entries);
        assertEquals(List.of("tok-7"), ancestry.roots());
        assertEquals(9L, TokenGraphBuilder.buildFromHistory(entries).getNode("tok-7").orElseThrow().value());
    }

    @Test
    void testGraphFromRestoredLog() throws ScenarioParseException, ExecutionStateException {
        SimulationEngine engine = pipelineRun();
        ExecutionStateCodec codec = new ExecutionStateCodec();

        List<HistoryEntry> restored = codec.decode(codec.encode(engine.snapshot())).globalActivityLog();

        assertEquals(TokenGraphBuilder.buildFromHistory(engine.getActivityLog().entries()).getGraphStats(),
                TokenGraphBuilder.buildFromHistory(restored).getGraphStats());
    }

    @Test
    void testQueueAggregationIsAnAggregationNode() {
        ValidatedScenario scenario = validate(new Scenario(Scenario.CURRENT_VERSION, List.of(
                new DataSourceNode("src", "Source", 1L, 1.0, 1.0, "window"),
                new QueueNode("window", "Window", 3L, "sum", null, "out"),
                new SinkNode("out", "Out"))));
        SimulationEngine engine = SimulationEngine.builder(scenario).metrics(SimulationMetrics.noop()).build();
        engine.run(4);

        TokenGraph graph = TokenGraphBuilder.buildFromHistory(engine.getActivityLog().entries());

        TokenNode sum = graph.getNode("tok-5").orElseThrow();
        assertEquals(OperationType.AGGREGATION, sum.operationType());
        assertEquals(3L, sum.value());
        assertEquals(List.of("tok-1", "tok-2", "tok-3"), graph.getParents("tok-5"));
        assertEquals(OperationType.DATASOURCE_CREATION, graph.getNode("tok-1").orElseThrow().operationType());
    }
}
