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

import dev.mars.tokenflow.core.ActivityAction;
import dev.mars.tokenflow.core.ActivityLog;
import dev.mars.tokenflow.core.HistoryEntry;
import dev.mars.tokenflow.core.HistoryFilter;
import dev.mars.tokenflow.core.Token;
import dev.mars.tokenflow.core.lineage.TokenLineageTracker;
import dev.mars.tokenflow.workflow.TestScenarios;
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.model.ProcessInput;
import dev.mars.tokenflow.workflow.model.ProcessNode;
import dev.mars.tokenflow.workflow.model.ProcessOutput;
import dev.mars.tokenflow.workflow.model.SinkNode;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.mars.tokenflow.workflow.TestScenarios.process;
import static dev.mars.tokenflow.workflow.TestScenarios.sink;
import static dev.mars.tokenflow.workflow.TestScenarios.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProcessNodeRuntime joins and formula evaluation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
class ProcessNodeRuntimeTest {

    private ValidatedScenario scenario;
    private SimulationContext context;
    private ProcessNodeRuntime join;
    private SinkRuntime out;

    private void setUp(ProcessOutput... outputs) {
        scenario = TestScenarios.validated(
                source("a", 1, 0, 10, "join"),
                source("b", 1, 0, 10, "join"),
                source("c", 1, 0, 10, "out"),
                process("join", List.of(new ProcessInput("x", "a"), new ProcessInput("y", "b")), List.of(outputs)),
                sink("out"));
        context = new SimulationContext(scenario, new ActivityLog(TestScenarios.FIXED_CLOCK),
                new TokenLineageTracker(), SimulationMetrics.noop());
        join = new ProcessNodeRuntime((ProcessNode) scenario.getNode("join").orElseThrow());
        out = new SinkRuntime((SinkNode) scenario.getNode("out").orElseThrow(), 10);
        context.registerRuntime(join);
        context.registerRuntime(out);
    }

    private Token send(String from, Object value) {
        Token token = context.createToken(scenario.getNode(from).orElseThrow(), value, List.of(),
                ActivityAction.CREATED, null);
        join.receive(new TokenDelivery(token, from));
        return token;
    }

    private List<HistoryEntry> joinEntries(ActivityAction action) {
        return context.getActivityLog().query(HistoryFilter.builder().nodeId("join").action(action).build());
    }

    @Test
    void testJoinWaitsForEveryReferencedInput() {
        setUp(new ProcessOutput("total", "x.value + yValue", "out"));
        Token x = send("a", 4L);

        join.onTick(0, context);
        assertTrue(joinEntries(ActivityAction.CREATED).isEmpty());
        assertEquals(List.of(x), join.getPending("x"));

        Token y = send("b", 6L);
        join.onTick(0, context);

        List<HistoryEntry> created = joinEntries(ActivityAction.CREATED);
        assertEquals(1, created.size());
        HistoryEntry entry = created.get(0);
        assertEquals(10L, entry.value());
        assertEquals(List.of(x.id(), y.id()), entry.sourceTokenIds());
        assertEquals("formula=x.value + yValue; inputs={x=4, y=6}; result=10", entry.details());
        assertEquals(1, join.getFiringCount());
        assertTrue(join.getPending("x").isEmpty());
        assertTrue(join.getPending("y").isEmpty());

        assertThat(out.getPendingDeliveries()).extracting(d -> d.token().id()).containsExactly(entry.tokenId());
    }

    @Test
    void testQueuedTokensPairInArrivalOrder() {
        setUp(new ProcessOutput("diff", "xValue - yValue", "out"));
        send("a", 10L);
        send("a", 20L);
        send("b", 1L);
        send("b", 2L);

        join.onTick(0, context);

        assertThat(joinEntries(ActivityAction.CREATED)).extracting(HistoryEntry::value).containsExactly(9L, 18L);
        assertEquals(2, join.getFiringCount());
    }

    @Test
    void testOutputsFireIndependently() {
        setUp(new ProcessOutput("doubled", "xValue * 2", "out"),
                new ProcessOutput("bumped", "yValue + 1", "out"));
        send("a", 5L);

        join.onTick(0, context);

        assertThat(joinEntries(ActivityAction.CREATED)).extracting(HistoryEntry::value).containsExactly(10L);
        assertTrue(join.getPending("x").isEmpty());
    }

    @Test
    void testInputsBindingNeedsAllInputs() {
        setUp(new ProcessOutput("total", "inputs.x.value * inputs.y.value", "out"));
        send("a", 3L);
        join.onTick(0, context);
        assertTrue(joinEntries(ActivityAction.CREATED).isEmpty());

        send("b", 7L);
        join.onTick(0, context);

        assertEquals(21L, joinEntries(ActivityAction.CREATED).get(0).value());
    }

    @Test
    void testTokenViewExposesTokenFields() {
        setUp(new ProcessOutput("origin", "x.originNodeId + ':' + x.data.value", "out"));
        send("a", 8L);
        send("b", 1L);

        join.onTick(0, context);

        assertEquals("a:8", joinEntries(ActivityAction.CREATED).get(0).value());
    }

    @Test
    void testUnknownNameLogsErrorAndConsumesInputs() {
        setUp(new ProcessOutput("broken", "z + 1", "out"));
        Token x = send("a", 1L);
        Token y = send("b", 2L);

        join.onTick(0, context);

        assertTrue(joinEntries(ActivityAction.CREATED).isEmpty());
        List<HistoryEntry> errors = joinEntries(ActivityAction.EVALUATION_ERROR);
        assertEquals(1, errors.size());
        assertThat(errors.get(0).details()).startsWith("Output broken: ").contains("'z'")
                .endsWith("in formula 'z + 1'");
        assertEquals(List.of(x.id(), y.id()), errors.get(0).sourceTokenIds());
        assertTrue(join.getPending("x").isEmpty());
        assertTrue(join.getPending("y").isEmpty());
        assertTrue(out.getPendingDeliveries().isEmpty());
    }

    @Test
    void testUnboundSenderIsRejected() {
        setUp(new ProcessOutput("total", "xValue + yValue", "out"));
        Token stray = context.createToken(scenario.getNode("c").orElseThrow(), 1L, List.of(),
                ActivityAction.CREATED, null);
        join.receive(new TokenDelivery(stray, "c"));

        join.onTick(0, context);

        List<HistoryEntry> errors = joinEntries(ActivityAction.EVALUATION_ERROR);
        assertEquals(1, errors.size());
        assertEquals("Token " + stray.id() + " from c is not bound to any input", errors.get(0).details());
        assertTrue(join.getPending("x").isEmpty());
    }

    @Test
    void testSnapshotAndRestorePendingInputs() {
        setUp(new ProcessOutput("total", "xValue + yValue", "out"));
        send("a", 4L);
        join.onTick(0, context);

        NodeState.ProcessNodeState saved = join.snapshot();
        join.reset();
        assertTrue(join.getPending("x").isEmpty());

        join.restore(saved);
        send("b", 5L);
        join.onTick(1, context);

        assertEquals(9L, joinEntries(ActivityAction.CREATED).get(0).value());
    }

    @Test
    void testRestoreRejectsUnknownInput() {
        setUp(new ProcessOutput("total", "xValue + yValue", "out"));
        NodeState.ProcessNodeState foreign = new NodeState.ProcessNodeState(Map.of("q", List.of()), 0);

        assertThrows(IllegalArgumentException.class, () -> join.restore(foreign));
    }
}
