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
import dev.mars.tokenflow.core.Token;
import dev.mars.tokenflow.core.lineage.TokenLineageTracker;
import dev.mars.tokenflow.workflow.TestScenarios;
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.model.FsmAction;
import dev.mars.tokenflow.workflow.model.FsmDefinition;
import dev.mars.tokenflow.workflow.model.FsmNode;
import dev.mars.tokenflow.workflow.model.FsmState;
import dev.mars.tokenflow.workflow.model.FsmTransition;
import dev.mars.tokenflow.workflow.model.SinkNode;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.mars.tokenflow.workflow.TestScenarios.sink;
import static dev.mars.tokenflow.workflow.TestScenarios.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StateMachineRuntime transitions, actions and snapshots.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
class StateMachineRuntimeTest {

    private ValidatedScenario scenario;
    private SimulationContext context;
    private StateMachineRuntime controller;
    private SinkRuntime out;
    private SimulationMetrics metrics;

    @BeforeEach
    void setUp() {
        FsmDefinition fsm = new FsmDefinition(
                List.of(
                        new FsmState("idle", List.of(), List.of(new FsmAction(FsmAction.LOG, null, "leaving idle"))),
                        new FsmState("busy", List.of(new FsmAction(FsmAction.EMIT, null, null),
                                new FsmAction(FsmAction.LOG, null, "busy now")), List.of()),
                        new FsmState("done", List.of(new FsmAction(FsmAction.EMIT, 42, null)), List.of())),
                List.of(
                        new FsmTransition("idle", "busy", "start", null),
                        new FsmTransition("busy", "done", null, "value > 10"),
                        new FsmTransition("busy", "idle", "reset", null)),
                "idle");
        scenario = TestScenarios.validated(
                source("src", 1, 0, 10, "controller"),
                new FsmNode("controller", "Controller", List.of("src"), fsm, "out"),
                sink("out"));
        metrics = SimulationMetrics.noop();
        context = new SimulationContext(scenario, new ActivityLog(TestScenarios.FIXED_CLOCK),
                new TokenLineageTracker(), metrics);
        controller = new StateMachineRuntime((FsmNode) scenario.getNode("controller").orElseThrow());
        out = new SinkRuntime((SinkNode) scenario.getNode("out").orElseThrow(), 10);
        context.registerRuntime(controller);
        context.registerRuntime(out);
    }

    private Token send(Object value) {
        Token token = context.createToken(scenario.getNode("src").orElseThrow(), value, List.of(),
                ActivityAction.CREATED, null);
        controller.receive(new TokenDelivery(token, "src"));
        controller.onTick(context.getCurrentTime(), context);
        return token;
    }

    private List<HistoryEntry> controllerEntries() {
        return context.getActivityLog().forNode("controller");
    }

    @Test
    void testStartsInInitialState() {
        assertEquals("idle", controller.getCurrentState());
        assertTrue(controller.getHistory().isEmpty());
    }

    @Test
    void testExitTransitionEntryOrder() {
        Token start = send("start");

        assertEquals("busy", controller.getCurrentState());
        List<HistoryEntry> entries = controllerEntries();
        assertThat(entries).extracting(HistoryEntry::action).containsExactly(
                ActivityAction.FSM_LOG, ActivityAction.TRANSITION, ActivityAction.CREATED, ActivityAction.FSM_LOG);

        assertEquals("leaving idle", entries.get(0).details());
        assertEquals("busy", entries.get(1).value());
        assertEquals("idle -> busy on 'start'", entries.get(1).details());
        assertEquals(start.id(), entries.get(1).tokenId());
        assertEquals("busy now", entries.get(3).details());
        assertEquals(1, metrics.getTransitionCount());
    }

    @Test
    void testEmitDefaultsToStateIdAndDescendsFromTrigger() {
        Token start = send("start");

        HistoryEntry created = controllerEntries().get(2);
        assertEquals("busy", created.value());
        assertEquals(List.of(start.id()), created.sourceTokenIds());

        List<TokenDelivery> delivered = out.getPendingDeliveries();
        assertEquals(1, delivered.size());
        assertEquals("controller", delivered.get(0).fromNodeId());
        assertEquals(List.of(start.id()), delivered.get(0).token().parentTokenIds());
    }

    @Test
    void testUnmatchedTriggerIsIgnored() {
        Token reset = send("reset");

        assertEquals("idle", controller.getCurrentState());
        List<HistoryEntry> entries = controllerEntries();
        assertEquals(1, entries.size());
        assertEquals(ActivityAction.TRIGGER_IGNORED, entries.get(0).action());
        assertEquals("reset", entries.get(0).value());
        assertEquals("No transition from 'idle' on 'reset'", entries.get(0).details());
        assertEquals(reset.id(), entries.get(0).tokenId());
    }

    @Test
    void testConditionTransition() {
        send("start");
        send(5L);
        assertEquals("busy", controller.getCurrentState());

        send(15L);

        assertEquals("done", controller.getCurrentState());
        assertThat(out.getPendingDeliveries()).extracting(d -> d.token().value()).containsExactly("busy", 42L);
    }

    @Test
    void testConditionErrorCountsAsFalse() {
        send("start");
        send("reset");

        assertEquals("idle", controller.getCurrentState());
        List<HistoryEntry> errors = context.getActivityLog().entries().stream()
                .filter(e -> e.action() == ActivityAction.EVALUATION_ERROR)
                .toList();
        assertEquals(1, errors.size());
        assertThat(errors.get(0).details()).startsWith("Condition 'value > 10': ");
        assertEquals(1, metrics.getErrorCount());
    }

    @Test
    void testMapValueSuppliesMessageType() {
        Token start = send(Map.of("type", "start", "priority", 2L));

        assertEquals("busy", controller.getCurrentState());
        Map<String, Object> message = StateMachineRuntime.toMessage(start, 3);
        assertEquals("msg-" + start.id(), message.get("id"));
        assertEquals("start", message.get("type"));
        assertEquals(3L, message.get("timestamp"));
        assertEquals(start.id(), message.get("fromEvent"));
    }

    @Test
    void testHistoryRecordsTransitions() {
        send("start");
        send("reset");

        assertThat(controller.getHistory()).extracting(NodeState.TransitionRecord::to).containsExactly("busy", "idle");
        assertEquals("reset", controller.getHistory().get(1).trigger());
    }

    @Test
    void testSnapshotAndRestore() {
        send("start");
        NodeState.StateMachineState saved = controller.snapshot();

        controller.reset();
        assertEquals("idle", controller.getCurrentState());

        controller.restore(saved);
        assertEquals("busy", controller.getCurrentState());
        assertEquals(1, controller.getHistory().size());
    }

    @Test
    void testRestoreRejectsUnknownState() {
        NodeState.StateMachineState foreign = new NodeState.StateMachineState("sleeping", List.of());

        assertThrows(IllegalArgumentException.class, () -> controller.restore(foreign));
    }
}
