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
import dev.mars.tokenflow.core.lineage.TokenLineageTracker;
import dev.mars.tokenflow.workflow.TestScenarios;
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.model.DataSourceNode;
import dev.mars.tokenflow.workflow.model.SinkNode;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import org.junit.jupiter.api.Test;

import static dev.mars.tokenflow.workflow.TestScenarios.sink;
import static dev.mars.tokenflow.workflow.TestScenarios.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DataSourceRuntime emission schedule and generator state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
class DataSourceRuntimeTest {

    private SimulationContext context;
    private DataSourceRuntime runtime;
    private SinkRuntime sink;

    private void setUp(long interval, ValueGenerator generator) {
        ValidatedScenario scenario = TestScenarios.validated(source("src", interval, 1, 6, "out"), sink("out"));
        context = new SimulationContext(scenario, new ActivityLog(TestScenarios.FIXED_CLOCK),
                new TokenLineageTracker(), SimulationMetrics.noop());
        runtime = new DataSourceRuntime((DataSourceNode) scenario.getNode("src").orElseThrow(), generator);
        sink = new SinkRuntime((SinkNode) scenario.getNode("out").orElseThrow(), 10);
        context.registerRuntime(runtime);
        context.registerRuntime(sink);
    }

    private void tickAt(long time) {
        context.setCurrentTime(time);
        runtime.onTick(time, context);
    }

    @Test
    void testEmitsOnIntervalMultiples() {
        setUp(3, SequenceValueGenerator.of(7));
        for (long t = 0; t < 7; t++) {
            tickAt(t);
        }

        assertThat(context.getActivityLog().entries()).extracting(HistoryEntry::timestamp).containsExactly(0L, 3L, 6L);
        assertEquals(3, runtime.getEmittedCount());
        assertEquals(3, sink.getPendingDeliveries().size());
    }

    @Test
    void testCreatedEntryDescribesRange() {
        setUp(1, SequenceValueGenerator.of(4));
        tickAt(0);

        HistoryEntry entry = context.getActivityLog().entries().get(0);
        assertEquals(ActivityAction.CREATED, entry.action());
        assertEquals(4L, entry.value());
        assertEquals("sampled from [1, 6]", entry.details());
        assertTrue(entry.sourceTokenIds().isEmpty());
        assertEquals("tok-1", entry.tokenId());
    }

    @Test
    void testRandomValuesStayInWholeRange() {
        setUp(1, new RandomValueGenerator(42));
        for (long t = 0; t < 200; t++) {
            tickAt(t);
        }

        assertThat(context.getActivityLog().entries()).extracting(HistoryEntry::value)
                .allSatisfy(value -> {
                    assertInstanceOf(Long.class, value);
                    assertThat((Long) value).isBetween(1L, 6L);
                });
    }

    @Test
    void testRestoreResumesGeneratorStream() {
        RandomValueGenerator generator = new RandomValueGenerator(7);
        setUp(1, generator);
        tickAt(0);
        tickAt(1);
        NodeState.DataSourceState saved = runtime.snapshot();
        assertEquals(2, saved.drawCount());

        tickAt(2);
        Object expected = context.getActivityLog().entries().get(2).value();

        runtime.restore(saved);
        tickAt(3);

        assertEquals(expected, context.getActivityLog().entries().get(3).value());
        assertEquals(3, runtime.getEmittedCount());
    }

    @Test
    void testResetStartsOver() {
        setUp(1, SequenceValueGenerator.of(1, 2, 3));
        tickAt(0);
        tickAt(1);
        runtime.reset();
        tickAt(2);

        assertEquals(1L, context.getActivityLog().entries().get(2).value());
        assertEquals(1, runtime.getEmittedCount());
    }
}
