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

package dev.mars.tokenflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for one simulation engine.
 *
 * Provides 5 simulation metrics:
 * - tokenflow.simulation.ticks (counter) - Ticks processed
 * - tokenflow.simulation.tokens.created (counter) - Tokens created, by node type
 * - tokenflow.simulation.evaluation.errors (counter) - Failed formula or condition evaluations
 * - tokenflow.simulation.fsm.transitions (counter) - State machine transitions taken
 * - tokenflow.simulation.tick.duration.seconds (histogram) - Wall time spent per tick
 *
 * Local totals are kept alongside so callers can read them without a metrics backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0 (OpenTelemetry)
 */
public class SimulationMetrics {

    private static final Logger logger = LoggerFactory.getLogger(SimulationMetrics.class);
    private static final String METER_NAME = "tokenflow-simulation";

    private static final AttributeKey<String> NODE_TYPE_KEY = AttributeKey.stringKey("node.type");
    private static final AttributeKey<String> NODE_ID_KEY = AttributeKey.stringKey("node.id");

    private final LongCounter ticks;
    private final LongCounter tokensCreated;
    private final LongCounter evaluationErrors;
    private final LongCounter transitions;
    private final DoubleHistogram tickDuration;

    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong tokenCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong transitionCount = new AtomicLong();

    public SimulationMetrics() {
        this(GlobalOpenTelemetry.get());
    }

    public SimulationMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        ticks = meter.counterBuilder("tokenflow.simulation.ticks")
                .setDescription("Number of simulation ticks processed")
                .setUnit("1")
                .build();

        tokensCreated = meter.counterBuilder("tokenflow.simulation.tokens.created")
                .setDescription("Number of tokens created")
                .setUnit("1")
                .build();

        evaluationErrors = meter.counterBuilder("tokenflow.simulation.evaluation.errors")
                .setDescription("Number of failed formula or condition evaluations")
                .setUnit("1")
                .build();

        transitions = meter.counterBuilder("tokenflow.simulation.fsm.transitions")
                .setDescription("Number of state machine transitions taken")
                .setUnit("1")
                .build();

        tickDuration = meter.histogramBuilder("tokenflow.simulation.tick.duration.seconds")
                .setDescription("Wall time spent processing one tick")
                .setUnit("s")
                .build();

        logger.debug("SimulationMetrics initialized");
    }

    /**
     * Metrics that record nothing to any backend; local totals still count.
     */
    public static SimulationMetrics noop() {
        return new SimulationMetrics(OpenTelemetry.noop());
    }

    public void recordTick(long durationNanos) {
        tickCount.incrementAndGet();
        ticks.add(1);
        tickDuration.record(durationNanos / 1_000_000_000.0);
    }

    public void recordTokenCreated(String nodeType) {
        tokenCount.incrementAndGet();
        tokensCreated.add(1, Attributes.of(NODE_TYPE_KEY, nodeType));
    }

    public void recordEvaluationError(String nodeId) {
        errorCount.incrementAndGet();
        evaluationErrors.add(1, Attributes.of(NODE_ID_KEY, nodeId));
    }

    public void recordTransition(String nodeId) {
        transitionCount.incrementAndGet();
        transitions.add(1, Attributes.of(NODE_ID_KEY, nodeId));
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public long getTokenCount() {
        return tokenCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public long getTransitionCount() {
        return transitionCount.get();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ticks", getTickCount());
        map.put("tokensCreated", getTokenCount());
        map.put("evaluationErrors", getErrorCount());
        map.put("transitions", getTransitionCount());
        return map;
    }
}
