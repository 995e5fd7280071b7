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

package dev.mars.tokenflow.workflow.engine;

import dev.mars.tokenflow.config.TokenflowConfiguration;
import dev.mars.tokenflow.core.ActivityLog;
import dev.mars.tokenflow.core.HistoryEntry;
import dev.mars.tokenflow.core.lineage.TokenLineageTracker;
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import dev.mars.tokenflow.workflow.runtime.NodeRuntime;
import dev.mars.tokenflow.workflow.runtime.NodeRuntimeFactory;
import dev.mars.tokenflow.workflow.runtime.NodeState;
import dev.mars.tokenflow.workflow.runtime.SimulationContext;
import dev.mars.tokenflow.workflow.runtime.TokenDelivery;
import dev.mars.tokenflow.workflow.runtime.ValueGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Discrete-time scheduler for one run of a validated scenario.
 * <p>
 * Tick {@code n} (counting from zero) processes simulation time {@code n * tickDelta}. Every
 * node runtime is invoked once per tick in execution order, so producers run before their
 * consumers and a token sent downstream is handled in the same tick. Tokens sent back along a
 * feedback edge wait until the next tick.
 * <p>
 * The engine never stops by itself. Callers tick it for as long as they like, or use a
 * {@link BudgetedRunner}. Single-threaded: one tick completes before the next begins.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class SimulationEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimulationEngine.class);

    private final ValidatedScenario scenario;
    private final ActivityLog activityLog;
    private final TokenLineageTracker lineageTracker;
    private final SimulationMetrics metrics;
    private final SimulationContext context;
    private final Map<String, NodeRuntime> runtimes = new LinkedHashMap<>();
    private final long tickDelta;

    private long tickCount;
    private volatile boolean stopped;

    private SimulationEngine(Builder builder) {
        this.scenario = builder.scenario;
        this.tickDelta = builder.configuration.getTickDelta();
        this.activityLog = new ActivityLog(builder.clock);
        this.lineageTracker = new TokenLineageTracker();
        this.metrics = builder.metrics != null ? builder.metrics
                : builder.configuration.isMetricsEnabled() ? new SimulationMetrics() : SimulationMetrics.noop();
        this.context = new SimulationContext(scenario, activityLog, lineageTracker, metrics);

        NodeRuntimeFactory factory = new NodeRuntimeFactory(builder.configuration, builder.generators);
        for (NodeDefinition node : scenario.getExecutionOrder()) {
            NodeRuntime runtime = factory.create(node);
            runtimes.put(node.nodeId(), runtime);
            context.registerRuntime(runtime);
        }
        logger.info("Simulation engine created for {} nodes, execution order {}", runtimes.size(), runtimes.keySet());
        if (scenario.hasFeedbackLoops()) {
            logger.info("Scenario has feedback loops; tokens on feedback edges are delivered on the next tick");
        }
    }

    public static Builder builder(ValidatedScenario scenario) {
        return new Builder(scenario);
    }

    public static SimulationEngine create(ValidatedScenario scenario) {
        return builder(scenario).build();
    }

    /**
     * Processes one tick.
     *
     * @return the simulation time that was processed
     * @throws IllegalStateException if the engine was stopped and not reset since
     */
    public long tick() {
        if (stopped) {
            throw new IllegalStateException("Simulation is stopped; reset it before ticking again");
        }
        long time = tickCount * tickDelta;
        context.setCurrentTime(time);
        long started = System.nanoTime();

        for (NodeRuntime runtime : runtimes.values()) {
            runtime.onTick(time, context);
        }

        tickCount++;
        metrics.recordTick(System.nanoTime() - started);
        logger.debug("Tick {} processed at t={}, {} log entries", tickCount, time, activityLog.size());
        return time;
    }

    /**
     * Processes {@code ticks} ticks, or fewer if the engine is stopped in between.
     */
    public long run(int ticks) {
        for (int i = 0; i < ticks && !stopped; i++) {
            tick();
        }
        return getCurrentTime();
    }

    /**
     * Stops between ticks. Safe to call from another thread.
     */
    public void stop() {
        stopped = true;
        logger.info("Simulation stopped after {} ticks at t={}", tickCount, getCurrentTime());
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * Returns the run to its initial state: empty log and lineage, token ids restart at 1, time 0.
     */
    public void reset() {
        activityLog.clear();
        lineageTracker.clearAll();
        context.setTokenCounter(0);
        context.setCurrentTime(0);
        for (NodeRuntime runtime : runtimes.values()) {
            runtime.reset();
        }
        tickCount = 0;
        stopped = false;
        logger.info("Simulation reset");
    }

    public ExecutionState snapshot() {
        Map<String, NodeState> nodeStates = new LinkedHashMap<>();
        Map<String, List<TokenDelivery>> pending = new LinkedHashMap<>();
        for (NodeRuntime runtime : runtimes.values()) {
            nodeStates.put(runtime.getNodeId(), runtime.snapshot());
            List<TokenDelivery> waiting = runtime.getPendingDeliveries();
            if (!waiting.isEmpty()) {
                pending.put(runtime.getNodeId(), waiting);
            }
        }
        return new ExecutionState(getCurrentTime(), tickCount, activityLog.getLastSequence(),
                context.getTokenCounter(), nodeStates, activityLog.entries(), activityLog.byNode(), pending);
    }

    /**
     * Replaces the run with a saved one. The lineage tracker is rebuilt from the activity log.
     * A state saved from another scenario is rejected before anything changes; a node state that
     * fails to restore part-way leaves the engine reset.
     */
    public void restore(ExecutionState state) throws ExecutionStateException {
        if (state == null) {
            throw new ExecutionStateException("Execution state cannot be null");
        }
        checkCompatible(state);

        try {
            activityLog.load(state.globalActivityLog());
        } catch (IllegalArgumentException e) {
            throw new ExecutionStateException("Activity log cannot be restored: " + e.getMessage(), e);
        }

        lineageTracker.clearAll();
        for (HistoryEntry entry : state.globalActivityLog()) {
            if (entry.action().isTokenCreation() && entry.tokenId() != null) {
                String nodeName = scenario.getNode(entry.nodeId()).map(NodeDefinition::displayName).orElse(entry.nodeId());
                lineageTracker.registerToken(entry.tokenId(), entry.value(), entry.nodeId(), nodeName,
                        entry.timestamp(), entry.sourceTokenIds(), entry.action().name());
            }
        }

        try {
            for (NodeRuntime runtime : runtimes.values()) {
                runtime.restore(state.nodeStates().get(runtime.getNodeId()));
                for (TokenDelivery delivery : state.pendingDeliveries().getOrDefault(runtime.getNodeId(), List.of())) {
                    runtime.receive(delivery);
                }
            }
        } catch (IllegalArgumentException e) {
            reset();
            throw new ExecutionStateException("Node state cannot be restored: " + e.getMessage(), e);
        }

        context.setTokenCounter(state.tokenCounter());
        context.setCurrentTime(state.currentTime());
        tickCount = state.tickCount();
        stopped = false;
        logger.info("Simulation restored at t={} with {} log entries and {} tokens",
                state.currentTime(), activityLog.size(), lineageTracker.size());
    }

    private void checkCompatible(ExecutionState state) throws ExecutionStateException {
        for (String nodeId : state.nodeStates().keySet()) {
            if (!runtimes.containsKey(nodeId)) {
                throw new ExecutionStateException("Execution state has unknown node '" + nodeId + "'");
            }
        }
        for (String nodeId : state.pendingDeliveries().keySet()) {
            if (!runtimes.containsKey(nodeId)) {
                throw new ExecutionStateException("Pending deliveries for unknown node '" + nodeId + "'");
            }
        }
        for (NodeRuntime runtime : runtimes.values()) {
            NodeState saved = state.nodeStates().get(runtime.getNodeId());
            if (saved == null) {
                throw new ExecutionStateException("Execution state has no state for node '" + runtime.getNodeId() + "'");
            }
            if (!saved.getClass().equals(runtime.snapshot().getClass())) {
                throw new ExecutionStateException("Node '" + runtime.getNodeId() + "' cannot restore "
                        + saved.getClass().getSimpleName());
            }
        }
    }

    /**
     * Simulation time of the last processed tick, 0 before the first.
     */
    public long getCurrentTime() {
        return context.getCurrentTime();
    }

    public long getTickCount() {
        return tickCount;
    }

    public long getTokenCount() {
        return context.getTokenCounter();
    }

    public ActivityLog getActivityLog() {
        return activityLog;
    }

    public TokenLineageTracker getLineageTracker() {
        return lineageTracker;
    }

    public SimulationMetrics getMetrics() {
        return metrics;
    }

    public ValidatedScenario getScenario() {
        return scenario;
    }

    public Optional<NodeRuntime> getRuntime(String nodeId) {
        return Optional.ofNullable(runtimes.get(nodeId));
    }

    /**
     * @throws IllegalArgumentException if there is no such node or it has another runtime type
     */
    public <T extends NodeRuntime> T getRuntime(String nodeId, Class<T> type) {
        NodeRuntime runtime = runtimes.get(nodeId);
        if (!type.isInstance(runtime)) {
            throw new IllegalArgumentException("Node " + nodeId + " has no " + type.getSimpleName());
        }
        return type.cast(runtime);
    }

    public static class Builder {
        private final ValidatedScenario scenario;
        private TokenflowConfiguration configuration = TokenflowConfiguration.defaults();
        private Clock clock = Clock.systemUTC();
        private SimulationMetrics metrics;
        private final Map<String, ValueGenerator> generators = new HashMap<>();

        private Builder(ValidatedScenario scenario) {
            this.scenario = Objects.requireNonNull(scenario, "Scenario cannot be null");
        }

        public Builder configuration(TokenflowConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
            return this;
        }

        /**
         * Clock for the wall time stamped on log entries.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public Builder metrics(SimulationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Replaces the seeded random generator of one DataSource.
         */
        public Builder valueGenerator(String nodeId, ValueGenerator generator) {
            generators.put(nodeId, generator);
            return this;
        }

        public SimulationEngine build() {
            for (String nodeId : generators.keySet()) {
                if (scenario.getNode(nodeId).isEmpty()) {
                    throw new IllegalArgumentException("Value generator given for unknown node " + nodeId);
                }
            }
            return new SimulationEngine(this);
        }
    }
}
