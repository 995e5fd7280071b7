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
import dev.mars.tokenflow.workflow.ValidatedScenario;
import dev.mars.tokenflow.workflow.expression.CompiledExpression;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.observability.SimulationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run services shared by the node runtimes: the activity log, the lineage tracker, token
 * creation and delivery between nodes.
 * <p>
 * Not thread-safe. The engine drives one tick at a time and runtimes only touch the context from
 * inside {@link NodeRuntime#onTick(long, SimulationContext)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class SimulationContext {

    private static final Logger logger = LoggerFactory.getLogger(SimulationContext.class);

    public static final String TOKEN_ID_PREFIX = "tok-";

    private final ValidatedScenario scenario;
    private final ActivityLog activityLog;
    private final TokenLineageTracker lineageTracker;
    private final SimulationMetrics metrics;
    private final Map<String, NodeRuntime> runtimes = new LinkedHashMap<>();

    private long currentTime;
    private long tokenCounter;

    public SimulationContext(ValidatedScenario scenario, ActivityLog activityLog,
                             TokenLineageTracker lineageTracker, SimulationMetrics metrics) {
        this.scenario = Objects.requireNonNull(scenario, "Scenario cannot be null");
        this.activityLog = Objects.requireNonNull(activityLog, "Activity log cannot be null");
        this.lineageTracker = Objects.requireNonNull(lineageTracker, "Lineage tracker cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    public void registerRuntime(NodeRuntime runtime) {
        runtimes.put(runtime.getNodeId(), runtime);
    }

    public Map<String, NodeRuntime> getRuntimes() {
        return Collections.unmodifiableMap(runtimes);
    }

    /**
     * Creates a token at the current time, registers its lineage and logs its creation.
     *
     * @param action {@link ActivityAction#CREATED} or one of the aggregation actions
     */
    public Token createToken(NodeDefinition origin, Object value, List<Token> parents,
                             ActivityAction action, String details) {
        if (!action.isTokenCreation()) {
            throw new IllegalArgumentException("Not a token creation action: " + action);
        }
        List<String> parentIds = new ArrayList<>(parents.size());
        for (Token parent : parents) {
            parentIds.add(parent.id());
        }
        Token token = new Token(TOKEN_ID_PREFIX + (++tokenCounter), value, currentTime, origin.nodeId(), parentIds);

        lineageTracker.registerToken(token, origin.nodeId(), origin.displayName(), currentTime, parents, action.name());
        activityLog.append(HistoryEntry.builder(currentTime, origin.nodeId(), action)
                .tokenId(token.id())
                .value(value)
                .details(details)
                .sourceTokenIds(parentIds));
        metrics.recordTokenCreated(origin.nodeType().getWireName());

        logger.debug("{} created {} = {} at t={}", origin.nodeId(), token.id(), value, currentTime);
        return token;
    }

    /**
     * Appends an entry stamped with the current time.
     */
    public long record(NodeDefinition node, ActivityAction action, Token token, Object value, String details) {
        HistoryEntry.Builder entry = HistoryEntry.builder(currentTime, node.nodeId(), action)
                .value(value)
                .details(details);
        if (token != null) {
            entry.tokenId(token.id()).sourceTokenIds(List.of(token.id()));
        }
        return activityLog.append(entry);
    }

    /**
     * Logs a recoverable evaluation failure. The run carries on.
     */
    public long recordEvaluationError(NodeDefinition node, String message, List<String> sourceTokenIds) {
        metrics.recordEvaluationError(node.nodeId());
        logger.warn("Evaluation error in {} at t={}: {}", node.nodeId(), currentTime, message);
        return activityLog.append(HistoryEntry.builder(currentTime, node.nodeId(), ActivityAction.EVALUATION_ERROR)
                .details(message)
                .sourceTokenIds(sourceTokenIds));
    }

    /**
     * Puts a token in the destination's inbox. A destination after the sender in execution order
     * sees it this tick; one before it sees it next tick.
     */
    public void deliver(NodeDefinition from, String destinationNodeId, Token token) {
        if (destinationNodeId == null) {
            logger.debug("{} has no destination, {} is dropped", from.nodeId(), token.id());
            return;
        }
        NodeRuntime destination = runtimes.get(destinationNodeId);
        if (destination == null) {
            logger.warn("Destination {} of {} has no runtime, {} is dropped", destinationNodeId, from.nodeId(), token.id());
            return;
        }
        destination.receive(new TokenDelivery(token, from.nodeId()));
    }

    public CompiledExpression expression(String source) {
        return scenario.expression(source);
    }

    public ValidatedScenario getScenario() {
        return scenario;
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

    public long getCurrentTime() {
        return currentTime;
    }

    public void setCurrentTime(long currentTime) {
        this.currentTime = currentTime;
    }

    public long getTokenCounter() {
        return tokenCounter;
    }

    public void setTokenCounter(long tokenCounter) {
        this.tokenCounter = tokenCounter;
    }
}
