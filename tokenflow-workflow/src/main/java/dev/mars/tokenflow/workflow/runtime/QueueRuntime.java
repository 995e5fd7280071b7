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
import dev.mars.tokenflow.core.Token;
import dev.mars.tokenflow.workflow.expression.EvaluationException;
import dev.mars.tokenflow.workflow.expression.Values;
import dev.mars.tokenflow.workflow.model.AggregationMethod;
import dev.mars.tokenflow.workflow.model.QueueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers tokens and folds them into one aggregate token when the time window closes or the
 * buffer reaches capacity, whichever comes first.
 * <p>
 * A window closes on the first tick at least {@code timeWindow} after it opened. A closing
 * window is aggregated before that tick's arrivals are buffered, so those arrivals open the next
 * window. Aggregating on capacity also opens a new window.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class QueueRuntime extends AbstractNodeRuntime<QueueNode, NodeState.QueueState> {

    private static final Logger logger = LoggerFactory.getLogger(QueueRuntime.class);

    private final AggregationMethod method;
    private final long timeWindow;
    private final Integer capacity;
    private final List<Token> buffer = new ArrayList<>();
    private long windowStart;
    private long aggregationCount;

    public QueueRuntime(QueueNode definition) {
        super(definition, NodeState.QueueState.class);
        this.method = definition.aggregation().orElse(AggregationMethod.SUM);
        this.timeWindow = definition.timeWindow() == null || definition.timeWindow() <= 0
                ? Long.MAX_VALUE : definition.timeWindow();
        this.capacity = definition.capacity();
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        if (time - windowStart >= timeWindow) {
            if (!buffer.isEmpty()) {
                aggregate(context, "window");
            }
            windowStart = time;
        }

        for (TokenDelivery delivery : drainInbox()) {
            Token token = delivery.token();
            buffer.add(token);
            context.record(definition, ActivityAction.ENQUEUED, token, token.value(),
                    "buffered " + buffer.size() + (capacity != null ? "/" + capacity : ""));

            if (capacity != null && buffer.size() >= capacity) {
                aggregate(context, "capacity");
                windowStart = time;
            }
        }
    }

    private void aggregate(SimulationContext context, String reason) {
        List<Token> window = List.copyOf(buffer);
        buffer.clear();

        Object value;
        try {
            value = fold(window);
        } catch (EvaluationException e) {
            List<String> ids = new ArrayList<>();
            for (Token token : window) {
                ids.add(token.id());
            }
            context.recordEvaluationError(definition, e.getMessage() + "; discarded " + window.size() + " token(s)", ids);
            return;
        }

        Token aggregate = context.createToken(definition, value, window, method.getAction(),
                method.getWireName() + " of " + window.size() + " token(s) on " + reason);
        aggregationCount++;
        logger.debug("Queue {} aggregated {} token(s) into {} ({})", definition.nodeId(), window.size(),
                aggregate.id(), reason);
        context.deliver(definition, definition.destinationNodeId(), aggregate);
    }

    private Object fold(List<Token> window) {
        switch (method) {
            case COUNT:
                return (long) window.size();
            case FIRST:
                return window.get(0).value();
            case LAST:
                return window.get(window.size() - 1).value();
            default:
                break;
        }

        Object sum = 0L;
        for (Token token : window) {
            if (!Values.isNumber(token.value())) {
                throw new EvaluationException("Cannot " + method.getWireName() + " " + Values.typeName(token.value())
                        + " value '" + Values.format(token.value()) + "' of token " + token.id());
            }
            sum = Values.add(sum, Values.normalize(token.value()));
        }
        if (method == AggregationMethod.AVERAGE) {
            return ((Number) sum).doubleValue() / window.size();
        }
        return sum;
    }

    public List<Token> getBuffer() {
        return List.copyOf(buffer);
    }

    public long getAggregationCount() {
        return aggregationCount;
    }

    @Override
    public NodeState.QueueState snapshot() {
        return new NodeState.QueueState(buffer, windowStart, aggregationCount);
    }

    @Override
    protected void restoreState(NodeState.QueueState state) {
        buffer.clear();
        buffer.addAll(state.buffer());
        windowStart = state.windowStart();
        aggregationCount = state.aggregationCount();
    }

    @Override
    protected void resetState() {
        buffer.clear();
        windowStart = 0;
        aggregationCount = 0;
    }
}
