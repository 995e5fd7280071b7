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
import dev.mars.tokenflow.workflow.expression.Values;
import dev.mars.tokenflow.workflow.model.DataSourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Emits one token on every tick where {@code t mod interval == 0}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class DataSourceRuntime extends AbstractNodeRuntime<DataSourceNode, NodeState.DataSourceState> {

    private static final Logger logger = LoggerFactory.getLogger(DataSourceRuntime.class);

    private final ValueGenerator generator;
    private final long interval;
    private final double min;
    private final double max;
    private long emittedCount;

    public DataSourceRuntime(DataSourceNode definition, ValueGenerator generator) {
        super(definition, NodeState.DataSourceState.class);
        this.generator = Objects.requireNonNull(generator, "Value generator cannot be null");
        this.interval = definition.interval() == null || definition.interval() <= 0 ? 1 : definition.interval();
        this.min = definition.valueMin() == null ? 0 : definition.valueMin();
        this.max = definition.valueMax() == null ? min : definition.valueMax();
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        List<TokenDelivery> unexpected = drainInbox();
        if (!unexpected.isEmpty()) {
            logger.warn("DataSource {} ignored {} incoming token(s)", definition.nodeId(), unexpected.size());
        }
        if (time % interval != 0) {
            return;
        }

        Object value = Values.normalize(generator.next(min, max));
        Token token = context.createToken(definition, value, List.of(), ActivityAction.CREATED,
                "sampled from [" + Values.format(min) + ", " + Values.format(max) + "]");
        emittedCount++;
        context.deliver(definition, definition.destinationNodeId(), token);
    }

    public long getEmittedCount() {
        return emittedCount;
    }

    @Override
    public NodeState.DataSourceState snapshot() {
        return new NodeState.DataSourceState(emittedCount, generator.getDrawCount());
    }

    @Override
    protected void restoreState(NodeState.DataSourceState state) {
        emittedCount = state.emittedCount();
        generator.restore(state.drawCount());
    }

    @Override
    protected void resetState() {
        emittedCount = 0;
        generator.reset();
    }
}
