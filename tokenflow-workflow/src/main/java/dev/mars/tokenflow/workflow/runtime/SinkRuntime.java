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
import dev.mars.tokenflow.workflow.model.SinkNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Terminal node. Logs every token it consumes and keeps the most recent ones for inspection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class SinkRuntime extends AbstractNodeRuntime<SinkNode, NodeState.SinkState> {

    private final int retained;
    private final Deque<Token> recentTokens = new ArrayDeque<>();
    private long consumedCount;

    public SinkRuntime(SinkNode definition, int retained) {
        super(definition, NodeState.SinkState.class);
        this.retained = Math.max(0, retained);
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        for (TokenDelivery delivery : drainInbox()) {
            Token token = delivery.token();
            context.record(definition, ActivityAction.CONSUMED, token, token.value(),
                    "from " + delivery.fromNodeId());
            consumedCount++;
            remember(token);
        }
    }

    private void remember(Token token) {
        if (retained == 0) {
            return;
        }
        if (recentTokens.size() == retained) {
            recentTokens.pollFirst();
        }
        recentTokens.addLast(token);
    }

    public long getConsumedCount() {
        return consumedCount;
    }

    public List<Token> getRecentTokens() {
        return List.copyOf(recentTokens);
    }

    @Override
    public NodeState.SinkState snapshot() {
        return new NodeState.SinkState(consumedCount, List.copyOf(recentTokens));
    }

    @Override
    protected void restoreState(NodeState.SinkState state) {
        consumedCount = state.consumedCount();
        recentTokens.clear();
        for (Token token : state.recentTokens()) {
            remember(token);
        }
    }

    @Override
    protected void resetState() {
        consumedCount = 0;
        recentTokens.clear();
    }
}
