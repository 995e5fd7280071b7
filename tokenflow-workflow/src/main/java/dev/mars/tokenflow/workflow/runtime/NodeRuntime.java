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

import dev.mars.tokenflow.workflow.model.NodeDefinition;

import java.util.List;

/**
 * Executable behaviour of one scenario node.
 * <p>
 * Tokens sent to a node wait in its inbox until its next {@link #onTick(long, SimulationContext)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public interface NodeRuntime {

    NodeDefinition getDefinition();

    default String getNodeId() {
        return getDefinition().nodeId();
    }

    void receive(TokenDelivery delivery);

    /**
     * Processes the inbox and any time-driven work for simulation time {@code time}.
     */
    void onTick(long time, SimulationContext context);

    /**
     * Deliveries received but not yet processed, oldest first.
     */
    List<TokenDelivery> getPendingDeliveries();

    NodeState snapshot();

    /**
     * Replaces the runtime state. The inbox is emptied.
     *
     * @throws IllegalArgumentException if the state belongs to another node kind
     */
    void restore(NodeState state);

    void reset();
}
