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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Inbox handling and state-kind checks shared by all runtimes.
 *
 * @param <D> node definition type
 * @param <S> state type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public abstract class AbstractNodeRuntime<D extends NodeDefinition, S extends NodeState> implements NodeRuntime {

    protected final D definition;
    private final Class<S> stateType;
    private final Deque<TokenDelivery> inbox = new ArrayDeque<>();

    protected AbstractNodeRuntime(D definition, Class<S> stateType) {
        this.definition = Objects.requireNonNull(definition, "Node definition cannot be null");
        this.stateType = stateType;
    }

    @Override
    public D getDefinition() {
        return definition;
    }

    @Override
    public void receive(TokenDelivery delivery) {
        inbox.addLast(delivery);
    }

    @Override
    public List<TokenDelivery> getPendingDeliveries() {
        return List.copyOf(inbox);
    }

    /**
     * Removes and returns everything received so far.
     */
    protected List<TokenDelivery> drainInbox() {
        List<TokenDelivery> drained = new ArrayList<>(inbox);
        inbox.clear();
        return drained;
    }

    @Override
    public abstract S snapshot();

    @Override
    public void restore(NodeState state) {
        if (!stateType.isInstance(state)) {
            throw new IllegalArgumentException("Node " + definition.nodeId() + " expects "
                    + stateType.getSimpleName() + " but got "
                    + (state == null ? "null" : state.getClass().getSimpleName()));
        }
        inbox.clear();
        restoreState(stateType.cast(state));
    }

    @Override
    public void reset() {
        inbox.clear();
        resetState();
    }

    protected abstract void restoreState(S state);

    protected abstract void resetState();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + definition.nodeId() + "}";
    }
}
