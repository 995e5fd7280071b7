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
import dev.mars.tokenflow.workflow.expression.Bindings;
import dev.mars.tokenflow.workflow.expression.EvaluationException;
import dev.mars.tokenflow.workflow.model.MultiplexerRoute;
import dev.mars.tokenflow.workflow.model.StateMultiplexerNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forwards each incoming token unchanged along the first route whose condition holds, or the
 * default route. A condition that fails to evaluate counts as false.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class StateMultiplexerRuntime extends AbstractNodeRuntime<StateMultiplexerNode, NodeState.MultiplexerState> {

    static final String DEFAULT_ROUTE = "default";

    private final Map<String, Long> routeCounts = new LinkedHashMap<>();

    public StateMultiplexerRuntime(StateMultiplexerNode definition) {
        super(definition, NodeState.MultiplexerState.class);
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        for (TokenDelivery delivery : drainInbox()) {
            route(delivery.token(), context);
        }
    }

    private void route(Token token, SimulationContext context) {
        Bindings bindings = Bindings.builder()
                .bind("input", token.value())
                .bind("value", token.value())
                .bind("token", ProcessNodeRuntime.tokenView(token))
                .build();

        MultiplexerRoute chosen = null;
        String routeName = DEFAULT_ROUTE;
        List<MultiplexerRoute> routes = definition.routes();
        for (int i = 0; i < routes.size() && chosen == null; i++) {
            MultiplexerRoute route = routes.get(i);
            if (matches(route, token, bindings, context)) {
                chosen = route;
                routeName = route.name() != null ? route.name() : "route " + i;
            }
        }
        if (chosen == null) {
            chosen = definition.defaultRoute();
        }

        String destination = chosen == null ? null : chosen.destinationNodeId();
        routeCounts.merge(routeName, 1L, Long::sum);
        context.record(definition, ActivityAction.ROUTED, token, token.value(),
                "route '" + routeName + "' -> " + destination);
        context.deliver(definition, destination, token);
    }

    private boolean matches(MultiplexerRoute route, Token token, Bindings bindings, SimulationContext context) {
        if (route.condition() == null || route.condition().isBlank()) {
            return false;
        }
        try {
            return context.expression(route.condition()).test(bindings);
        } catch (EvaluationException e) {
            context.recordEvaluationError(definition, "Route condition '" + route.condition() + "': "
                    + e.getMessage(), List.of(token.id()));
            return false;
        }
    }

    public Map<String, Long> getRouteCounts() {
        return Map.copyOf(routeCounts);
    }

    @Override
    public NodeState.MultiplexerState snapshot() {
        return new NodeState.MultiplexerState(routeCounts);
    }

    @Override
    protected void restoreState(NodeState.MultiplexerState state) {
        routeCounts.clear();
        routeCounts.putAll(state.routeCounts());
    }

    @Override
    protected void resetState() {
        routeCounts.clear();
    }
}
