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
import dev.mars.tokenflow.workflow.expression.Values;
import dev.mars.tokenflow.workflow.model.FsmAction;
import dev.mars.tokenflow.workflow.model.FsmDefinition;
import dev.mars.tokenflow.workflow.model.FsmNode;
import dev.mars.tokenflow.workflow.model.FsmState;
import dev.mars.tokenflow.workflow.model.FsmTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the state machine of an FSM node, one incoming token at a time.
 * <p>
 * Each token becomes a message whose {@code type} is the token value as text, or the value's
 * {@code type} field when the value is a map. The first transition out of the current state whose
 * trigger equals the type, and whose condition holds if it has one, is taken. A transition
 * without a trigger is taken when its condition holds.
 * <p>
 * Taking a transition runs the {@code onExit} actions of the old state, logs
 * {@link ActivityAction#TRANSITION}, then runs the {@code onEntry} actions of the new state.
 * A message that matches nothing logs {@link ActivityAction#TRIGGER_IGNORED} and leaves the state
 * as it was.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class StateMachineRuntime extends AbstractNodeRuntime<FsmNode, NodeState.StateMachineState> {

    private static final Logger logger = LoggerFactory.getLogger(StateMachineRuntime.class);

    private final FsmDefinition fsm;
    private final List<NodeState.TransitionRecord> history = new ArrayList<>();
    private String currentState;

    public StateMachineRuntime(FsmNode definition) {
        super(definition, NodeState.StateMachineState.class);
        this.fsm = definition.fsm();
        this.currentState = fsm.initialState();
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        for (TokenDelivery delivery : drainInbox()) {
            handle(delivery.token(), time, context);
        }
    }

    private void handle(Token token, long time, SimulationContext context) {
        Map<String, Object> message = toMessage(token, time);
        String type = (String) message.get("type");

        Optional<FsmTransition> match = findTransition(type, token, message, context);
        if (match.isEmpty()) {
            context.record(definition, ActivityAction.TRIGGER_IGNORED, token, type,
                    "No transition from '" + currentState + "' on '" + type + "'");
            return;
        }

        FsmTransition transition = match.get();
        String from = currentState;
        fsm.state(from).ifPresent(state -> runActions(state, state.onExit(), token, context));

        currentState = transition.to();
        history.add(new NodeState.TransitionRecord(time, from, currentState, type, token.id()));
        context.record(definition, ActivityAction.TRANSITION, token, currentState,
                from + " -> " + currentState + " on '" + type + "'");
        context.getMetrics().recordTransition(definition.nodeId());
        logger.debug("FSM {} moved {} -> {} on {}", definition.nodeId(), from, currentState, type);

        fsm.state(currentState).ifPresent(state -> runActions(state, state.onEntry(), token, context));
    }

    private Optional<FsmTransition> findTransition(String type, Token token, Map<String, Object> message,
                                                   SimulationContext context) {
        for (FsmTransition transition : fsm.transitions()) {
            if (!currentState.equals(transition.from())) {
                continue;
            }
            boolean hasTrigger = transition.trigger() != null && !transition.trigger().isBlank();
            boolean hasCondition = transition.condition() != null && !transition.condition().isBlank();
            if (hasTrigger && !transition.trigger().equals(type)) {
                continue;
            }
            if (!hasTrigger && !hasCondition) {
                continue;
            }
            if (hasCondition && !conditionHolds(transition.condition(), token, message, context)) {
                continue;
            }
            return Optional.of(transition);
        }
        return Optional.empty();
    }

    private boolean conditionHolds(String condition, Token token, Map<String, Object> message,
                                   SimulationContext context) {
        Bindings bindings = Bindings.builder()
                .bind("input", token.value())
                .bind("value", token.value())
                .bind("message", message)
                .bind("state", currentState)
                .build();
        try {
            return context.expression(condition).test(bindings);
        } catch (EvaluationException e) {
            context.recordEvaluationError(definition, "Condition '" + condition + "': " + e.getMessage(),
                    List.of(token.id()));
            return false;
        }
    }

    private void runActions(FsmState state, List<FsmAction> actions, Token trigger, SimulationContext context) {
        for (FsmAction action : actions) {
            if (action.isEmit()) {
                Object value = action.value() != null ? Values.normalize(action.value()) : state.id();
                Token emitted = context.createToken(definition, value, List.of(trigger), ActivityAction.CREATED,
                        "emit in state '" + state.id() + "'");
                context.deliver(definition, definition.destinationNodeId(), emitted);
            } else if (action.isLog()) {
                context.record(definition, ActivityAction.FSM_LOG, trigger, state.id(),
                        action.message() != null ? action.message() : "state " + state.id());
            } else {
                logger.warn("FSM {} skipped unknown action type '{}' in state {}",
                        definition.nodeId(), action.type(), state.id());
            }
        }
    }

    static Map<String, Object> toMessage(Token token, long time) {
        Object value = token.value();
        String type;
        if (value instanceof Map<?, ?> map && map.get("type") != null) {
            type = Values.format(map.get("type"));
        } else {
            type = Values.format(value);
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", "msg-" + token.id());
        message.put("type", type);
        message.put("timestamp", time);
        message.put("data", value);
        message.put("fromEvent", token.id());
        return message;
    }

    public String getCurrentState() {
        return currentState;
    }

    public List<NodeState.TransitionRecord> getHistory() {
        return List.copyOf(history);
    }

    @Override
    public NodeState.StateMachineState snapshot() {
        return new NodeState.StateMachineState(currentState, history);
    }

    @Override
    protected void restoreState(NodeState.StateMachineState state) {
        if (fsm.state(state.currentState()).isEmpty()) {
            throw new IllegalArgumentException("FSM " + definition.nodeId() + " has no state " + state.currentState());
        }
        currentState = state.currentState();
        history.clear();
        history.addAll(state.history());
    }

    @Override
    protected void resetState() {
        currentState = fsm.initialState();
        history.clear();
    }
}
