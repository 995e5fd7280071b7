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
import dev.mars.tokenflow.workflow.expression.CompiledExpression;
import dev.mars.tokenflow.workflow.expression.EvaluationException;
import dev.mars.tokenflow.workflow.expression.Values;
import dev.mars.tokenflow.workflow.model.ProcessInput;
import dev.mars.tokenflow.workflow.model.ProcessNode;
import dev.mars.tokenflow.workflow.model.ProcessOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins tokens from named inputs and evaluates one formula per output.
 * <p>
 * Each input keeps a FIFO buffer. An output can fire once every input its formula needs has a
 * token waiting. All outputs that can fire are evaluated against the oldest waiting tokens, then
 * those tokens are consumed; this repeats until no output can fire. A formula that references no
 * input name needs all inputs.
 * <p>
 * Formula bindings per input {@code x}: {@code x} (a map with {@code value}, {@code id},
 * {@code createdAt}, {@code originNodeId} and {@code data.value}), {@code xValue}, and
 * {@code inputs.x.value}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class ProcessNodeRuntime extends AbstractNodeRuntime<ProcessNode, NodeState.ProcessNodeState> {

    private static final Logger logger = LoggerFactory.getLogger(ProcessNodeRuntime.class);

    static final String INPUTS_BINDING = "inputs";
    static final String VALUE_SUFFIX = "Value";

    private final Map<String, Deque<Token>> inputBuffers = new LinkedHashMap<>();
    private final Map<ProcessOutput, List<String>> requiredInputs = new LinkedHashMap<>();
    private long firingCount;

    public ProcessNodeRuntime(ProcessNode definition) {
        super(definition, NodeState.ProcessNodeState.class);
        for (ProcessInput input : definition.inputs()) {
            inputBuffers.put(input.name(), new ArrayDeque<>());
        }
    }

    @Override
    public void onTick(long time, SimulationContext context) {
        for (TokenDelivery delivery : drainInbox()) {
            List<String> names = inputNamesFor(delivery.fromNodeId());
            if (names.isEmpty()) {
                context.recordEvaluationError(definition, "Token " + delivery.token().id() + " from "
                        + delivery.fromNodeId() + " is not bound to any input", List.of(delivery.token().id()));
                continue;
            }
            for (String name : names) {
                inputBuffers.get(name).addLast(delivery.token());
            }
        }

        List<ProcessOutput> ready = readyOutputs(context);
        while (!ready.isEmpty()) {
            Set<String> consumed = new LinkedHashSet<>();
            for (ProcessOutput output : ready) {
                List<String> names = requiredInputs.get(output);
                evaluate(output, names, context);
                consumed.addAll(names);
            }
            for (String name : consumed) {
                inputBuffers.get(name).pollFirst();
            }
            firingCount++;
            ready = readyOutputs(context);
        }
    }

    private void evaluate(ProcessOutput output, List<String> names, SimulationContext context) {
        List<Token> parents = new ArrayList<>();
        Bindings.Builder bindings = Bindings.builder();
        Map<String, Object> inputs = new LinkedHashMap<>();
        Map<String, Object> shown = new LinkedHashMap<>();
        for (String name : names) {
            Token token = inputBuffers.get(name).peekFirst();
            parents.add(token);
            Map<String, Object> view = tokenView(token);
            bindings.bind(name, view);
            bindings.bind(name + VALUE_SUFFIX, token.value());
            inputs.put(name, view);
            shown.put(name, token.value());
        }
        bindings.bind(INPUTS_BINDING, inputs);

        Object result;
        try {
            result = context.expression(output.formula()).evaluate(bindings.build());
        } catch (EvaluationException e) {
            List<String> ids = new ArrayList<>();
            for (Token parent : parents) {
                ids.add(parent.id());
            }
            context.recordEvaluationError(definition, "Output " + output.name() + ": " + e.getMessage()
                    + " in formula '" + output.formula() + "'", ids);
            return;
        }

        String details = "formula=" + output.formula() + "; inputs=" + shown + "; result=" + Values.format(result);
        Token token = context.createToken(definition, result, parents, ActivityAction.CREATED, details);
        logger.debug("ProcessNode {} output {} produced {}", definition.nodeId(), output.name(), token.id());
        context.deliver(definition, output.destinationNodeId(), token);
    }

    private List<ProcessOutput> readyOutputs(SimulationContext context) {
        List<ProcessOutput> ready = new ArrayList<>();
        for (ProcessOutput output : definition.outputs()) {
            List<String> names = requiredInputs.computeIfAbsent(output, o -> requiredNames(o, context));
            boolean available = !names.isEmpty();
            for (String name : names) {
                if (inputBuffers.get(name).isEmpty()) {
                    available = false;
                    break;
                }
            }
            if (available) {
                ready.add(output);
            }
        }
        return ready;
    }

    private List<String> requiredNames(ProcessOutput output, SimulationContext context) {
        CompiledExpression formula = context.expression(output.formula());
        Set<String> referenced = formula.getReferencedNames();
        if (referenced.contains(INPUTS_BINDING)) {
            return List.copyOf(inputBuffers.keySet());
        }
        List<String> names = new ArrayList<>();
        for (String name : inputBuffers.keySet()) {
            if (referenced.contains(name) || referenced.contains(name + VALUE_SUFFIX)) {
                names.add(name);
            }
        }
        return names.isEmpty() ? List.copyOf(inputBuffers.keySet()) : names;
    }

    private List<String> inputNamesFor(String fromNodeId) {
        List<String> names = new ArrayList<>();
        for (ProcessInput input : definition.inputs()) {
            if (fromNodeId.equals(input.nodeId())) {
                names.add(input.name());
            }
        }
        return names;
    }

    static Map<String, Object> tokenView(Token token) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("value", token.value());
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("value", token.value());
        view.put("id", token.id());
        view.put("createdAt", token.createdAt());
        view.put("originNodeId", token.originNodeId());
        view.put("data", data);
        return view;
    }

    public long getFiringCount() {
        return firingCount;
    }

    /**
     * Tokens waiting on one input, oldest first.
     */
    public List<Token> getPending(String inputName) {
        Deque<Token> pending = inputBuffers.get(inputName);
        return pending == null ? List.of() : List.copyOf(pending);
    }

    @Override
    public NodeState.ProcessNodeState snapshot() {
        Map<String, List<Token>> copy = new LinkedHashMap<>();
        inputBuffers.forEach((name, tokens) -> copy.put(name, List.copyOf(tokens)));
        return new NodeState.ProcessNodeState(copy, firingCount);
    }

    @Override
    protected void restoreState(NodeState.ProcessNodeState state) {
        resetState();
        state.inputBuffers().forEach((name, tokens) -> {
            Deque<Token> buffer = inputBuffers.get(name);
            if (buffer == null) {
                throw new IllegalArgumentException("ProcessNode " + definition.nodeId() + " has no input " + name);
            }
            buffer.addAll(tokens);
        });
        firingCount = state.firingCount();
    }

    @Override
    protected void resetState() {
        inputBuffers.values().forEach(Deque::clear);
        firingCount = 0;
    }
}
