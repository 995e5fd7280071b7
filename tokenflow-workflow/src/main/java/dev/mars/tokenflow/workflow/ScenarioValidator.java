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

package dev.mars.tokenflow.workflow;

import dev.mars.tokenflow.workflow.expression.CompiledExpression;
import dev.mars.tokenflow.workflow.expression.ExpressionParseException;
import dev.mars.tokenflow.workflow.expression.ExpressionParser;
import dev.mars.tokenflow.workflow.model.DataSourceNode;
import dev.mars.tokenflow.workflow.model.FsmAction;
import dev.mars.tokenflow.workflow.model.FsmDefinition;
import dev.mars.tokenflow.workflow.model.FsmNode;
import dev.mars.tokenflow.workflow.model.FsmState;
import dev.mars.tokenflow.workflow.model.FsmTransition;
import dev.mars.tokenflow.workflow.model.MultiplexerRoute;
import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.model.ProcessInput;
import dev.mars.tokenflow.workflow.model.ProcessNode;
import dev.mars.tokenflow.workflow.model.ProcessOutput;
import dev.mars.tokenflow.workflow.model.QueueNode;
import dev.mars.tokenflow.workflow.model.Scenario;
import dev.mars.tokenflow.workflow.model.StateMultiplexerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a scenario before a run: required fields, numeric ranges, cross-references and expression
 * syntax. Every violation is collected; nothing fails fast.
 * <p>
 * Reference errors read {@code <Type> "<nodeId>": <field> "<target>" does not exist.}
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class ScenarioValidator {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioValidator.class);

    public ScenarioValidation validate(Scenario scenario) {
        ValidationResult result = new ValidationResult();
        if (scenario == null) {
            result.addError("scenario", "Scenario cannot be null");
            return new ScenarioValidation(result, null);
        }

        validateVersion(scenario, result);
        Map<String, NodeDefinition> nodesById = indexNodes(scenario.nodes(), result);
        Map<String, CompiledExpression> expressions = new LinkedHashMap<>();

        List<NodeDefinition> nodes = scenario.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            NodeDefinition node = nodes.get(i);
            NodeContext ctx = new NodeContext(node, "nodes[" + i + "]", nodesById, expressions, result);
            if (node instanceof DataSourceNode dataSource) {
                validateDataSource(dataSource, ctx);
            } else if (node instanceof QueueNode queue) {
                validateQueue(queue, ctx);
            } else if (node instanceof ProcessNode process) {
                validateProcessNode(process, ctx);
            } else if (node instanceof FsmNode fsm) {
                validateFsm(fsm, ctx);
            } else if (node instanceof StateMultiplexerNode multiplexer) {
                validateMultiplexer(multiplexer, ctx);
            }
        }

        validateProcessBindings(nodes, nodesById, result);

        DependencyGraph graph = DependencyGraph.of(nodes);
        result.merge(graph.validate());

        if (!result.isValid()) {
            logger.debug("Scenario rejected with {} error(s)", result.getErrorCount());
            return new ScenarioValidation(result, null);
        }
        ValidatedScenario validated = new ValidatedScenario(scenario, graph.executionOrder(), expressions,
                graph.hasCycles());
        return new ScenarioValidation(result, validated);
    }

    private void validateVersion(Scenario scenario, ValidationResult result) {
        if (scenario.version() == null || scenario.version().isBlank()) {
            result.addError("version", "Required field 'version' is missing");
        } else if (!Scenario.CURRENT_VERSION.equals(scenario.version())) {
            result.addError("version", "Unsupported scenario version \"" + scenario.version()
                    + "\", expected \"" + Scenario.CURRENT_VERSION + "\"");
        }
        if (scenario.nodes().isEmpty()) {
            result.addError("nodes", "Scenario must declare at least one node");
        }
    }

    private Map<String, NodeDefinition> indexNodes(List<NodeDefinition> nodes, ValidationResult result) {
        Map<String, NodeDefinition> byId = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            NodeDefinition node = nodes.get(i);
            String path = "nodes[" + i + "]";
            String type = node.nodeType().getWireName();
            if (isBlank(node.nodeId())) {
                result.addError(path + ".nodeId", type + " at index " + i + ": nodeId is required.");
                continue;
            }
            if (byId.putIfAbsent(node.nodeId(), node) != null) {
                result.addError(path + ".nodeId", type + " \"" + node.nodeId() + "\": nodeId is already used by another node.");
            }
            if (isBlank(node.displayName())) {
                result.addError(path + ".displayName", label(node) + ": displayName is required.");
            }
        }
        return byId;
    }

    private void validateDataSource(DataSourceNode node, NodeContext ctx) {
        if (node.interval() == null) {
            ctx.error("interval", "interval is required.");
        } else if (node.interval() <= 0) {
            ctx.error("interval", "interval must be greater than 0.");
        }
        if (node.valueMin() == null) {
            ctx.error("valueMin", "valueMin is required.");
        }
        if (node.valueMax() == null) {
            ctx.error("valueMax", "valueMax is required.");
        }
        if (node.valueMin() != null && node.valueMax() != null && node.valueMin() > node.valueMax()) {
            ctx.error("valueMin", "valueMin (" + node.valueMin() + ") must not be greater than valueMax ("
                    + node.valueMax() + ").");
        }
        ctx.destination("destinationNodeId", node.destinationNodeId(), true);
    }

    private void validateQueue(QueueNode node, NodeContext ctx) {
        if (node.timeWindow() == null) {
            ctx.error("timeWindow", "timeWindow is required.");
        } else if (node.timeWindow() <= 0) {
            ctx.error("timeWindow", "timeWindow must be greater than 0.");
        }
        if (isBlank(node.aggregationMethod())) {
            ctx.error("aggregationMethod", "aggregationMethod is required.");
        } else if (node.aggregation().isEmpty()) {
            ctx.error("aggregationMethod", "aggregationMethod \"" + node.aggregationMethod()
                    + "\" must be one of sum, average, count, first, last.");
        }
        if (node.capacity() != null && node.capacity() <= 0) {
            ctx.error("capacity", "capacity must be greater than 0.");
        }
        ctx.destination("destinationNodeId", node.destinationNodeId(), true);
    }

    private void validateProcessNode(ProcessNode node, NodeContext ctx) {
        if (node.inputs().isEmpty()) {
            ctx.error("inputs", "at least one input is required.");
        }
        Set<String> inputNames = new HashSet<>();
        for (int i = 0; i < node.inputs().size(); i++) {
            ProcessInput input = node.inputs().get(i);
            String field = "inputs[" + i + "]";
            if (isBlank(input.name())) {
                ctx.error(field + ".name", "input name is required.");
            } else if (!inputNames.add(input.name())) {
                ctx.error(field + ".name", "input name \"" + input.name() + "\" is declared twice.");
            }
            ctx.reference(field + ".nodeId", "input nodeId", input.nodeId());
        }

        if (node.outputs().isEmpty()) {
            ctx.error("outputs", "at least one output is required.");
        }
        for (int i = 0; i < node.outputs().size(); i++) {
            ProcessOutput output = node.outputs().get(i);
            String field = "outputs[" + i + "]";
            CompiledExpression formula = ctx.expression(field + ".formula", "formula", output.formula());
            if (formula != null) {
                for (String name : formula.getReferencedNames()) {
                    if (!isFormulaName(name, inputNames)) {
                        ctx.warning(field + ".formula", "formula refers to \"" + name
                                + "\", which is not a declared input.");
                    }
                }
            }
            ctx.destination(field + ".destinationNodeId", output.destinationNodeId(), true);
        }
    }

    private void validateFsm(FsmNode node, NodeContext ctx) {
        for (int i = 0; i < node.inputs().size(); i++) {
            ctx.reference("inputs[" + i + "]", "input", node.inputs().get(i));
        }
        ctx.destination("destinationNodeId", node.destinationNodeId(), false);

        FsmDefinition fsm = node.fsm();
        if (fsm == null) {
            ctx.error("fsm", "fsm definition is required.");
            return;
        }
        if (fsm.states().isEmpty()) {
            ctx.error("fsm.states", "at least one state is required.");
        }

        Set<String> stateIds = new HashSet<>();
        boolean emits = false;
        for (int i = 0; i < fsm.states().size(); i++) {
            FsmState state = fsm.states().get(i);
            String field = "fsm.states[" + i + "]";
            if (isBlank(state.id())) {
                ctx.error(field + ".id", "state id is required.");
            } else if (!stateIds.add(state.id())) {
                ctx.error(field + ".id", "state \"" + state.id() + "\" is declared twice.");
            }
            emits |= validateActions(state.onEntry(), field + ".onEntry", ctx);
            emits |= validateActions(state.onExit(), field + ".onExit", ctx);
        }
        if (emits && node.destinationNodeId() == null) {
            ctx.warning("destinationNodeId", "emit actions have no destinationNodeId; emitted tokens go nowhere.");
        }

        if (isBlank(fsm.initialState())) {
            ctx.error("fsm.initialState", "initialState is required.");
        } else if (!stateIds.contains(fsm.initialState())) {
            ctx.error("fsm.initialState", "initialState \"" + fsm.initialState() + "\" does not exist.");
        }

        for (int i = 0; i < fsm.transitions().size(); i++) {
            FsmTransition transition = fsm.transitions().get(i);
            String field = "fsm.transitions[" + i + "]";
            checkState(transition.from(), field + ".from", "from", stateIds, ctx);
            checkState(transition.to(), field + ".to", "to", stateIds, ctx);
            if (isBlank(transition.trigger()) && isBlank(transition.condition())) {
                ctx.error(field, "transition needs a trigger or a condition.");
            }
            if (!isBlank(transition.condition())) {
                ctx.expression(field + ".condition", "condition", transition.condition());
            }
        }
    }

    private boolean validateActions(List<FsmAction> actions, String field, NodeContext ctx) {
        boolean emits = false;
        for (int i = 0; i < actions.size(); i++) {
            FsmAction action = actions.get(i);
            String actionField = field + "[" + i + "]";
            if (action.isEmit()) {
                emits = true;
            } else if (action.isLog()) {
                if (isBlank(action.message())) {
                    ctx.error(actionField + ".message", "log action needs a message.");
                }
            } else {
                ctx.error(actionField + ".type", "action type \"" + action.type() + "\" must be emit or log.");
            }
        }
        return emits;
    }

    private void checkState(String stateId, String field, String name, Set<String> stateIds, NodeContext ctx) {
        if (isBlank(stateId)) {
            ctx.error(field, name + " is required.");
        } else if (!stateIds.contains(stateId)) {
            ctx.error(field, name + " state \"" + stateId + "\" does not exist.");
        }
    }

    private void validateMultiplexer(StateMultiplexerNode node, NodeContext ctx) {
        if (node.routes().isEmpty()) {
            ctx.error("routes", "at least one route is required.");
        }
        for (int i = 0; i < node.routes().size(); i++) {
            MultiplexerRoute route = node.routes().get(i);
            String field = "routes[" + i + "]";
            ctx.expression(field + ".condition", "condition", route.condition());
            ctx.destination(field + ".destinationNodeId", route.destinationNodeId(), true);
        }
        if (node.defaultRoute() == null) {
            ctx.error("defaultRoute", "defaultRoute is required.");
        } else {
            ctx.destination("defaultRoute.destinationNodeId", node.defaultRoute().destinationNodeId(), true);
        }
    }

    /**
     * Warns about edges into a ProcessNode that no input of that node is bound to.
     */
    private void validateProcessBindings(List<NodeDefinition> nodes, Map<String, NodeDefinition> nodesById,
                                         ValidationResult result) {
        for (NodeDefinition producer : nodes) {
            for (String destination : producer.destinationNodeIds()) {
                NodeDefinition target = nodesById.get(destination);
                if (target instanceof ProcessNode process && !process.inputNodeIds().contains(producer.nodeId())) {
                    result.addWarning("nodes." + destination + ".inputs", label(process)
                            + ": receives tokens from \"" + producer.nodeId() + "\" but no input is bound to it.");
                }
            }
        }
    }

    private static boolean isFormulaName(String name, Set<String> inputNames) {
        if (inputNames.contains(name) || "inputs".equals(name)) {
            return true;
        }
        return name.endsWith("Value") && inputNames.contains(name.substring(0, name.length() - "Value".length()));
    }

    private static String label(NodeDefinition node) {
        return node.nodeType().getWireName() + " \"" + node.nodeId() + "\"";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Per-node helpers that prefix messages with the node label and paths with the node's position.
     */
    private static final class NodeContext {
        private final NodeDefinition node;
        private final String path;
        private final Map<String, NodeDefinition> nodesById;
        private final Map<String, CompiledExpression> expressions;
        private final ValidationResult result;

        NodeContext(NodeDefinition node, String path, Map<String, NodeDefinition> nodesById,
                    Map<String, CompiledExpression> expressions, ValidationResult result) {
            this.node = node;
            this.path = path;
            this.nodesById = nodesById;
            this.expressions = expressions;
            this.result = result;
        }

        void error(String field, String message) {
            result.addError(path + "." + field, label(node) + ": " + message);
        }

        void warning(String field, String message) {
            result.addWarning(path + "." + field, label(node) + ": " + message);
        }

        /**
         * An edge this node sends tokens along; the target must exist and accept tokens.
         */
        void destination(String field, String targetId, boolean required) {
            if (isBlank(targetId)) {
                if (required) {
                    error(field, field + " is required.");
                }
                return;
            }
            NodeDefinition target = nodesById.get(targetId);
            if (target == null) {
                error(field, lastSegment(field) + " \"" + targetId + "\" does not exist.");
            } else if (!target.nodeType().acceptsTokens()) {
                error(field, lastSegment(field) + " \"" + targetId + "\" is a DataSource and cannot receive tokens.");
            }
        }

        /**
         * A reference to an upstream node; any existing node will do.
         */
        void reference(String field, String name, String targetId) {
            if (isBlank(targetId)) {
                error(field, name + " is required.");
            } else if (!nodesById.containsKey(targetId)) {
                error(field, name + " \"" + targetId + "\" does not exist.");
            }
        }

        CompiledExpression expression(String field, String name, String source) {
            if (isBlank(source)) {
                error(field, name + " is required.");
                return null;
            }
            CompiledExpression compiled = expressions.get(source);
            if (compiled != null) {
                return compiled;
            }
            try {
                compiled = ExpressionParser.parse(source);
                expressions.put(source, compiled);
                return compiled;
            } catch (ExpressionParseException e) {
                error(field, name + " is invalid: " + e.getMessage());
                return null;
            }
        }

        private static String lastSegment(String field) {
            int dot = field.lastIndexOf('.');
            return dot < 0 ? field : field.substring(dot + 1);
        }
    }
}
