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

import dev.mars.tokenflow.workflow.model.NodeDefinition;
import dev.mars.tokenflow.workflow.model.NodeType;

import java.util.*;

/**
 * Producer/consumer graph of a scenario's nodes.
 * Provides the execution order used by the scheduler and detects feedback loops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class DependencyGraph {

    private final Map<String, NodeDefinition> nodes;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    public DependencyGraph() {
        this.nodes = new LinkedHashMap<>();
        this.declarationIndex = new HashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();
    }

    /**
     * Builds the graph from all nodes with an id. Edges to unknown nodes are ignored.
     */
    public static DependencyGraph of(Collection<NodeDefinition> definitions) {
        DependencyGraph graph = new DependencyGraph();
        for (NodeDefinition definition : definitions) {
            if (definition.nodeId() != null && !graph.nodes.containsKey(definition.nodeId())) {
                graph.addNode(definition);
            }
        }
        for (NodeDefinition definition : graph.nodes.values()) {
            for (String destination : definition.destinationNodeIds()) {
                graph.addEdge(definition.nodeId(), destination);
            }
            for (String input : definition.inputNodeIds()) {
                graph.addEdge(input, definition.nodeId());
            }
        }
        return graph;
    }

    /**
     * Adds a node to the graph. Declaration order breaks ties in {@link #executionOrder()}.
     *
     * @param node the node to add
     */
    public void addNode(NodeDefinition node) {
        Objects.requireNonNull(node, "Node cannot be null");
        String nodeId = Objects.requireNonNull(node.nodeId(), "Node id cannot be null");
        nodes.put(nodeId, node);
        declarationIndex.putIfAbsent(nodeId, declarationIndex.size());
        dependencies.putIfAbsent(nodeId, new LinkedHashSet<>());
        dependents.putIfAbsent(nodeId, new LinkedHashSet<>());
    }

    /**
     * Records that tokens flow from {@code producerId} to {@code consumerId}.
     */
    public void addEdge(String producerId, String consumerId) {
        if (!nodes.containsKey(producerId) || !nodes.containsKey(consumerId)) {
            return;
        }
        dependencies.get(consumerId).add(producerId);
        dependents.get(producerId).add(consumerId);
    }

    public Map<String, NodeDefinition> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /**
     * Gets the producers feeding a node.
     */
    public Set<String> getDependencies(String nodeId) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Gets the consumers a node feeds.
     */
    public Set<String> getDependents(String nodeId) {
        return Collections.unmodifiableSet(dependents.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Orders nodes so that producers come before consumers.
     * <p>
     * Strongly connected components are ordered topologically, the component holding the earliest
     * declared node first among those that are ready. Inside a feedback loop the nodes follow their
     * edges within the loop; when every remaining loop node still waits on another, the earliest
     * declared node fed from outside the loop is taken next, and its back edges deliver on the
     * following tick. Nodes downstream of a loop always run after it.
     *
     * @return node ids in execution order, every node exactly once
     */
    public List<String> executionOrder() {
        List<List<String>> components = stronglyConnectedComponents();
        Map<String, Integer> componentOf = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (String nodeId : components.get(i)) {
                componentOf.put(nodeId, i);
            }
        }

        int[] inDegree = new int[components.size()];
        List<Set<Integer>> successors = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            successors.add(new LinkedHashSet<>());
        }
        for (int i = 0; i < components.size(); i++) {
            for (String nodeId : components.get(i)) {
                for (String dependent : dependents.get(nodeId)) {
                    int target = componentOf.get(dependent);
                    if (target != i && successors.get(i).add(target)) {
                        inDegree[target]++;
                    }
                }
            }
        }

        Comparator<Integer> byFirstDeclared = Comparator.comparingInt(i -> firstDeclared(components.get(i)));
        PriorityQueue<Integer> ready = new PriorityQueue<>(byFirstDeclared);
        for (int i = 0; i < components.size(); i++) {
            if (inDegree[i] == 0) {
                ready.offer(i);
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            int component = ready.poll();
            order.addAll(orderWithinComponent(components.get(component)));
            for (int successor : successors.get(component)) {
                if (--inDegree[successor] == 0) {
                    ready.offer(successor);
                }
            }
        }
        return order;
    }

    private int firstDeclared(Collection<String> nodeIds) {
        int first = Integer.MAX_VALUE;
        for (String nodeId : nodeIds) {
            first = Math.min(first, declarationIndex.get(nodeId));
        }
        return first;
    }

    private List<String> orderWithinComponent(List<String> members) {
        if (members.size() == 1) {
            return members;
        }
        Set<String> memberSet = new HashSet<>(members);
        Comparator<String> byDeclaration = Comparator.comparingInt(declarationIndex::get);
        Map<String, Integer> inDegree = new HashMap<>();
        Set<String> entries = new HashSet<>();
        for (String nodeId : members) {
            int internal = 0;
            for (String producer : dependencies.get(nodeId)) {
                if (memberSet.contains(producer)) {
                    internal++;
                } else {
                    entries.add(nodeId);
                }
            }
            inDegree.put(nodeId, internal);
        }

        TreeSet<String> remaining = new TreeSet<>(byDeclaration);
        remaining.addAll(members);
        PriorityQueue<String> ready = new PriorityQueue<>(byDeclaration);
        List<String> order = new ArrayList<>();
        while (!remaining.isEmpty()) {
            String current = ready.isEmpty() ? loopBreaker(remaining, entries) : ready.poll();
            if (!remaining.remove(current)) {
                continue;
            }
            order.add(current);
            for (String dependent : dependents.get(current)) {
                if (memberSet.contains(dependent) && inDegree.merge(dependent, -1, Integer::sum) == 0
                        && remaining.contains(dependent)) {
                    ready.offer(dependent);
                }
            }
        }
        return order;
    }

    private static String loopBreaker(TreeSet<String> remaining, Set<String> entries) {
        for (String nodeId : remaining) {
            if (entries.contains(nodeId)) {
                return nodeId;
            }
        }
        return remaining.first();
    }

    /**
     * Tarjan's algorithm, iterative. Components come out in reverse topological order.
     */
    private List<List<String>> stronglyConnectedComponents() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> components = new ArrayList<>();

        for (String root : nodes.keySet()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            work.push(enter(root, index, lowLink, stack, onStack));
            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        work.push(enter(next, index, lowLink, stack, onStack));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.nodeId, Math.min(lowLink.get(frame.nodeId), index.get(next)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().nodeId;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.nodeId)));
                }
                if (lowLink.get(frame.nodeId).equals(index.get(frame.nodeId))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.nodeId));
                    component.sort(Comparator.comparingInt(declarationIndex::get));
                    components.add(component);
                }
            }
        }
        return components;
    }

    private Frame enter(String nodeId, Map<String, Integer> index, Map<String, Integer> lowLink,
                        Deque<String> stack, Set<String> onStack) {
        int next = index.size();
        index.put(nodeId, next);
        lowLink.put(nodeId, next);
        stack.push(nodeId);
        onStack.add(nodeId);
        return new Frame(nodeId, dependents.get(nodeId).iterator());
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> successors;

        private Frame(String nodeId, Iterator<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }

    /**
     * Detects feedback loops in the node graph.
     *
     * @return true if any node can reach itself
     */
    public boolean hasCycles() {
        return !getCyclicNodes().isEmpty();
    }

    /**
     * Nodes that sit on a feedback loop, in declaration order. Nodes merely downstream of a loop
     * are not included.
     */
    public Set<String> getCyclicNodes() {
        Set<String> cyclic = new TreeSet<>(Comparator.comparingInt(declarationIndex::get));
        for (List<String> component : stronglyConnectedComponents()) {
            String only = component.get(0);
            if (component.size() > 1 || dependents.get(only).contains(only)) {
                cyclic.addAll(component);
            }
        }
        return new LinkedHashSet<>(cyclic);
    }

    /**
     * Nodes reachable by following edges from any DataSource, the DataSources included.
     */
    public Set<String> reachableFromSources() {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (NodeDefinition node : nodes.values()) {
            if (node.nodeType() == NodeType.DATA_SOURCE) {
                stack.push(node.nodeId());
            }
        }
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (visited.add(current)) {
                for (String dependent : dependents.get(current)) {
                    stack.push(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Reports structural concerns that do not stop a run.
     *
     * @return result holding warnings only
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        Set<String> cyclic = getCyclicNodes();
        if (!cyclic.isEmpty()) {
            result.addWarning("nodes", "Feedback loop among nodes " + cyclic
                    + "; tokens on back edges are delivered on the next tick");
        }

        Set<String> reachable = reachableFromSources();
        for (String nodeId : nodes.keySet()) {
            if (!reachable.contains(nodeId)) {
                result.addWarning("nodes." + nodeId, "Node \"" + nodeId + "\" is not reachable from any DataSource");
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "nodes=" + nodes.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
