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

package dev.mars.tokenflow.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of token derivations, parent to child.
 * <p>
 * Provenance read back from a log is not guaranteed to be acyclic, so every traversal here is
 * iterative and tracks visited tokens. A token is reported at most once per traversal.
 * <p>
 * Not thread-safe; build it, then query it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public class TokenGraph {

    private static final Logger logger = LoggerFactory.getLogger(TokenGraph.class);

    public static final int DEFAULT_MAX_PATH_DEPTH = 50;

    private final Map<String, TokenNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<TokenEdge>> outgoing = new HashMap<>();
    private final Map<String, List<TokenEdge>> incoming = new HashMap<>();

    private enum Colour {
        GRAY,
        BLACK
    }

    public void addNode(TokenNode node) {
        nodes.put(node.tokenId(), node);
        outgoing.computeIfAbsent(node.tokenId(), k -> new ArrayList<>());
        incoming.computeIfAbsent(node.tokenId(), k -> new ArrayList<>());
    }

    public void addEdge(TokenEdge edge) {
        outgoing.computeIfAbsent(edge.fromTokenId(), k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.toTokenId(), k -> new ArrayList<>()).add(edge);
    }

    public Optional<TokenNode> getNode(String tokenId) {
        return Optional.ofNullable(nodes.get(tokenId));
    }

    public boolean hasToken(String tokenId) {
        return nodes.containsKey(tokenId);
    }

    /**
     * Token ids in the order they were added.
     */
    public List<String> getAllTokenIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<TokenEdge> getOutgoingEdges(String tokenId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(tokenId, List.of()));
    }

    public List<TokenEdge> getIncomingEdges(String tokenId) {
        return Collections.unmodifiableList(incoming.getOrDefault(tokenId, List.of()));
    }

    public List<String> getParents(String tokenId) {
        List<String> parents = new ArrayList<>();
        for (TokenEdge edge : getIncomingEdges(tokenId)) {
            parents.add(edge.fromTokenId());
        }
        return parents;
    }

    public List<String> getChildren(String tokenId) {
        List<String> children = new ArrayList<>();
        for (TokenEdge edge : getOutgoingEdges(tokenId)) {
            children.add(edge.toTokenId());
        }
        return children;
    }

    /**
     * The token followed by its ancestors in depth-first pre-order, parents in declaration order.
     * Empty if the token is unknown.
     */
    public List<String> dfsAncestryTraversal(String tokenId) {
        return depthFirst(tokenId, true);
    }

    /**
     * The token followed by its descendants in depth-first pre-order. Empty if the token is unknown.
     */
    public List<String> dfsDescendantTraversal(String tokenId) {
        return depthFirst(tokenId, false);
    }

    private List<String> depthFirst(String tokenId, boolean upwards) {
        List<String> result = new ArrayList<>();
        if (!hasToken(tokenId)) {
            return result;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(tokenId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            result.add(current);
            List<String> next = upwards ? getParents(current) : getChildren(current);
            for (int i = next.size() - 1; i >= 0; i--) {
                String candidate = next.get(i);
                if (!visited.contains(candidate) && hasToken(candidate)) {
                    stack.push(candidate);
                }
            }
        }
        return result;
    }

    /**
     * Ancestors grouped by hop distance; generation 0 is the token itself.
     */
    public Map<Integer, List<String>> bfsAncestryByGeneration(String tokenId) {
        return breadthFirst(tokenId, true);
    }

    /**
     * Descendants grouped by hop distance; generation 0 is the token itself.
     */
    public Map<Integer, List<String>> bfsDescendantByGeneration(String tokenId) {
        return breadthFirst(tokenId, false);
    }

    private Map<Integer, List<String>> breadthFirst(String tokenId, boolean upwards) {
        Map<Integer, List<String>> generations = new LinkedHashMap<>();
        if (!hasToken(tokenId)) {
            return generations;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        Map<String, Integer> level = new HashMap<>();
        visited.add(tokenId);
        queue.add(tokenId);
        level.put(tokenId, 0);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int generation = level.get(current);
            generations.computeIfAbsent(generation, k -> new ArrayList<>()).add(current);
            for (String next : upwards ? getParents(current) : getChildren(current)) {
                if (hasToken(next) && visited.add(next)) {
                    level.put(next, generation + 1);
                    queue.add(next);
                }
            }
        }
        return generations;
    }

    public List<TokenPath> findAllPaths(String fromTokenId, String toTokenId) {
        return findAllPaths(fromTokenId, toTokenId, DEFAULT_MAX_PATH_DEPTH);
    }

    /**
     * All simple paths that follow edges from one token down to another, at most {@code maxDepth}
     * edges long.
     */
    public List<TokenPath> findAllPaths(String fromTokenId, String toTokenId, int maxDepth) {
        List<TokenPath> paths = new ArrayList<>();
        if (!hasToken(fromTokenId) || !hasToken(toTokenId)) {
            return paths;
        }
        collectPaths(fromTokenId, toTokenId, maxDepth, new LinkedHashSet<>(), paths);
        return paths;
    }

    private void collectPaths(String current, String target, int maxDepth, LinkedHashSet<String> path,
                              List<TokenPath> paths) {
        path.add(current);
        if (current.equals(target)) {
            paths.add(new TokenPath(new ArrayList<>(path)));
        } else if (path.size() <= maxDepth) {
            for (String child : getChildren(current)) {
                if (!path.contains(child)) {
                    collectPaths(child, target, maxDepth, path, paths);
                }
            }
        }
        path.remove(current);
    }

    /**
     * One shortest path from every ancestor down to the token, found with a single breadth-first
     * walk over parent edges. Ancestors more than {@code maxDepth} edges away are left out.
     *
     * @return ancestor id to path, nearest ancestors first; the token itself is not included
     */
    public Map<String, TokenPath> shortestPathsFromAncestors(String tokenId, int maxDepth) {
        Map<String, TokenPath> paths = new LinkedHashMap<>();
        if (!hasToken(tokenId)) {
            return paths;
        }
        Map<String, String> towardToken = new HashMap<>();
        Map<String, Integer> distance = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distance.put(tokenId, 0);
        queue.add(tokenId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int hops = distance.get(current);
            if (hops == maxDepth) {
                continue;
            }
            for (String parent : getParents(current)) {
                if (hasToken(parent) && !distance.containsKey(parent)) {
                    distance.put(parent, hops + 1);
                    towardToken.put(parent, current);
                    queue.add(parent);
                }
            }
        }
        for (String ancestor : distance.keySet()) {
            if (ancestor.equals(tokenId)) {
                continue;
            }
            List<String> tokens = new ArrayList<>();
            for (String step = ancestor; step != null; step = towardToken.get(step)) {
                tokens.add(step);
            }
            paths.put(ancestor, new TokenPath(tokens));
        }
        return paths;
    }

    /**
     * Finds cycles with a three-colour depth-first search. Each cycle is the list of token ids from
     * the token the closing edge points at, down to the token it leaves from.
     */
    public List<List<String>> detectCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Map<String, Colour> colours = new HashMap<>();
        List<String> path = new ArrayList<>();
        Map<String, Integer> pathIndex = new HashMap<>();
        Deque<ChildCursor> stack = new ArrayDeque<>();

        for (String start : nodes.keySet()) {
            if (colours.containsKey(start)) {
                continue;
            }
            enter(start, colours, path, pathIndex, stack);
            while (!stack.isEmpty()) {
                ChildCursor frame = stack.peek();
                if (frame.hasNext()) {
                    String child = frame.next();
                    Colour colour = colours.get(child);
                    if (colour == null) {
                        enter(child, colours, path, pathIndex, stack);
                    } else if (colour == Colour.GRAY) {
                        cycles.add(new ArrayList<>(path.subList(pathIndex.get(child), path.size())));
                    }
                } else {
                    stack.pop();
                    String done = path.remove(path.size() - 1);
                    pathIndex.remove(done);
                    colours.put(done, Colour.BLACK);
                }
            }
        }
        if (!cycles.isEmpty()) {
            logger.debug("Found {} cycle(s) among {} tokens", cycles.size(), nodes.size());
        }
        return cycles;
    }

    private void enter(String tokenId, Map<String, Colour> colours, List<String> path,
                       Map<String, Integer> pathIndex, Deque<ChildCursor> stack) {
        colours.put(tokenId, Colour.GRAY);
        pathIndex.put(tokenId, path.size());
        path.add(tokenId);
        stack.push(new ChildCursor(getChildren(tokenId)));
    }

    /**
     * Children still to visit from one token on the search path.
     */
    private static final class ChildCursor {
        private final List<String> children;
        private int next;

        ChildCursor(List<String> children) {
            this.children = children;
        }

        boolean hasNext() {
            return next < children.size();
        }

        String next() {
            return children.get(next++);
        }
    }

    /**
     * Tokens without parents in the graph.
     */
    public List<String> findRootTokens() {
        List<String> roots = new ArrayList<>();
        for (String tokenId : nodes.keySet()) {
            if (getIncomingEdges(tokenId).isEmpty()) {
                roots.add(tokenId);
            }
        }
        return roots;
    }

    /**
     * Tokens without children in the graph.
     */
    public List<String> findLeafTokens() {
        List<String> leaves = new ArrayList<>();
        for (String tokenId : nodes.keySet()) {
            if (getOutgoingEdges(tokenId).isEmpty()) {
                leaves.add(tokenId);
            }
        }
        return leaves;
    }

    /**
     * A root created by a DataSource rather than one whose parents are missing from the graph.
     */
    public boolean isRootToken(String tokenId) {
        TokenNode node = nodes.get(tokenId);
        return node != null && getIncomingEdges(tokenId).isEmpty()
                && node.operationType() == OperationType.DATASOURCE_CREATION;
    }

    /**
     * Highest generation reached walking down from the given root.
     */
    public int depthBelow(String tokenId) {
        int depth = 0;
        for (Integer generation : bfsDescendantByGeneration(tokenId).keySet()) {
            depth = Math.max(depth, generation);
        }
        return depth;
    }

    public GraphStatistics getGraphStats() {
        int edgeCount = 0;
        for (List<TokenEdge> edges : outgoing.values()) {
            edgeCount += edges.size();
        }
        List<String> roots = findRootTokens();
        int maxDepth = 0;
        for (String root : roots) {
            maxDepth = Math.max(maxDepth, depthBelow(root));
        }
        return new GraphStatistics(nodes.size(), edgeCount, roots.size(), findLeafTokens().size(), maxDepth,
                !detectCycles().isEmpty());
    }

    public int size() {
        return nodes.size();
    }

    public void clear() {
        nodes.clear();
        outgoing.clear();
        incoming.clear();
    }
}
