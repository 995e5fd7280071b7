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

package dev.mars.tokenflow.core.lineage;

import dev.mars.tokenflow.core.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Live registry of token parent/child relations for one simulation run.
 * <p>
 * Each run owns its own tracker; node runtimes register tokens as they create them and external
 * readers query between ticks. Traversals walk an explicit stack with a visited set, so malformed
 * (cyclic) relations cannot cause non-termination. Results are ordered by timestamp, then by
 * registration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class TokenLineageTracker {

    private static final Logger logger = LoggerFactory.getLogger(TokenLineageTracker.class);

    private static final Comparator<TokenLineageNode> CHRONOLOGICAL =
            Comparator.comparingLong(TokenLineageNode::getTimestamp)
                    .thenComparingLong(TokenLineageNode::getRegistrationOrder);

    private final Map<String, TokenLineageNode> lineageNodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> parentToChildren = new LinkedHashMap<>();
    private final Map<String, Set<String>> childToParents = new LinkedHashMap<>();
    private long registrations;

    /**
     * Registers a token created at time {@code timestamp} by node {@code nodeId} from the given parents.
     */
    public TokenLineageNode registerToken(Token token, String nodeId, String nodeName, long timestamp,
                                          List<Token> parentTokens, String action) {
        Objects.requireNonNull(token, "Token cannot be null");
        List<String> parentIds = new ArrayList<>();
        for (Token parent : parentTokens == null ? List.<Token>of() : parentTokens) {
            parentIds.add(parent.id());
        }
        return registerToken(token.id(), token.value(), nodeId, nodeName, timestamp, parentIds, action);
    }

    /**
     * Registers a token from its recorded fields, e.g. when replaying an activity log.
     */
    public TokenLineageNode registerToken(String tokenId, Object value, String nodeId, String nodeName,
                                          long timestamp, List<String> parentIds, String action) {
        Objects.requireNonNull(tokenId, "Token id cannot be null");
        TokenLineageNode existing = lineageNodes.get(tokenId);
        if (existing != null) {
            logger.warn("Token {} is already registered, keeping the first registration", tokenId);
            return existing;
        }

        List<String> parents = List.copyOf(new LinkedHashSet<>(parentIds == null ? List.of() : parentIds));
        int depth = 0;
        if (!parents.isEmpty()) {
            int maxParentDepth = 0;
            for (String parentId : parents) {
                TokenLineageNode parent = lineageNodes.get(parentId);
                if (parent != null) {
                    maxParentDepth = Math.max(maxParentDepth, parent.getDepth());
                }
            }
            depth = maxParentDepth + 1;
        }

        TokenLineageNode node = new TokenLineageNode(tokenId, value, nodeId, nodeName, timestamp, action,
                parents, depth, LineageType.classify(action, parents.size()), registrations++);
        lineageNodes.put(tokenId, node);

        for (String parentId : parents) {
            parentToChildren.computeIfAbsent(parentId, k -> new LinkedHashSet<>()).add(tokenId);
            childToParents.computeIfAbsent(tokenId, k -> new LinkedHashSet<>()).add(parentId);
            TokenLineageNode parent = lineageNodes.get(parentId);
            if (parent != null) {
                parent.addChild(tokenId);
            }
        }

        logger.debug("Registered token {} at {} (depth {}, {})", tokenId, nodeId, depth, node.getLineageType());
        return node;
    }

    public Optional<TokenLineageNode> getNode(String tokenId) {
        return Optional.ofNullable(lineageNodes.get(tokenId));
    }

    public boolean isRegistered(String tokenId) {
        return lineageNodes.containsKey(tokenId);
    }

    public int size() {
        return lineageNodes.size();
    }

    public List<TokenLineageNode> getAncestors(String tokenId) {
        return traverse(tokenId, id -> childToParents.getOrDefault(id, Set.of()));
    }

    public List<TokenLineageNode> getDescendants(String tokenId) {
        return traverse(tokenId, id -> parentToChildren.getOrDefault(id, Set.of()));
    }

    /**
     * Other tokens created at the same timestamp from exactly the same set of parents.
     */
    public List<TokenLineageNode> getSiblings(String tokenId) {
        TokenLineageNode node = lineageNodes.get(tokenId);
        if (node == null) {
            return List.of();
        }
        Set<String> parents = new HashSet<>(node.getParentTokens());
        Collection<String> candidates = parents.isEmpty()
                ? lineageNodes.keySet()
                : parentToChildren.getOrDefault(node.getParentTokens().get(0), Set.of());

        List<TokenLineageNode> siblings = new ArrayList<>();
        for (String candidateId : candidates) {
            TokenLineageNode candidate = lineageNodes.get(candidateId);
            if (candidate == null || candidateId.equals(tokenId)) {
                continue;
            }
            if (candidate.getTimestamp() == node.getTimestamp()
                    && new HashSet<>(candidate.getParentTokens()).equals(parents)) {
                siblings.add(candidate);
            }
        }
        siblings.sort(CHRONOLOGICAL);
        return siblings;
    }

    /**
     * Ancestors, the token itself and its descendants, in timestamp order.
     */
    public List<TokenLineageNode> getFullPath(String tokenId) {
        TokenLineageNode node = lineageNodes.get(tokenId);
        if (node == null) {
            return List.of();
        }
        List<TokenLineageNode> path = new ArrayList<>(getAncestors(tokenId));
        path.add(node);
        path.addAll(getDescendants(tokenId));
        path.sort(CHRONOLOGICAL);
        return path;
    }

    public Optional<TokenLineage> getTokenLineage(String tokenId) {
        TokenLineageNode node = lineageNodes.get(tokenId);
        if (node == null) {
            return Optional.empty();
        }
        return Optional.of(new TokenLineage(node, getAncestors(tokenId), getDescendants(tokenId),
                getSiblings(tokenId), getFullPath(tokenId)));
    }

    /**
     * The original source tokens (ancestors without parents) a token was derived from.
     */
    public List<TokenLineageNode> getSourceTokens(String tokenId) {
        List<TokenLineageNode> sources = new ArrayList<>();
        for (TokenLineageNode ancestor : getAncestors(tokenId)) {
            if (ancestor.getParentTokens().isEmpty()) {
                sources.add(ancestor);
            }
        }
        return sources;
    }

    /**
     * Single chain from a root down to the token, following the first parent at every step.
     */
    public List<TokenLineageNode> getLineageChain(String tokenId) {
        Deque<TokenLineageNode> chain = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        String current = tokenId;
        while (current != null && visited.add(current)) {
            TokenLineageNode node = lineageNodes.get(current);
            if (node == null) {
                break;
            }
            chain.addFirst(node);
            current = node.getParentTokens().isEmpty() ? null : node.getParentTokens().get(0);
        }
        return new ArrayList<>(chain);
    }

    public String getLineageSummary(String tokenId) {
        TokenLineageNode node = lineageNodes.get(tokenId);
        if (node == null) {
            return "Token " + tokenId + " is not tracked";
        }
        int sources = getSourceTokens(tokenId).size();
        int descendants = getDescendants(tokenId).size();
        return String.format("Token %s (%s, depth %d) created by %s from %d source token(s); %d descendant(s)",
                tokenId, node.getLineageType().name().toLowerCase(Locale.ROOT), node.getDepth(),
                node.getNodeName() != null ? node.getNodeName() : node.getNodeId(), sources, descendants);
    }

    public LineageStatistics getStatistics() {
        Map<LineageType, Long> byType = new EnumMap<>(LineageType.class);
        int maxDepth = 0;
        int relationships = 0;
        for (TokenLineageNode node : lineageNodes.values()) {
            byType.merge(node.getLineageType(), 1L, Long::sum);
            maxDepth = Math.max(maxDepth, node.getDepth());
        }
        for (Set<String> children : parentToChildren.values()) {
            relationships += children.size();
        }
        return new LineageStatistics(lineageNodes.size(), relationships, maxDepth, byType);
    }

    /**
     * Empties all three maps. There is no partial reset.
     */
    public void clearAll() {
        int count = lineageNodes.size();
        lineageNodes.clear();
        parentToChildren.clear();
        childToParents.clear();
        registrations = 0;
        logger.debug("Cleared lineage of {} tokens", count);
    }

    private List<TokenLineageNode> traverse(String startId, Function<String, Set<String>> neighbours) {
        Set<String> visited = new HashSet<>();
        visited.add(startId);
        Deque<String> stack = new ArrayDeque<>(neighbours.apply(startId));
        List<TokenLineageNode> found = new ArrayList<>();
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!visited.add(id)) {
                continue;
            }
            TokenLineageNode node = lineageNodes.get(id);
            if (node != null) {
                found.add(node);
            }
            for (String next : neighbours.apply(id)) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        found.sort(CHRONOLOGICAL);
        return found;
    }
}
