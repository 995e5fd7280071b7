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

import dev.mars.tokenflow.config.TokenflowConfiguration;
import dev.mars.tokenflow.core.HistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Answers provenance questions about a recorded run. The graph is built from the entries each
 * query is given, so it works the same on a live log and on one loaded from storage; it is rebuilt
 * only when the log has changed since the previous query.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public class LineageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LineageAnalyzer.class);

    private final int maxPathDepth;
    private final int depthWarningThreshold;
    private final TokenGraphCache graphCache = new TokenGraphCache();

    public LineageAnalyzer() {
        this(TokenflowConfiguration.defaults());
    }

    public LineageAnalyzer(TokenflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.maxPathDepth = configuration.getMaxPathDepth();
        this.depthWarningThreshold = configuration.getDepthWarningThreshold();
    }

    /**
     * Cache of the graph shared by all queries on this analyzer.
     */
    public TokenGraphCache getGraphCache() {
        return graphCache;
    }

    public TokenAncestry getTokenAncestry(String tokenId, List<HistoryEntry> entries) {
        TokenGraph graph = graphCache.graphFor(entries);
        if (!graph.hasToken(tokenId)) {
            return TokenAncestry.empty();
        }
        List<String> ancestors = graph.dfsAncestryTraversal(tokenId);
        List<String> roots = new ArrayList<>();
        for (String ancestor : ancestors) {
            if (graph.isRootToken(ancestor)) {
                roots.add(ancestor);
            }
        }
        return new TokenAncestry(ancestors, graph.bfsAncestryByGeneration(tokenId), roots);
    }

    public TokenDescendants getTokenDescendants(String tokenId, List<HistoryEntry> entries) {
        TokenGraph graph = graphCache.graphFor(entries);
        if (!graph.hasToken(tokenId)) {
            return TokenDescendants.empty();
        }
        List<String> descendants = graph.dfsDescendantTraversal(tokenId);
        Set<String> allLeaves = new HashSet<>(graph.findLeafTokens());
        List<String> leaves = new ArrayList<>();
        for (String descendant : descendants) {
            if (allLeaves.contains(descendant)) {
                leaves.add(descendant);
            }
        }
        return new TokenDescendants(descendants, graph.bfsDescendantByGeneration(tokenId), leaves);
    }

    public LineageAnalysis analyzeTokenLineage(List<HistoryEntry> entries) {
        TokenGraph graph = graphCache.graphFor(entries);
        GraphStatistics stats = graph.getGraphStats();

        List<String> roots = graph.findRootTokens();
        long totalDepth = 0;
        for (String root : roots) {
            totalDepth += graph.depthBelow(root);
        }
        double averageDepth = roots.isEmpty() ? 0 : (double) totalDepth / roots.size();

        return new LineageAnalysis(stats.nodeCount(), stats.rootCount(), stats.leafCount(), stats.maxDepth(),
                averageDepth, stats.hasCycles(), graph.detectCycles().size());
    }

    /**
     * Every ancestor of the token, oldest first, each with one shortest path down to the token.
     */
    public List<TokenContributor> findTokenContributors(String tokenId, List<HistoryEntry> entries) {
        TokenGraph graph = graphCache.graphFor(entries);
        if (!graph.hasToken(tokenId)) {
            return List.of();
        }
        Set<String> directParents = new HashSet<>(graph.getParents(tokenId));
        Map<String, TokenPath> paths = graph.shortestPathsFromAncestors(tokenId, maxPathDepth);
        List<TokenContributor> contributors = new ArrayList<>();
        for (String ancestorId : graph.dfsAncestryTraversal(tokenId)) {
            if (ancestorId.equals(tokenId)) {
                continue;
            }
            TokenNode node = graph.getNode(ancestorId).orElseThrow();
            TokenPath path = paths.get(ancestorId);
            contributors.add(new TokenContributor(ancestorId, node.value(), node.originNodeId(), node.createdAt(),
                    path == null ? List.of() : path.tokens(),
                    directParents.contains(ancestorId), graph.isRootToken(ancestorId)));
        }
        contributors.sort(Comparator.comparingLong(TokenContributor::createdAt));
        return contributors;
    }

    /**
     * Checks the recorded provenance for cycles, references to tokens that were never created,
     * a missing root and very deep lineage.
     */
    public IntegrityReport validateIntegrity(List<HistoryEntry> entries) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        TokenGraph graph = graphCache.graphFor(entries);

        List<List<String>> cycles = graph.detectCycles();
        if (!cycles.isEmpty()) {
            errors.add("Found " + cycles.size() + " cycles in token graph");
            for (int i = 0; i < cycles.size(); i++) {
                errors.add("Cycle " + (i + 1) + ": " + String.join(" -> ", cycles.get(i)));
            }
        }

        Map<String, HistoryEntry> creations = TokenGraphBuilder.creationEntries(entries);
        for (Map.Entry<String, HistoryEntry> creation : creations.entrySet()) {
            for (String parentId : creation.getValue().sourceTokenIds()) {
                if (!creations.containsKey(parentId)) {
                    errors.add("Token " + creation.getKey() + " references non-existent parent " + parentId);
                }
            }
        }

        if (graph.size() > 0 && graph.findRootTokens().isEmpty()) {
            warnings.add("No root tokens found - all tokens may be part of cycles");
        }

        int maxDepth = graph.getGraphStats().maxDepth();
        if (maxDepth > depthWarningThreshold) {
            warnings.add("Very deep token lineage detected (depth: " + maxDepth + ")");
        }

        IntegrityReport report = new IntegrityReport(errors, warnings);
        if (!report.isValid()) {
            logger.warn("Token graph integrity check found {} error(s)", errors.size());
        }
        return report;
    }
}
