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

import dev.mars.tokenflow.core.HistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a {@link TokenGraph} from recorded activity.
 * <p>
 * Only token creation entries ({@code CREATED} and {@code AGGREGATED_*}) carrying a token id
 * become nodes. An edge is added for each declared source id that is itself a node; references to
 * tokens with no creation entry are left for {@link LineageAnalyzer#validateIntegrity(List)} to
 * report.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public final class TokenGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TokenGraphBuilder.class);

    private TokenGraphBuilder() {
    }

    public static TokenGraph buildFromHistory(List<HistoryEntry> entries) {
        Map<String, HistoryEntry> creations = creationEntries(entries);

        TokenGraph graph = new TokenGraph();
        for (HistoryEntry entry : creations.values()) {
            List<String> parents = List.copyOf(new LinkedHashSet<>(entry.sourceTokenIds()));
            graph.addNode(new TokenNode(entry.tokenId(), entry.value(), entry.timestamp(), entry.nodeId(),
                    entry.action(), OperationType.of(entry.action(), parents.size()), parents));
        }

        int skipped = 0;
        for (HistoryEntry entry : creations.values()) {
            TokenNode child = graph.getNode(entry.tokenId()).orElseThrow();
            for (String parentId : child.sourceTokenIds()) {
                if (graph.hasToken(parentId)) {
                    graph.addEdge(new TokenEdge(parentId, child.tokenId(), child.operationType()));
                } else {
                    skipped++;
                }
            }
        }

        logger.debug("Built token graph with {} tokens from {} entries ({} dangling parent references)",
                graph.size(), entries.size(), skipped);
        return graph;
    }

    /**
     * Creation entries keyed by token id, in log order. A token created twice keeps its first entry.
     */
    static Map<String, HistoryEntry> creationEntries(List<HistoryEntry> entries) {
        Map<String, HistoryEntry> creations = new LinkedHashMap<>();
        for (HistoryEntry entry : entries) {
            if (!entry.action().isTokenCreation() || entry.tokenId() == null) {
                continue;
            }
            HistoryEntry previous = creations.putIfAbsent(entry.tokenId(), entry);
            if (previous != null) {
                logger.warn("Token {} has more than one creation entry, keeping #{}", entry.tokenId(),
                        previous.sequence());
            }
        }
        return creations;
    }
}
