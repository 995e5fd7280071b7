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

import dev.mars.tokenflow.core.ActivityAction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenGraph construction and traversal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
class TokenGraphTest {

    @Test
    void testBuildFromHistory() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        assertEquals(List.of("a", "b", "c", "d"), graph.getAllTokenIds());
        assertEquals(List.of("b", "c"), graph.getParents("d"));
        assertEquals(List.of("b", "c"), graph.getChildren("a"));
        assertTrue(graph.hasToken("d"));
        assertFalse(graph.hasToken("z"));

        TokenNode d = graph.getNode("d").orElseThrow();
        assertEquals(5L, d.value());
        assertEquals(2, d.createdAt());
        assertEquals("node-d", d.originNodeId());
        assertEquals(OperationType.TRANSFORMATION, d.operationType());
        assertEquals(OperationType.DATASOURCE_CREATION, graph.getNode("a").orElseThrow().operationType());
    }

    @Test
    void testOnlyCreationEntriesBecomeTokens() {
        TokenGraph graph = new HistoryFixtures()
                .created("a", 0, 4L)
                .aggregated("s", 3, 4L, "a")
                .add(ActivityAction.ROUTED, "a", 1, 4L)
                .add(ActivityAction.CONSUMED, "s", 3, 4L, "s")
                .graph();

        assertEquals(List.of("a", "s"), graph.getAllTokenIds());
        assertEquals(OperationType.AGGREGATION, graph.getNode("s").orElseThrow().operationType());
        assertEquals(1, graph.getGraphStats().edgeCount());
    }

    @Test
    void testDanglingParentAddsNoEdge() {
        TokenGraph graph = new HistoryFixtures().created("x", 1, 1L, "ghost").graph();

        assertTrue(graph.getParents("x").isEmpty());
        assertEquals(List.of("x"), graph.findRootTokens());
        assertFalse(graph.isRootToken("x"));
        assertEquals(List.of("ghost"), graph.getNode("x").orElseThrow().sourceTokenIds());
    }

    @Test
    void testRepeatedParentIsOneEdge() {
        TokenGraph graph = new HistoryFixtures().created("a", 0, 1L).created("b", 1, 2L, "a", "a").graph();

        assertEquals(List.of("a"), graph.getParents("b"));
    }

    @Test
    void testDepthFirstTraversals() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        assertEquals(List.of("d", "b", "a", "c"), graph.dfsAncestryTraversal("d"));
        assertEquals(List.of("a", "b", "d", "c"), graph.dfsDescendantTraversal("a"));
        assertTrue(graph.dfsAncestryTraversal("missing").isEmpty());
    }

    @Test
    void testBreadthFirstGenerations() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        assertEquals(Map.of(0, List.of("d"), 1, List.of("b", "c"), 2, List.of("a")),
                graph.bfsAncestryByGeneration("d"));
        assertEquals(Map.of(0, List.of("a"), 1, List.of("b", "c"), 2, List.of("d")),
                graph.bfsDescendantByGeneration("a"));
    }

    @Test
    void testFindAllPaths() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        List<TokenPath> paths = graph.findAllPaths("a", "d");

        assertThat(paths).extracting(TokenPath::tokens)
                .containsExactly(List.of("a", "b", "d"), List.of("a", "c", "d"));
        assertEquals(2, paths.get(0).length());
        assertTrue(graph.findAllPaths("d", "a").isEmpty());
        assertEquals(List.of(List.of("b")), graph.findAllPaths("b", "b").stream().map(TokenPath::tokens).toList());
    }

    @Test
    void testFindAllPathsRespectsDepthLimit() {
        TokenGraph graph = HistoryFixtures.chain(4).graph();

        assertTrue(graph.findAllPaths("t0", "t3", 2).isEmpty());
        assertEquals(1, graph.findAllPaths("t0", "t3", 3).size());
    }

    @Test
    void testShortestPathsFromAncestors() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        Map<String, TokenPath> paths = graph.shortestPathsFromAncestors("d", TokenGraph.DEFAULT_MAX_PATH_DEPTH);

        assertThat(paths).containsOnlyKeys("b", "c", "a");
        assertEquals(List.of("b", "d"), paths.get("b").tokens());
        assertEquals(List.of("a", "b", "d"), paths.get("a").tokens());
        assertTrue(graph.shortestPathsFromAncestors("a", 5).isEmpty());
        assertTrue(graph.shortestPathsFromAncestors("zz", 5).isEmpty());
    }

    @Test
    void testShortestPathsStopAtDepthLimit() {
        TokenGraph graph = HistoryFixtures.chain(4).graph();

        assertThat(graph.shortestPathsFromAncestors("t3", 2)).containsOnlyKeys("t2", "t1");
    }

    @Test
    void testShortestPathsOnWideGraphAreQuick() {
        TokenGraph graph = HistoryFixtures.ladder(60).graph();

        Map<String, TokenPath> paths = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> graph.shortestPathsFromAncestors("a59", TokenGraph.DEFAULT_MAX_PATH_DEPTH));

        assertEquals(100, paths.size());
        assertEquals(50, paths.get("a10").tokens().size());
        assertFalse(paths.containsKey("a0"));
    }

    @Test
    void testRootsLeavesAndStatistics() {
        TokenGraph graph = HistoryFixtures.diamond().created("e", 4, 9L).graph();

        assertEquals(List.of("a", "e"), graph.findRootTokens());
        assertEquals(List.of("d", "e"), graph.findLeafTokens());
        assertTrue(graph.isRootToken("a"));
        assertEquals(new GraphStatistics(5, 4, 2, 2, 2, false), graph.getGraphStats());
    }

    @Test
    void testDetectCyclesReportsTargetToSource() {
        TokenGraph graph = new HistoryFixtures()
                .created("a", 0, 1L, "c")
                .created("b", 1, 1L, "a")
                .created("c", 2, 1L, "b")
                .graph();

        assertEquals(List.of(List.of("a", "b", "c")), graph.detectCycles());
        assertTrue(graph.findRootTokens().isEmpty());
        assertEquals(List.of("a", "c", "b"), graph.dfsAncestryTraversal("a"));
        assertTrue(graph.getGraphStats().hasCycles());
    }

    @Test
    void testAcyclicGraphHasNoCycles() {
        assertTrue(HistoryFixtures.diamond().graph().detectCycles().isEmpty());
    }

    @Test
    void testLargeCycleTerminates() {
        int size = 10_000;
        TokenGraph graph = new TokenGraph();
        for (int i = 0; i < size; i++) {
            graph.addNode(new TokenNode("t" + i, (long) i, i, "loop", ActivityAction.CREATED,
                    OperationType.TRANSFORMATION, List.of("t" + ((i + size - 1) % size))));
        }
        for (int i = 0; i < size; i++) {
            graph.addEdge(new TokenEdge("t" + i, "t" + ((i + 1) % size), OperationType.TRANSFORMATION));
        }

        List<List<String>> cycles = assertTimeoutPreemptively(Duration.ofSeconds(10), graph::detectCycles);

        assertEquals(1, cycles.size());
        assertEquals(size, cycles.get(0).size());
        assertEquals("t0", cycles.get(0).get(0));
        assertEquals("t9999", cycles.get(0).get(size - 1));
        assertEquals(size, graph.dfsDescendantTraversal("t0").size());
        assertEquals(size, graph.dfsAncestryTraversal("t5").size());
        assertEquals(size, graph.bfsAncestryByGeneration("t0").size());
    }

    @Test
    void testClear() {
        TokenGraph graph = HistoryFixtures.diamond().graph();

        graph.clear();

        assertEquals(0, graph.size());
        assertTrue(graph.getParents("d").isEmpty());
        assertEquals(new GraphStatistics(0, 0, 0, 0, 0, false), graph.getGraphStats());
    }
}
