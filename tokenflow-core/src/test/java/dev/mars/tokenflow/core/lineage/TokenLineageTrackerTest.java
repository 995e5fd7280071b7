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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenLineageTracker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
class TokenLineageTrackerTest {

    private TokenLineageTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new TokenLineageTracker();
    }

    private Token token(String id, long t, String... parents) {
        return new Token(id, id, t, "node", List.of(parents));
    }

    private TokenLineageNode register(String id, long t, String action, Token... parents) {
        Token token = token(id, t, java.util.Arrays.stream(parents).map(Token::id).toArray(String[]::new));
        return tracker.registerToken(token, "node", "Node", t, List.of(parents), action);
    }

    @Test
    void testSourceTokenHasDepthZero() {
        TokenLineageNode node = register("a", 1, "CREATED");

        assertEquals(0, node.getDepth());
        assertEquals(LineageType.SOURCE, node.getLineageType());
        assertTrue(node.getParentTokens().isEmpty());
    }

    @Test
    void testDepthIsOnePlusDeepestParent() {
        Token a = token("a", 1);
        Token b = token("b", 1);
        register("a", 1, "CREATED");
        register("b", 1, "CREATED");
        TokenLineageNode c = register("c", 2, "CREATED", a);
        Token cToken = token("c", 2, "a");
        TokenLineageNode d = register("d", 3, "AGGREGATED_SUM", cToken, b);

        assertEquals(1, c.getDepth());
        assertEquals(LineageType.TRANSFORMED, c.getLineageType());
        assertEquals(2, d.getDepth());
        assertEquals(LineageType.AGGREGATED, d.getLineageType());
    }

    @Test
    void testDepthInvariantHoldsOnRandomDag() {
        Random random = new Random(7);
        for (int i = 0; i < 300; i++) {
            int parentCount = i == 0 ? 0 : random.nextInt(Math.min(i, 4) + 1);
            List<String> parents = new java.util.ArrayList<>();
            for (int p = 0; p < parentCount; p++) {
                parents.add("t" + random.nextInt(i));
            }
            tracker.registerToken("t" + i, i, "node", "Node", i, parents, "CREATED");
        }

        for (int i = 0; i < 300; i++) {
            TokenLineageNode node = tracker.getNode("t" + i).orElseThrow();
            if (node.getParentTokens().isEmpty()) {
                assertEquals(0, node.getDepth(), node.toString());
            } else {
                int expected = 1 + node.getParentTokens().stream()
                        .mapToInt(p -> tracker.getNode(p).orElseThrow().getDepth())
                        .max().orElseThrow();
                assertEquals(expected, node.getDepth(), node.toString());
            }
        }
    }

    @Test
    void testParentChildTokensAreLinked() {
        Token a = token("a", 1);
        register("a", 1, "CREATED");
        register("b", 2, "CREATED", a);
        register("c", 3, "CREATED", a);

        assertThat(tracker.getNode("a").orElseThrow().getChildTokens()).containsExactly("b", "c");
    }

    @Test
    void testAncestorsAndDescendantsSortedByTimestamp() {
        tracker.registerToken("s1", 1, "src", "Source", 1, List.of(), "CREATED");
        tracker.registerToken("s2", 2, "src", "Source", 2, List.of(), "CREATED");
        tracker.registerToken("agg", 3, "q", "Queue", 5, List.of("s2", "s1"), "AGGREGATED_SUM");
        tracker.registerToken("out", "x", "p", "Process", 6, List.of("agg"), "CREATED");

        assertThat(tracker.getAncestors("out")).extracting(TokenLineageNode::getTokenId)
                .containsExactly("s1", "s2", "agg");
        assertThat(tracker.getDescendants("s1")).extracting(TokenLineageNode::getTokenId)
                .containsExactly("agg", "out");
        assertThat(tracker.getSourceTokens("out")).extracting(TokenLineageNode::getTokenId)
                .containsExactly("s1", "s2");
        assertThat(tracker.getFullPath("agg")).extracting(TokenLineageNode::getTokenId)
                .containsExactly("s1", "s2", "agg", "out");
        assertThat(tracker.getLineageChain("out")).extracting(TokenLineageNode::getTokenId)
                .containsExactly("s2", "agg", "out");
    }

    @Test
    void testTraversalTerminatesOnCyclicRelations() {
        // x names y as parent before y exists, then y names x: a malformed two-cycle
        tracker.registerToken("x", 1, "n", "N", 1, List.of("y"), "CREATED");
        tracker.registerToken("y", 2, "n", "N", 2, List.of("x"), "CREATED");

        assertThat(tracker.getAncestors("x")).extracting(TokenLineageNode::getTokenId).containsExactly("y");
        assertThat(tracker.getDescendants("x")).extracting(TokenLineageNode::getTokenId).containsExactly("y");
        assertThat(tracker.getLineageChain("x")).hasSize(2);
    }

    @Test
    void testSiblingsShareTimestampAndParents() {
        tracker.registerToken("p", 1, "src", "Source", 1, List.of(), "CREATED");
        tracker.registerToken("a", 1, "n", "N", 2, List.of("p"), "CREATED");
        tracker.registerToken("b", 2, "n", "N", 2, List.of("p"), "CREATED");
        tracker.registerToken("c", 3, "n", "N", 3, List.of("p"), "CREATED");

        assertThat(tracker.getSiblings("a")).extracting(TokenLineageNode::getTokenId).containsExactly("b");
        assertTrue(tracker.getSiblings("c").isEmpty());
    }

    @Test
    void testTokenLineageAggregatesViews() {
        tracker.registerToken("p", 1, "src", "Source", 1, List.of(), "CREATED");
        tracker.registerToken("c", 2, "n", "N", 2, List.of("p"), "CREATED");

        TokenLineage lineage = tracker.getTokenLineage("c").orElseThrow();

        assertEquals("c", lineage.token().getTokenId());
        assertEquals(1, lineage.ancestors().size());
        assertTrue(lineage.descendants().isEmpty());
        assertEquals(2, lineage.fullPath().size());
        assertTrue(tracker.getTokenLineage("missing").isEmpty());
    }

    @Test
    void testDuplicateRegistrationKeepsFirst() {
        TokenLineageNode first = tracker.registerToken("a", 1, "n", "N", 1, List.of(), "CREATED");
        TokenLineageNode second = tracker.registerToken("a", 2, "n", "N", 5, List.of(), "CREATED");

        assertSame(first, second);
        assertEquals(1, tracker.size());
    }

    @Test
    void testStatisticsAndSummary() {
        tracker.registerToken("s1", 1, "src", "Source", 1, List.of(), "CREATED");
        tracker.registerToken("s2", 1, "src", "Source", 2, List.of(), "CREATED");
        tracker.registerToken("agg", 2, "q", "Queue", 3, List.of("s1", "s2"), "AGGREGATED_SUM");

        LineageStatistics stats = tracker.getStatistics();

        assertEquals(3, stats.totalTokens());
        assertEquals(2, stats.relationships());
        assertEquals(1, stats.maxDepth());
        assertEquals(2, stats.count(LineageType.SOURCE));
        assertEquals(1, stats.count(LineageType.AGGREGATED));
        assertThat(tracker.getLineageSummary("agg")).contains("aggregated", "depth 1", "Queue", "2 source");
    }

    @Test
    void testClearAllEmptiesEverything() {
        tracker.registerToken("s1", 1, "src", "Source", 1, List.of(), "CREATED");
        tracker.registerToken("c", 1, "n", "N", 2, List.of("s1"), "CREATED");

        tracker.clearAll();

        assertEquals(0, tracker.size());
        assertTrue(tracker.getDescendants("s1").isEmpty());
        assertEquals(0, tracker.getStatistics().relationships());
    }

    @ParameterizedTest
    @CsvSource({
            "CREATED, 0, SOURCE",
            "CREATED, 1, TRANSFORMED",
            "AGGREGATED_SUM, 3, AGGREGATED",
            "token_split, 1, SPLIT",
            "CONSUMED, 1, CONSUMED"
    })
    void testLineageTypeClassification(String action, int parents, LineageType expected) {
        assertEquals(expected, LineageType.classify(action, parents));
    }
}
