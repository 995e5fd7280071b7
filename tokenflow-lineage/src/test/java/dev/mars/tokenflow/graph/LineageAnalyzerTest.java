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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LineageAnalyzer queries and integrity reporting.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
class LineageAnalyzerTest {

    private LineageAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new LineageAnalyzer(TokenflowConfiguration.defaults());
    }

    @Test
    void testTokenAncestry() {
        TokenAncestry ancestry = analyzer.getTokenAncestry("d", HistoryFixtures.diamond().entries());

        assertEquals(List.of("d", "b", "a", "c"), ancestry.ancestors());
        assertEquals(List.of("a"), ancestry.roots());
        assertEquals(List.of("b", "c"), ancestry.generations().get(1));
    }

    @Test
    void testUnknownTokenGivesEmptyResults() {
        assertEquals(TokenAncestry.empty(), analyzer.getTokenAncestry("zz", HistoryFixtures.diamond().entries()));
        assertEquals(TokenDescendants.empty(), analyzer.getTokenDescendants("zz", HistoryFixtures.diamond().entries()));
        assertTrue(analyzer.findTokenContributors("zz", HistoryFixtures.diamond().entries()).isEmpty());
    }

    @Test
    void testTokenDescendants() {
        TokenDescendants descendants = analyzer.getTokenDescendants("a", HistoryFixtures.diamond().entries());

        assertEquals(List.of("a", "b", "d", "c"), descendants.descendants());
        assertEquals(List.of("d"), descendants.leaves());
        assertEquals(List.of("d"), descendants.generations().get(2));
    }

    @Test
    void testContributorsOldestFirst() {
        List<TokenContributor> contributors = analyzer.findTokenContributors("d", HistoryFixtures.diamond().entries());

        assertThat(contributors).extracting(TokenContributor::tokenId).containsExactly("a", "b", "c");

        TokenContributor root = contributors.get(0);
        assertTrue(root.root());
        assertFalse(root.directParent());
        assertEquals(List.of("a", "b", "d"), root.contributionPath());
        assertEquals(1L, root.value());

        TokenContributor parent = contributors.get(1);
        assertTrue(parent.directParent());
        assertFalse(parent.root());
        assertEquals(List.of("b", "d"), parent.contributionPath());
    }

    @Test
    void testContributorsOnWideGraph() {
        List<HistoryEntry> entries = HistoryFixtures.ladder(26).entries();

        List<TokenContributor> contributors = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> analyzer.findTokenContributors("a25", entries));

        assertEquals(50, contributors.size());
        TokenContributor root = contributors.get(0);
        assertTrue(root.root());
        assertEquals(26, root.contributionPath().size());
        assertEquals("a25", root.contributionPath().get(25));
        assertThat(contributors).filteredOn(TokenContributor::directParent)
                .extracting(TokenContributor::tokenId)
                .containsExactlyInAnyOrder("a24", "b24");
    }

    @Test
    void testQueriesShareTheGraphUntilTheLogChanges() {
        List<HistoryEntry> entries = HistoryFixtures.diamond().entries();

        analyzer.getTokenAncestry("d", entries);
        analyzer.findTokenContributors("d", entries);
        analyzer.validateIntegrity(entries);
        assertEquals(1, analyzer.getGraphCache().getMisses());
        assertEquals(2, analyzer.getGraphCache().getHits());

        List<HistoryEntry> grown = HistoryFixtures.diamond().created("e", 3, 6L, "d").entries();
        assertEquals(List.of("e", "d", "b", "a", "c"), analyzer.getTokenAncestry("e", grown).ancestors());
        assertEquals(2, analyzer.getGraphCache().getMisses());
    }

    @Test
    void testAnalyzeTokenLineage() {
        LineageAnalysis analysis = analyzer.analyzeTokenLineage(HistoryFixtures.diamond().created("e", 4, 9L).entries());

        assertEquals(new LineageAnalysis(5, 2, 2, 2, 1.0, false, 0), analysis);
    }

    @Test
    void testCleanHistoryIsValid() {
        IntegrityReport report = analyzer.validateIntegrity(HistoryFixtures.diamond().entries());

        assertTrue(report.isValid());
        assertFalse(report.hasWarnings());
    }

    @Test
    void testCyclesAreReported() {
        List<String> errors = analyzer.validateIntegrity(new HistoryFixtures()
                .created("a", 0, 1L, "c")
                .created("b", 1, 1L, "a")
                .created("c", 2, 1L, "b")
                .entries()).errors();

        assertEquals(List.of("Found 1 cycles in token graph", "Cycle 1: a -> b -> c"), errors);
    }

    @Test
    void testAllCyclicGraphWarnsAboutRoots() {
        IntegrityReport report = analyzer.validateIntegrity(new HistoryFixtures()
                .created("a", 0, 1L, "b")
                .created("b", 1, 1L, "a")
                .entries());

        assertFalse(report.isValid());
        assertEquals(List.of("No root tokens found - all tokens may be part of cycles"), report.warnings());
    }

    @Test
    void testMissingParentIsReported() {
        IntegrityReport report = analyzer.validateIntegrity(new HistoryFixtures()
                .created("a", 0, 1L)
                .created("x", 1, 2L, "a", "ghost")
                .entries());

        assertEquals(List.of("Token x references non-existent parent ghost"), report.errors());
    }

    @Test
    void testDeepLineageWarnsPastDefaultThreshold() {
        assertFalse(analyzer.validateIntegrity(HistoryFixtures.chain(21).entries()).hasWarnings());

        IntegrityReport report = analyzer.validateIntegrity(HistoryFixtures.chain(22).entries());

        assertTrue(report.isValid());
        assertEquals(List.of("Very deep token lineage detected (depth: 21)"), report.warnings());
    }

    @Test
    void testThresholdsComeFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(TokenflowConfiguration.DEPTH_WARNING_THRESHOLD, "3");
        properties.setProperty(TokenflowConfiguration.MAX_PATH_DEPTH, "1");
        LineageAnalyzer strict = new LineageAnalyzer(new TokenflowConfiguration(properties));
        assertEquals(List.of("Very deep token lineage detected (depth: 4)"),
                strict.validateIntegrity(HistoryFixtures.chain(5).entries()).warnings());

        List<TokenContributor> contributors = strict.findTokenContributors("t2", HistoryFixtures.chain(5).entries());
        assertEquals(List.of("t1", "t2"), contributors.get(1).contributionPath());
        assertTrue(contributors.get(0).contributionPath().isEmpty());
    }
}
