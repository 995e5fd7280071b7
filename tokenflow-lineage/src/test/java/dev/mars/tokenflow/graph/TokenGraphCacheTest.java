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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenGraphCache.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-12
 * @version 1.0
 */
class TokenGraphCacheTest {

    private TokenGraphCache cache;

    @BeforeEach
    void setUp() {
        cache = new TokenGraphCache();
    }

    @Test
    void testSameLogIsBuiltOnce() {
        List<HistoryEntry> entries = HistoryFixtures.diamond().entries();

        TokenGraph first = cache.graphFor(entries);
        TokenGraph second = cache.graphFor(new ArrayList<>(entries));

        assertSame(first, second);
        assertEquals(1, cache.getMisses());
        assertEquals(1, cache.getHits());
        assertEquals(4, first.size());
    }

    @Test
    void testGrowingLogRebuildsTheGraph() {
        TokenGraph before = cache.graphFor(HistoryFixtures.diamond().entries());
        TokenGraph after = cache.graphFor(HistoryFixtures.diamond().created("e", 3, 6L, "d").entries());

        assertNotSame(before, after);
        assertEquals(5, after.size());
        assertEquals(List.of("d"), after.getParents("e"));
        assertEquals(2, cache.getMisses());
    }

    @Test
    void testDifferentLogOfSameLengthRebuildsTheGraph() {
        TokenGraph diamond = cache.graphFor(HistoryFixtures.diamond().entries());
        TokenGraph chain = cache.graphFor(HistoryFixtures.chain(4).entries());

        assertNotSame(diamond, chain);
        assertTrue(chain.hasToken("t3"));
    }

    @Test
    void testInvalidate() {
        List<HistoryEntry> entries = HistoryFixtures.chain(3).entries();
        TokenGraph first = cache.graphFor(entries);

        cache.invalidate();

        assertNotSame(first, cache.graphFor(entries));
        assertEquals(2, cache.getMisses());
        assertEquals(0, cache.getHits());
    }

    @Test
    void testEmptyLog() {
        assertEquals(0, cache.graphFor(List.of()).size());
        assertEquals(0, cache.graphFor(List.of()).size());
        assertEquals(1, cache.getHits());
    }
}
