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

import java.util.List;
import java.util.Objects;

/**
 * Keeps the graph built from the most recent activity log so repeated lineage queries over the
 * same log do not rebuild it.
 * <p>
 * Activity logs are append-only and their sequence numbers strictly increase, so a log is
 * identified by its length and its first and last entries. When the log grows, or a different log
 * is passed in, the cached graph is dropped and rebuilt.
 * <p>
 * The returned graph is shared between callers and must not be modified.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-12
 * @version 1.0
 */
public class TokenGraphCache {

    private static final Logger logger = LoggerFactory.getLogger(TokenGraphCache.class);

    private LogKey cachedKey;
    private TokenGraph cachedGraph;
    private long hits;
    private long misses;

    /**
     * Returns the graph for these entries, building it only if the log changed since the last call.
     */
    public synchronized TokenGraph graphFor(List<HistoryEntry> entries) {
        Objects.requireNonNull(entries, "Entries cannot be null");
        LogKey key = LogKey.of(entries);
        if (cachedGraph != null && key.equals(cachedKey)) {
            hits++;
            return cachedGraph;
        }
        misses++;
        if (cachedKey != null) {
            logger.debug("Activity log changed from {} to {} entries, rebuilding token graph",
                    cachedKey.size(), key.size());
        }
        cachedGraph = TokenGraphBuilder.buildFromHistory(entries);
        cachedKey = key;
        return cachedGraph;
    }

    public synchronized void invalidate() {
        cachedKey = null;
        cachedGraph = null;
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    private record LogKey(int size, HistoryEntry first, HistoryEntry last) {

        static LogKey of(List<HistoryEntry> entries) {
            if (entries.isEmpty()) {
                return new LogKey(0, null, null);
            }
            return new LogKey(entries.size(), entries.get(0), entries.get(entries.size() - 1));
        }
    }
}
