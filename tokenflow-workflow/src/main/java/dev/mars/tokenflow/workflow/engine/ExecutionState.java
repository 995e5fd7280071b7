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

package dev.mars.tokenflow.workflow.engine;

import dev.mars.tokenflow.core.HistoryEntry;
import dev.mars.tokenflow.workflow.runtime.NodeState;
import dev.mars.tokenflow.workflow.runtime.TokenDelivery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to continue a run later: runtime states, counters, the activity log and the
 * tokens still waiting in node inboxes.
 * <p>
 * {@code nodeActivityLogs} is the global log grouped by node. It is written for readers of the
 * persisted form and ignored on restore.
 *
 * @param currentTime    simulation time of the last processed tick
 * @param tickCount      ticks processed so far
 * @param eventCounter   sequence of the last activity log entry
 * @param tokenCounter   number of tokens created so far
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public record ExecutionState(
        long currentTime,
        long tickCount,
        long eventCounter,
        long tokenCounter,
        Map<String, NodeState> nodeStates,
        List<HistoryEntry> globalActivityLog,
        Map<String, List<HistoryEntry>> nodeActivityLogs,
        Map<String, List<TokenDelivery>> pendingDeliveries) {

    public ExecutionState {
        nodeStates = nodeStates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates));
        globalActivityLog = globalActivityLog == null ? List.of() : List.copyOf(globalActivityLog);
        nodeActivityLogs = nodeActivityLogs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodeActivityLogs));
        pendingDeliveries = pendingDeliveries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pendingDeliveries));
    }
}
