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

package dev.mars.tokenflow.core;

import java.util.List;
import java.util.Objects;

/**
 * One row of the activity log.
 * <p>
 * Entries are immutable. {@code sequence} is assigned by the {@link ActivityLog} and is the only
 * total order over entries; {@code timestamp} is simulation time and {@code epochTimestamp} is wall time
 * in milliseconds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record HistoryEntry(
        long sequence,
        long timestamp,
        long epochTimestamp,
        String nodeId,
        ActivityAction action,
        String tokenId,
        Object value,
        String details,
        List<String> sourceTokenIds) {

    public HistoryEntry {
        Objects.requireNonNull(nodeId, "Node id cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        sourceTokenIds = sourceTokenIds == null ? List.of() : List.copyOf(sourceTokenIds);
    }

    public static Builder builder(long timestamp, String nodeId, ActivityAction action) {
        return new Builder(timestamp, nodeId, action);
    }

    /**
     * Unsequenced entry handed to {@link ActivityLog#append(Builder)}.
     */
    public static class Builder {
        private final long timestamp;
        private final String nodeId;
        private final ActivityAction action;
        private String tokenId;
        private Object value;
        private String details;
        private List<String> sourceTokenIds = List.of();

        private Builder(long timestamp, String nodeId, ActivityAction action) {
            this.timestamp = timestamp;
            this.nodeId = Objects.requireNonNull(nodeId, "Node id cannot be null");
            this.action = Objects.requireNonNull(action, "Action cannot be null");
        }

        public Builder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder sourceTokenIds(List<String> sourceTokenIds) {
            this.sourceTokenIds = sourceTokenIds;
            return this;
        }

        HistoryEntry build(long sequence, long epochTimestamp) {
            return new HistoryEntry(sequence, timestamp, epochTimestamp, nodeId, action,
                    tokenId, value, details, sourceTokenIds);
        }
    }
}
