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

import java.util.EnumSet;
import java.util.Set;

/**
 * Selection criteria for {@link ActivityLog#query(HistoryFilter)}. Unset criteria match everything.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class HistoryFilter {

    private static final HistoryFilter ALL = builder().build();

    private final String nodeId;
    private final Set<ActivityAction> actions;
    private final String tokenId;
    private final long afterSequence;
    private final long fromTime;
    private final long toTime;

    private HistoryFilter(Builder builder) {
        this.nodeId = builder.nodeId;
        this.actions = builder.actions.isEmpty() ? Set.of() : Set.copyOf(builder.actions);
        this.tokenId = builder.tokenId;
        this.afterSequence = builder.afterSequence;
        this.fromTime = builder.fromTime;
        this.toTime = builder.toTime;
    }

    public static HistoryFilter all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(HistoryEntry entry) {
        if (nodeId != null && !nodeId.equals(entry.nodeId())) {
            return false;
        }
        if (!actions.isEmpty() && !actions.contains(entry.action())) {
            return false;
        }
        if (tokenId != null && !tokenId.equals(entry.tokenId())) {
            return false;
        }
        return entry.sequence() > afterSequence
                && entry.timestamp() >= fromTime
                && entry.timestamp() <= toTime;
    }

    public static class Builder {
        private String nodeId;
        private final EnumSet<ActivityAction> actions = EnumSet.noneOf(ActivityAction.class);
        private String tokenId;
        private long afterSequence = Long.MIN_VALUE;
        private long fromTime = Long.MIN_VALUE;
        private long toTime = Long.MAX_VALUE;

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder action(ActivityAction action) {
            this.actions.add(action);
            return this;
        }

        public Builder actions(Set<ActivityAction> actions) {
            this.actions.addAll(actions);
            return this;
        }

        public Builder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        /**
         * Only entries with a sequence strictly greater than the given one. Lets readers poll a growing log.
         */
        public Builder afterSequence(long afterSequence) {
            this.afterSequence = afterSequence;
            return this;
        }

        public Builder timeRange(long fromTime, long toTime) {
            if (fromTime > toTime) {
                throw new IllegalArgumentException("fromTime must not be after toTime");
            }
            this.fromTime = fromTime;
            this.toTime = toTime;
            return this;
        }

        public HistoryFilter build() {
            return new HistoryFilter(this);
        }
    }
}
