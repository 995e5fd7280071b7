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

package dev.mars.tokenflow.workflow.runtime;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import dev.mars.tokenflow.core.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialisable state of one node runtime, one variant per node kind.
 * Inbox contents are not part of it; the engine saves those as pending deliveries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NodeState.DataSourceState.class, name = "DataSource"),
        @JsonSubTypes.Type(value = NodeState.QueueState.class, name = "Queue"),
        @JsonSubTypes.Type(value = NodeState.ProcessNodeState.class, name = "ProcessNode"),
        @JsonSubTypes.Type(value = NodeState.StateMachineState.class, name = "FSM"),
        @JsonSubTypes.Type(value = NodeState.MultiplexerState.class, name = "StateMultiplexer"),
        @JsonSubTypes.Type(value = NodeState.SinkState.class, name = "Sink")
})
public sealed interface NodeState {

    /**
     * @param emittedCount tokens emitted so far
     * @param drawCount    values drawn from the generator so far
     */
    record DataSourceState(long emittedCount, long drawCount) implements NodeState {
    }

    /**
     * @param buffer      tokens of the open window, in arrival order
     * @param windowStart simulation time the open window started
     */
    record QueueState(List<Token> buffer, long windowStart, long aggregationCount) implements NodeState {
        public QueueState {
            buffer = buffer == null ? List.of() : List.copyOf(buffer);
        }
    }

    /**
     * @param inputBuffers pending tokens per input name, oldest first
     */
    record ProcessNodeState(Map<String, List<Token>> inputBuffers, long firingCount) implements NodeState {
        public ProcessNodeState {
            Map<String, List<Token>> copy = new LinkedHashMap<>();
            if (inputBuffers != null) {
                inputBuffers.forEach((name, tokens) -> copy.put(name, List.copyOf(tokens)));
            }
            inputBuffers = Collections.unmodifiableMap(copy);
        }
    }

    record StateMachineState(String currentState, List<TransitionRecord> history) implements NodeState {
        public StateMachineState {
            history = history == null ? List.of() : List.copyOf(history);
        }
    }

    record MultiplexerState(Map<String, Long> routeCounts) implements NodeState {
        public MultiplexerState {
            routeCounts = routeCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(routeCounts));
        }
    }

    /**
     * @param recentTokens the most recently consumed tokens, oldest first
     */
    record SinkState(long consumedCount, List<Token> recentTokens) implements NodeState {
        public SinkState {
            recentTokens = recentTokens == null ? List.of() : List.copyOf(recentTokens);
        }
    }

    /**
     * One transition taken by a state machine.
     */
    record TransitionRecord(long time, String from, String to, String trigger, String tokenId) {
    }
}
