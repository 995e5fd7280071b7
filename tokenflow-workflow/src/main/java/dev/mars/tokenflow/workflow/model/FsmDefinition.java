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

package dev.mars.tokenflow.workflow.model;

import java.util.List;
import java.util.Optional;

/**
 * States, transitions and initial state of an FSM node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public record FsmDefinition(List<FsmState> states, List<FsmTransition> transitions, String initialState) {

    public FsmDefinition {
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public Optional<FsmState> state(String id) {
        for (FsmState state : states) {
            if (state.id() != null && state.id().equals(id)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
