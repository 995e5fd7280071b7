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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * An immutable unit of data flowing through a scenario.
 * <p>
 * A token is created by exactly one node runtime and is only ever referenced afterwards.
 * The value is an opaque payload: a number, a string, a boolean or a structured map.
 *
 * @param id             unique id within a run
 * @param value          payload, may be null
 * @param createdAt      simulation time of creation
 * @param originNodeId   node that created the token
 * @param parentTokenIds ids of the tokens this one was derived from, in contribution order
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record Token(String id, Object value, long createdAt, String originNodeId, List<String> parentTokenIds) {

    public Token {
        Objects.requireNonNull(id, "Token id cannot be null");
        Objects.requireNonNull(originNodeId, "Origin node id cannot be null");
        parentTokenIds = parentTokenIds == null ? List.of() : List.copyOf(parentTokenIds);
    }

    @JsonIgnore
    public boolean isSource() {
        return parentTokenIds.isEmpty();
    }
}
