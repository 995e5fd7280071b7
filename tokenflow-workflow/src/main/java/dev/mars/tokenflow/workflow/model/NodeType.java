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

import java.util.Optional;

/**
 * Node kinds of the scenario wire format, with their JSON discriminator names.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public enum NodeType {
    DATA_SOURCE("DataSource"),
    QUEUE("Queue"),
    PROCESS_NODE("ProcessNode"),
    FSM("FSM"),
    STATE_MULTIPLEXER("StateMultiplexer"),
    SINK("Sink");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<NodeType> fromWireName(String name) {
        for (NodeType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks if nodes of this kind may be the target of an edge.
     */
    public boolean acceptsTokens() {
        return this != DATA_SOURCE;
    }
}
