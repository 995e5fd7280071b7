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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps execution states in memory. Safe for concurrent use.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class InMemoryExecutionStateStore implements ExecutionStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryExecutionStateStore.class);

    private final Map<String, ExecutionState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<ExecutionState> get(String id) {
        return Optional.ofNullable(states.get(id));
    }

    @Override
    public void put(String id, ExecutionState state) {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(state, "Execution state cannot be null");
        states.put(id, state);
        logger.debug("Saved execution state {} at t={}", id, state.currentTime());
    }

    @Override
    public void delete(String id) {
        ExecutionState removed = states.remove(id);
        if (removed != null) {
            logger.debug("Removed execution state {}", id);
        }
    }

    public boolean contains(String id) {
        return states.containsKey(id);
    }

    public int size() {
        return states.size();
    }

    public void clearAll() {
        int count = states.size();
        states.clear();
        logger.info("Cleared {} execution states", count);
    }
}
