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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of {@link ExecutionState}. Whole numbers in token values decode as {@link Long}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class ExecutionStateCodec {

    private final ObjectMapper objectMapper;

    public ExecutionStateCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.USE_LONG_FOR_INTS, true);
        this.objectMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public String encode(ExecutionState state) throws ExecutionStateException {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new ExecutionStateException("Failed to encode execution state: " + e.getOriginalMessage(), e);
        }
    }

    public ExecutionState decode(String json) throws ExecutionStateException {
        if (json == null || json.isBlank()) {
            throw new ExecutionStateException("Empty execution state document");
        }
        try {
            return objectMapper.readValue(json, ExecutionState.class);
        } catch (JsonProcessingException e) {
            throw new ExecutionStateException("Invalid execution state JSON: " + e.getOriginalMessage(), e);
        }
    }
}
