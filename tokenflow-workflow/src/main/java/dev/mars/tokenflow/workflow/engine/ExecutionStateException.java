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

import dev.mars.tokenflow.core.exceptions.TokenflowException;

/**
 * Thrown when an execution state cannot be encoded, decoded or restored into an engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class ExecutionStateException extends TokenflowException {

    public ExecutionStateException(String message) {
        super(message);
    }

    public ExecutionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
