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

package dev.mars.tokenflow.workflow;

import dev.mars.tokenflow.core.exceptions.TokenflowException;

/**
 * Exception thrown when a scenario document cannot be read or mapped onto the node model.
 * Semantic problems are reported through {@link ValidationResult} instead.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class ScenarioParseException extends TokenflowException {

    private final String sourceName;
    private final String fieldPath;

    public ScenarioParseException(String message) {
        this(null, null, message, null);
    }

    public ScenarioParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public ScenarioParseException(String sourceName, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.fieldPath = fieldPath;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (sourceName != null) {
            sb.append("Scenario '").append(sourceName).append("': ");
        }
        if (fieldPath != null && !fieldPath.isEmpty()) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        sb.append(super.getMessage());
        return sb.toString();
    }
}
