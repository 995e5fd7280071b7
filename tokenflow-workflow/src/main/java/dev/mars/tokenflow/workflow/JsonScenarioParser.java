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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import dev.mars.tokenflow.workflow.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Jackson-based implementation of ScenarioParser for the JSON scenario format.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class JsonScenarioParser implements ScenarioParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonScenarioParser.class);

    private final ObjectMapper objectMapper;
    private final ScenarioValidator validator;

    public JsonScenarioParser() {
        this(new ScenarioValidator());
    }

    public JsonScenarioParser(ScenarioValidator validator) {
        this.validator = validator;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Scenario parse(Path scenarioFile) throws ScenarioParseException {
        try {
            String content = Files.readString(scenarioFile);
            return read(content, scenarioFile.getFileName().toString());
        } catch (IOException e) {
            throw new ScenarioParseException("Failed to read scenario file: " + scenarioFile, e);
        }
    }

    @Override
    public Scenario parse(InputStream input, String sourceName) throws ScenarioParseException {
        try {
            Scenario scenario = objectMapper.readValue(input, Scenario.class);
            return requireDocument(scenario, sourceName);
        } catch (JsonProcessingException e) {
            throw translate(e, sourceName);
        } catch (IOException e) {
            throw new ScenarioParseException(sourceName, null, "Failed to read scenario", e);
        }
    }

    @Override
    public Scenario parseFromString(String content) throws ScenarioParseException {
        return read(content, null);
    }

    @Override
    public ScenarioValidation parseAndValidate(String content) {
        try {
            return validator.validate(parseFromString(content));
        } catch (ScenarioParseException e) {
            ValidationResult result = new ValidationResult();
            result.addError(e.getFieldPath(), e.getMessage());
            return new ScenarioValidation(result, null);
        }
    }

    @Override
    public String toJson(Scenario scenario) throws ScenarioParseException {
        try {
            return objectMapper.writeValueAsString(scenario);
        } catch (JsonProcessingException e) {
            throw new ScenarioParseException("Failed to write scenario", e);
        }
    }

    private Scenario read(String content, String sourceName) throws ScenarioParseException {
        if (content == null || content.isBlank()) {
            throw new ScenarioParseException(sourceName, null, "Empty scenario document", null);
        }
        try {
            return requireDocument(objectMapper.readValue(content, Scenario.class), sourceName);
        } catch (JsonProcessingException e) {
            throw translate(e, sourceName);
        }
    }

    private Scenario requireDocument(Scenario scenario, String sourceName) throws ScenarioParseException {
        if (scenario == null) {
            throw new ScenarioParseException(sourceName, null, "Empty scenario document", null);
        }
        logger.debug("Parsed scenario {} with {} node(s)", sourceName != null ? sourceName : "<inline>",
                scenario.nodes().size());
        return scenario;
    }

    private ScenarioParseException translate(JsonProcessingException e, String sourceName) {
        String fieldPath = null;
        if (e instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            fieldPath = toFieldPath(mapping.getPath());
        }
        String message;
        if (e instanceof InvalidTypeIdException typeId) {
            message = typeId.getTypeId() == null
                    ? "Node type is missing"
                    : "Unknown node type \"" + typeId.getTypeId() + "\"";
        } else {
            message = "Invalid scenario JSON: " + e.getOriginalMessage();
        }
        return new ScenarioParseException(sourceName, fieldPath, message, e);
    }

    private static String toFieldPath(List<JsonMappingException.Reference> path) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference reference : path) {
            if (reference.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                sb.append('[').append(reference.getIndex()).append(']');
            }
        }
        return sb.toString();
    }
}
