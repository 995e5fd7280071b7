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

import dev.mars.tokenflow.workflow.model.Scenario;

import java.io.InputStream;
import java.nio.file.Path;

public interface ScenarioParser {

    Scenario parse(Path scenarioFile) throws ScenarioParseException;

    Scenario parse(InputStream input, String sourceName) throws ScenarioParseException;

    Scenario parseFromString(String content) throws ScenarioParseException;

    /**
     * Parses and validates in one step. Read and mapping failures are reported as errors in the
     * returned result rather than thrown.
     *
     * @param content the scenario document
     * @return validation outcome
     */
    ScenarioValidation parseAndValidate(String content);

    String toJson(Scenario scenario) throws ScenarioParseException;
}
