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

import java.util.Optional;

/**
 * Read-only supplier of scenario templates used to start runs.
 */
public interface ScenarioTemplateSource {

    /**
     * @param templateId template identifier
     * @return the template, or empty if there is none with that id
     * @throws ScenarioParseException if the template exists but cannot be read
     */
    Optional<Scenario> findTemplate(String templateId) throws ScenarioParseException;
}
