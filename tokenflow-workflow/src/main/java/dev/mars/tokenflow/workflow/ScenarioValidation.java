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

import java.util.Optional;

/**
 * Outcome of {@link ScenarioValidator#validate}: the full issue list, plus the validated scenario
 * when there were no errors.
 */
public record ScenarioValidation(ValidationResult result, ValidatedScenario scenario) {

    public boolean isValid() {
        return result.isValid();
    }

    public Optional<ValidatedScenario> validated() {
        return Optional.ofNullable(scenario);
    }
}
