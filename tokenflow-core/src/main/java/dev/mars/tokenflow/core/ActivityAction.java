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

/**
 * Kinds of observable engine events recorded in the activity log.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum ActivityAction {
    CREATED("Token created"),
    ENQUEUED("Token buffered for aggregation"),
    AGGREGATED_SUM("Window aggregated by sum"),
    AGGREGATED_AVERAGE("Window aggregated by average"),
    AGGREGATED_COUNT("Window aggregated by count"),
    AGGREGATED_FIRST("Window aggregated by first value"),
    AGGREGATED_LAST("Window aggregated by last value"),
    TRANSITION("State transition taken"),
    TRIGGER_IGNORED("Message matched no transition"),
    FSM_LOG("State machine log action"),
    ROUTED("Routing decision made"),
    CONSUMED("Token consumed"),
    EVALUATION_ERROR("Expression evaluation failed");

    private final String description;

    ActivityAction(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Checks if entries with this action introduce a new token into the run.
     */
    public boolean isTokenCreation() {
        return this == CREATED || isAggregation();
    }

    public boolean isAggregation() {
        return switch (this) {
            case AGGREGATED_SUM, AGGREGATED_AVERAGE, AGGREGATED_COUNT, AGGREGATED_FIRST, AGGREGATED_LAST -> true;
            default -> false;
        };
    }

    public boolean isError() {
        return this == EVALUATION_ERROR;
    }
}
