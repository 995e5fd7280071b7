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

import dev.mars.tokenflow.core.ActivityAction;

import java.util.Locale;
import java.util.Optional;

/**
 * Ways a Queue folds a window of buffered values into one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public enum AggregationMethod {
    SUM(ActivityAction.AGGREGATED_SUM),
    AVERAGE(ActivityAction.AGGREGATED_AVERAGE),
    COUNT(ActivityAction.AGGREGATED_COUNT),
    FIRST(ActivityAction.AGGREGATED_FIRST),
    LAST(ActivityAction.AGGREGATED_LAST);

    private final ActivityAction action;

    AggregationMethod(ActivityAction action) {
        this.action = action;
    }

    public ActivityAction getAction() {
        return action;
    }

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the method needs numeric values.
     */
    public boolean isNumeric() {
        return this == SUM || this == AVERAGE;
    }

    public static Optional<AggregationMethod> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (AggregationMethod method : values()) {
            if (method.getWireName().equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
