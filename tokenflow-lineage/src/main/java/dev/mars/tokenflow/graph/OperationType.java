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

package dev.mars.tokenflow.graph;

import dev.mars.tokenflow.core.ActivityAction;

/**
 * How a token in the graph came to exist.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-11
 * @version 1.0
 */
public enum OperationType {
    DATASOURCE_CREATION,
    TRANSFORMATION,
    AGGREGATION;

    public static OperationType of(ActivityAction action, int parentCount) {
        if (action.isAggregation()) {
            return AGGREGATION;
        }
        return parentCount == 0 ? DATASOURCE_CREATION : TRANSFORMATION;
    }
}
