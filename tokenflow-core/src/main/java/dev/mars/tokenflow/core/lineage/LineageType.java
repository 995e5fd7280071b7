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

package dev.mars.tokenflow.core.lineage;

import java.util.Locale;

/**
 * How a token came into existence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public enum LineageType {
    SOURCE,
    TRANSFORMED,
    AGGREGATED,
    SPLIT,
    CONSUMED;

    /**
     * Split and consumed are only assigned when the creating action says so; otherwise the
     * parent count decides.
     */
    public static LineageType classify(String action, int parentCount) {
        if (action != null) {
            String normalized = action.toLowerCase(Locale.ROOT);
            if (normalized.contains("split")) {
                return SPLIT;
            }
            if (normalized.contains("consumed")) {
                return CONSUMED;
            }
        }
        if (parentCount == 0) {
            return SOURCE;
        }
        return parentCount == 1 ? TRANSFORMED : AGGREGATED;
    }
}
