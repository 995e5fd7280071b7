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

package dev.mars.tokenflow.workflow.runtime;

/**
 * Supplies the values a DataSource emits.
 * <p>
 * Generators count their draws so a restored run can be repositioned to exactly where the
 * snapshot was taken.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public interface ValueGenerator {

    /**
     * Next value within {@code [min, max]}. Implementations may ignore the bounds.
     */
    Object next(double min, double max);

    long getDrawCount();

    /**
     * Repositions the generator as if {@code drawCount} values had been drawn since {@link #reset()}.
     */
    void restore(long drawCount);

    void reset();
}
