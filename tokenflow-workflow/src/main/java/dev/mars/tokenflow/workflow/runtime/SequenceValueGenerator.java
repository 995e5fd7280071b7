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

import dev.mars.tokenflow.workflow.expression.Values;

import java.util.List;
import java.util.Objects;

/**
 * Replays a fixed list of values in order, starting over when the list runs out.
 * The bounds passed to {@link #next(double, double)} are ignored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class SequenceValueGenerator implements ValueGenerator {

    private final List<Object> values;
    private long drawCount;

    public SequenceValueGenerator(List<?> values) {
        Objects.requireNonNull(values, "Values cannot be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Sequence must contain at least one value");
        }
        this.values = List.copyOf(values);
    }

    public static SequenceValueGenerator of(Object... values) {
        return new SequenceValueGenerator(List.of(values));
    }

    @Override
    public Object next(double min, double max) {
        Object value = values.get((int) (drawCount % values.size()));
        drawCount++;
        return Values.normalize(value);
    }

    @Override
    public long getDrawCount() {
        return drawCount;
    }

    @Override
    public void restore(long drawCount) {
        this.drawCount = drawCount;
    }

    @Override
    public void reset() {
        drawCount = 0;
    }
}
