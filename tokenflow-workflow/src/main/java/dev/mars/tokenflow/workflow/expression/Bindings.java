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

package dev.mars.tokenflow.workflow.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named values an expression is evaluated against. Names may be bound to null.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class Bindings {

    private final Map<String, Object> values;

    private Bindings(Map<String, Object> values) {
        this.values = values;
    }

    public static Bindings of(Map<String, ?> values) {
        return new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object lookup(String name) {
        if (!values.containsKey(name)) {
            throw new EvaluationException("Unknown name '" + name + "'");
        }
        return values.get(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder bind(String name, Object value) {
            values.put(name, value);
            return this;
        }

        public Bindings build() {
            return new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
