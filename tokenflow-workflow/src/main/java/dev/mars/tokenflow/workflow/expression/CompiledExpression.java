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
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed expression, ready to be evaluated any number of times.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class CompiledExpression {

    private final String source;
    private final Expression root;
    private final Set<String> referencedNames;

    CompiledExpression(String source, Expression root) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.root = Objects.requireNonNull(root, "Root cannot be null");
        Set<String> names = new LinkedHashSet<>();
        root.collectNames(names);
        this.referencedNames = Collections.unmodifiableSet(names);
    }

    /**
     * @throws EvaluationException if a name or field is missing or operand types do not fit
     */
    public Object evaluate(Bindings bindings) {
        return root.evaluate(bindings);
    }

    public boolean test(Bindings bindings) {
        return Values.isTruthy(evaluate(bindings));
    }

    /**
     * Root names read by the expression, in order of first appearance.
     */
    public Set<String> getReferencedNames() {
        return referencedNames;
    }

    public String getSource() {
        return source;
    }

    Expression getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return source;
    }
}
