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

import java.util.Map;
import java.util.Set;

/**
 * Syntax tree of the restricted expression language. Evaluation is pure: no assignment, no calls,
 * no loops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public sealed interface Expression {

    Object evaluate(Bindings bindings);

    /**
     * Adds the root names this expression reads, e.g. {@code num} for {@code num.value + 1}.
     */
    void collectNames(Set<String> names);

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            return value;
        }

        @Override
        public void collectNames(Set<String> names) {
        }
    }

    record Name(String name) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            return Values.normalize(bindings.lookup(name));
        }

        @Override
        public void collectNames(Set<String> names) {
            names.add(name);
        }
    }

    record FieldAccess(Expression target, String field) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            Object owner = target.evaluate(bindings);
            if (owner == null) {
                throw new EvaluationException("Cannot read field '" + field + "' of null");
            }
            if (!(owner instanceof Map)) {
                throw new EvaluationException("Cannot read field '" + field + "' of " + Values.typeName(owner));
            }
            Map<?, ?> map = (Map<?, ?>) owner;
            if (!map.containsKey(field)) {
                throw new EvaluationException("Field '" + field + "' not found");
            }
            return Values.normalize(map.get(field));
        }

        @Override
        public void collectNames(Set<String> names) {
            target.collectNames(names);
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            Object value = operand.evaluate(bindings);
            return switch (operator) {
                case NOT -> !Values.isTruthy(value);
                case NEGATE -> Values.negate(value);
            };
        }

        @Override
        public void collectNames(Set<String> names) {
            operand.collectNames(names);
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            if (operator == BinaryOperator.AND) {
                return Values.isTruthy(left.evaluate(bindings)) && Values.isTruthy(right.evaluate(bindings));
            }
            if (operator == BinaryOperator.OR) {
                return Values.isTruthy(left.evaluate(bindings)) || Values.isTruthy(right.evaluate(bindings));
            }
            Object l = left.evaluate(bindings);
            Object r = right.evaluate(bindings);
            return switch (operator) {
                case ADD -> Values.add(l, r);
                case SUBTRACT -> Values.subtract(l, r);
                case MULTIPLY -> Values.multiply(l, r);
                case DIVIDE -> Values.divide(l, r);
                case REMAINDER -> Values.remainder(l, r);
                case EQUAL -> Values.isEqual(l, r);
                case NOT_EQUAL -> !Values.isEqual(l, r);
                case LESS -> Values.compare(l, r, operator.getSymbol()) < 0;
                case LESS_OR_EQUAL -> Values.compare(l, r, operator.getSymbol()) <= 0;
                case GREATER -> Values.compare(l, r, operator.getSymbol()) > 0;
                case GREATER_OR_EQUAL -> Values.compare(l, r, operator.getSymbol()) >= 0;
                case AND, OR -> throw new IllegalStateException("Short-circuit operator " + operator);
            };
        }

        @Override
        public void collectNames(Set<String> names) {
            left.collectNames(names);
            right.collectNames(names);
        }
    }

    record Conditional(Expression test, Expression whenTrue, Expression whenFalse) implements Expression {
        @Override
        public Object evaluate(Bindings bindings) {
            return Values.isTruthy(test.evaluate(bindings))
                    ? whenTrue.evaluate(bindings)
                    : whenFalse.evaluate(bindings);
        }

        @Override
        public void collectNames(Set<String> names) {
            test.collectNames(names);
            whenTrue.collectNames(names);
            whenFalse.collectNames(names);
        }
    }

    enum UnaryOperator {
        NOT, NEGATE
    }

    enum BinaryOperator {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), REMAINDER("%"),
        EQUAL("=="), NOT_EQUAL("!="),
        LESS("<"), LESS_OR_EQUAL("<="), GREATER(">"), GREATER_OR_EQUAL(">="),
        AND("&&"), OR("||");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
