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
import java.util.Objects;

/**
 * Value semantics shared by the expression evaluator and the node runtimes.
 * <p>
 * Integral numbers stay integral ({@link Long}) under {@code + - * %} and under exact division;
 * anything else becomes a {@link Double}. Strings concatenate with {@code +}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class Values {

    private Values() {
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    /**
     * Widens integral boxes to Long and Float to Double; other values are returned as they are.
     */
    public static Object normalize(Object value) {
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }

    public static boolean isEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (isIntegral(left) && isIntegral(right)) {
                return ((Number) left).longValue() == ((Number) right).longValue();
            }
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right, String operator) {
        if (left instanceof Number && right instanceof Number) {
            if (isIntegral(left) && isIntegral(right)) {
                return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
            }
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        throw new EvaluationException("Operator '" + operator + "' cannot compare "
                + typeName(left) + " with " + typeName(right));
    }

    public static Object add(Object left, Object right) {
        if (left instanceof String || right instanceof String) {
            return format(left) + format(right);
        }
        Number[] operands = numbers("+", left, right);
        if (isIntegral(operands[0]) && isIntegral(operands[1])) {
            try {
                return Math.addExact(operands[0].longValue(), operands[1].longValue());
            } catch (ArithmeticException overflow) {
                return operands[0].doubleValue() + operands[1].doubleValue();
            }
        }
        return operands[0].doubleValue() + operands[1].doubleValue();
    }

    public static Object subtract(Object left, Object right) {
        Number[] operands = numbers("-", left, right);
        if (isIntegral(operands[0]) && isIntegral(operands[1])) {
            try {
                return Math.subtractExact(operands[0].longValue(), operands[1].longValue());
            } catch (ArithmeticException overflow) {
                return operands[0].doubleValue() - operands[1].doubleValue();
            }
        }
        return operands[0].doubleValue() - operands[1].doubleValue();
    }

    public static Object multiply(Object left, Object right) {
        Number[] operands = numbers("*", left, right);
        if (isIntegral(operands[0]) && isIntegral(operands[1])) {
            try {
                return Math.multiplyExact(operands[0].longValue(), operands[1].longValue());
            } catch (ArithmeticException overflow) {
                return operands[0].doubleValue() * operands[1].doubleValue();
            }
        }
        return operands[0].doubleValue() * operands[1].doubleValue();
    }

    public static Object divide(Object left, Object right) {
        Number[] operands = numbers("/", left, right);
        if (operands[1].doubleValue() == 0) {
            throw new EvaluationException("Division by zero");
        }
        if (isIntegral(operands[0]) && isIntegral(operands[1])) {
            long dividend = operands[0].longValue();
            long divisor = operands[1].longValue();
            // MIN_VALUE / -1 does not fit in a long
            if (dividend % divisor == 0 && !(dividend == Long.MIN_VALUE && divisor == -1)) {
                return dividend / divisor;
            }
        }
        return operands[0].doubleValue() / operands[1].doubleValue();
    }

    public static Object remainder(Object left, Object right) {
        Number[] operands = numbers("%", left, right);
        if (operands[1].doubleValue() == 0) {
            throw new EvaluationException("Division by zero");
        }
        if (isIntegral(operands[0]) && isIntegral(operands[1])) {
            return operands[0].longValue() % operands[1].longValue();
        }
        return operands[0].doubleValue() % operands[1].doubleValue();
    }

    public static Object negate(Object operand) {
        if (isIntegral(operand)) {
            long value = ((Number) operand).longValue();
            try {
                return Math.negateExact(value);
            } catch (ArithmeticException overflow) {
                return -(double) value;
            }
        }
        if (operand instanceof Number) {
            return -((Number) operand).doubleValue();
        }
        throw new EvaluationException("Operator '-' expects a number but got " + typeName(operand));
    }

    /**
     * Text form of a value; integral doubles print without a fraction.
     */
    public static String format(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Map) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    private static Number[] numbers(String operator, Object left, Object right) {
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw new EvaluationException("Operator '" + operator + "' expects numbers but got "
                    + typeName(left) + " and " + typeName(right));
        }
        return new Number[]{(Number) left, (Number) right};
    }
}
