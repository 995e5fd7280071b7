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

import dev.mars.tokenflow.workflow.expression.Expression.BinaryOperator;
import dev.mars.tokenflow.workflow.expression.Expression.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formulas and conditions.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * conditional    := or ( '?' conditional ':' conditional )?
 * or             := and ( '||' and )*
 * and            := equality ( '&amp;&amp;' equality )*
 * equality       := comparison ( ( '==' | '!=' | '===' | '!==' ) comparison )*
 * comparison     := additive ( ( '&lt;' | '&lt;=' | '&gt;' | '&gt;=' ) additive )*
 * additive       := multiplicative ( ( '+' | '-' ) multiplicative )*
 * multiplicative := unary ( ( '*' | '/' | '%' ) unary )*
 * unary          := ( '!' | '-' ) unary | postfix
 * postfix        := primary ( '.' identifier )*
 * primary        := number | string | 'true' | 'false' | 'null' | identifier | '(' conditional ')'
 * </pre>
 * {@code ===} and {@code !==} mean the same as {@code ==} and {@code !=}; there is no type coercion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class ExpressionParser {

    private enum Kind { NUMBER, STRING, IDENTIFIER, OPERATOR, END }

    private record Lexeme(Kind kind, String text, int position) {
    }

    private static final String[] OPERATORS = {
            "===", "!==", "==", "!=", "<=", ">=", "&&", "||",
            "<", ">", "+", "-", "*", "/", "%", "!", "?", ":", ".", "(", ")"
    };

    private final String source;
    private final List<Lexeme> lexemes;
    private int index;

    private ExpressionParser(String source, List<Lexeme> lexemes) {
        this.source = source;
        this.lexemes = lexemes;
    }

    public static CompiledExpression parse(String source) throws ExpressionParseException {
        if (source == null || source.isBlank()) {
            throw new ExpressionParseException(source == null ? "" : source, 0, "Expression is empty");
        }
        ExpressionParser parser = new ExpressionParser(source, tokenize(source));
        Expression root = parser.conditional();
        Lexeme trailing = parser.peek();
        if (trailing.kind() != Kind.END) {
            throw new ExpressionParseException(source, trailing.position(), "Unexpected '" + trailing.text() + "'");
        }
        return new CompiledExpression(source, root);
    }

    private Expression conditional() throws ExpressionParseException {
        Expression test = or();
        if (accept("?")) {
            Expression whenTrue = conditional();
            expect(":");
            Expression whenFalse = conditional();
            return new Expression.Conditional(test, whenTrue, whenFalse);
        }
        return test;
    }

    private Expression or() throws ExpressionParseException {
        Expression left = and();
        while (accept("||")) {
            left = new Expression.Binary(BinaryOperator.OR, left, and());
        }
        return left;
    }

    private Expression and() throws ExpressionParseException {
        Expression left = equality();
        while (accept("&&")) {
            left = new Expression.Binary(BinaryOperator.AND, left, equality());
        }
        return left;
    }

    private Expression equality() throws ExpressionParseException {
        Expression left = comparison();
        while (true) {
            if (accept("==") || accept("===")) {
                left = new Expression.Binary(BinaryOperator.EQUAL, left, comparison());
            } else if (accept("!=") || accept("!==")) {
                left = new Expression.Binary(BinaryOperator.NOT_EQUAL, left, comparison());
            } else {
                return left;
            }
        }
    }

    private Expression comparison() throws ExpressionParseException {
        Expression left = additive();
        while (true) {
            if (accept("<=")) {
                left = new Expression.Binary(BinaryOperator.LESS_OR_EQUAL, left, additive());
            } else if (accept(">=")) {
                left = new Expression.Binary(BinaryOperator.GREATER_OR_EQUAL, left, additive());
            } else if (accept("<")) {
                left = new Expression.Binary(BinaryOperator.LESS, left, additive());
            } else if (accept(">")) {
                left = new Expression.Binary(BinaryOperator.GREATER, left, additive());
            } else {
                return left;
            }
        }
    }

    private Expression additive() throws ExpressionParseException {
        Expression left = multiplicative();
        while (true) {
            if (accept("+")) {
                left = new Expression.Binary(BinaryOperator.ADD, left, multiplicative());
            } else if (accept("-")) {
                left = new Expression.Binary(BinaryOperator.SUBTRACT, left, multiplicative());
            } else {
                return left;
            }
        }
    }

    private Expression multiplicative() throws ExpressionParseException {
        Expression left = unary();
        while (true) {
            if (accept("*")) {
                left = new Expression.Binary(BinaryOperator.MULTIPLY, left, unary());
            } else if (accept("/")) {
                left = new Expression.Binary(BinaryOperator.DIVIDE, left, unary());
            } else if (accept("%")) {
                left = new Expression.Binary(BinaryOperator.REMAINDER, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expression unary() throws ExpressionParseException {
        if (accept("!")) {
            return new Expression.Unary(UnaryOperator.NOT, unary());
        }
        if (accept("-")) {
            return new Expression.Unary(UnaryOperator.NEGATE, unary());
        }
        return postfix();
    }

    private Expression postfix() throws ExpressionParseException {
        Expression target = primary();
        while (accept(".")) {
            Lexeme field = next();
            if (field.kind() != Kind.IDENTIFIER) {
                throw new ExpressionParseException(source, field.position(), "Expected field name after '.'");
            }
            target = new Expression.FieldAccess(target, field.text());
        }
        return target;
    }

    private Expression primary() throws ExpressionParseException {
        Lexeme lexeme = next();
        switch (lexeme.kind()) {
            case NUMBER:
                return new Expression.Literal(parseNumber(lexeme));
            case STRING:
                return new Expression.Literal(lexeme.text());
            case IDENTIFIER:
                switch (lexeme.text()) {
                    case "true":
                        return new Expression.Literal(Boolean.TRUE);
                    case "false":
                        return new Expression.Literal(Boolean.FALSE);
                    case "null":
                        return new Expression.Literal(null);
                    default:
                        return new Expression.Name(lexeme.text());
                }
            case OPERATOR:
                if (lexeme.text().equals("(")) {
                    Expression inner = conditional();
                    expect(")");
                    return inner;
                }
                throw new ExpressionParseException(source, lexeme.position(), "Unexpected '" + lexeme.text() + "'");
            default:
                throw new ExpressionParseException(source, lexeme.position(), "Unexpected end of expression");
        }
    }

    private Object parseNumber(Lexeme lexeme) throws ExpressionParseException {
        String text = lexeme.text();
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ExpressionParseException(source, lexeme.position(), "Invalid number '" + text + "'");
        }
    }

    private Lexeme peek() {
        return lexemes.get(index);
    }

    private Lexeme next() {
        Lexeme lexeme = lexemes.get(index);
        if (lexeme.kind() != Kind.END) {
            index++;
        }
        return lexeme;
    }

    private boolean accept(String operator) {
        Lexeme lexeme = peek();
        if (lexeme.kind() == Kind.OPERATOR && lexeme.text().equals(operator)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(String operator) throws ExpressionParseException {
        if (!accept(operator)) {
            Lexeme found = peek();
            String seen = found.kind() == Kind.END ? "end of expression" : "'" + found.text() + "'";
            throw new ExpressionParseException(source, found.position(), "Expected '" + operator + "' but found " + seen);
        }
    }

    private static List<Lexeme> tokenize(String source) throws ExpressionParseException {
        List<Lexeme> result = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                int start = i;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
                    i++;
                    if (i < source.length() && (source.charAt(i) == '+' || source.charAt(i) == '-')) {
                        i++;
                    }
                    while (i < source.length() && Character.isDigit(source.charAt(i))) {
                        i++;
                    }
                }
                result.add(new Lexeme(Kind.NUMBER, source.substring(start, i), start));
            } else if (Character.isJavaIdentifierStart(c)) {
                int start = i;
                while (i < source.length() && Character.isJavaIdentifierPart(source.charAt(i))) {
                    i++;
                }
                result.add(new Lexeme(Kind.IDENTIFIER, source.substring(start, i), start));
            } else if (c == '"' || c == '\'') {
                i = readString(source, i, result);
            } else {
                String operator = matchOperator(source, i);
                if (operator == null) {
                    throw new ExpressionParseException(source, i, "Unexpected character '" + c + "'");
                }
                result.add(new Lexeme(Kind.OPERATOR, operator, i));
                i += operator.length();
            }
        }
        result.add(new Lexeme(Kind.END, "", source.length()));
        return result;
    }

    private static int readString(String source, int start, List<Lexeme> result) throws ExpressionParseException {
        char quote = source.charAt(start);
        StringBuilder text = new StringBuilder();
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == quote) {
                result.add(new Lexeme(Kind.STRING, text.toString(), start));
                return i + 1;
            }
            if (c == '\\' && i + 1 < source.length()) {
                char escaped = source.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    default -> text.append(escaped);
                }
                i += 2;
            } else {
                text.append(c);
                i++;
            }
        }
        throw new ExpressionParseException(source, start, "Unterminated string literal");
    }

    private static String matchOperator(String source, int position) {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                return operator;
            }
        }
        return null;
    }
}
