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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing and evaluating formulas and conditions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
class ExpressionParserTest {

    private static Object eval(String source, Bindings bindings) throws ExpressionParseException {
        return ExpressionParser.parse(source).evaluate(bindings);
    }

    private static Object eval(String source) throws ExpressionParseException {
        return eval(source, Bindings.builder().build());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 + 2 * 3        | 7",
            "(1 + 2) * 3      | 9",
            "10 / 4           | 2.5",
            "10 / 5           | 2",
            "7 % 3            | 1",
            "-2 + 5           | 3",
            "1.5 * 2          | 3",
            "\"a\" + 1        | a1",
            "2 > 1 && 1 > 2   | false",
            "2 > 1 || 1 > 2   | true",
            "!(3 == 3)        | false",
            "3 === 3.0        | true",
            "\"x\" !== \"y\"  | true",
            "1 < 2 ? \"yes\" : \"no\" | yes"
    })
    void testArithmeticAndLogic(String source, String expected) throws ExpressionParseException {
        assertEquals(expected, Values.format(eval(source)));
    }

    @Test
    void testIntegralResultsStayLong() throws ExpressionParseException {
        assertEquals(6L, eval("2 * 3"));
        assertEquals(2L, eval("8 / 4"));
        assertEquals(2.5, eval("5 / 2"));
    }

    @Test
    void testNestedTernaryClassifiesValues() throws ExpressionParseException {
        CompiledExpression classifier = ExpressionParser.parse(
                "num.value <= 3 ? \"token_received\" : num.value <= 6 ? \"processing_complete\" : \"reset\"");

        assertEquals("token_received", classifier.evaluate(Bindings.of(Map.of("num", Map.of("value", 2)))));
        assertEquals("processing_complete", classifier.evaluate(Bindings.of(Map.of("num", Map.of("value", 5)))));
        assertEquals("reset", classifier.evaluate(Bindings.of(Map.of("num", Map.of("value", 9)))));
    }

    @Test
    void testFieldAccessOnNestedMaps() throws ExpressionParseException {
        Bindings bindings = Bindings.of(Map.of("x", Map.of("data", Map.of("value", 41))));

        assertEquals(42L, eval("x.data.value + 1", bindings));
    }

    @Test
    void testReferencedNamesExcludeFields() throws ExpressionParseException {
        CompiledExpression expression = ExpressionParser.parse("a.value + bValue * inputs.c.value");

        assertThat(expression.getReferencedNames()).containsExactlyInAnyOrder("a", "bValue", "inputs");
        assertEquals("a.value + bValue * inputs.c.value", expression.getSource());
    }

    @Test
    void testShortCircuitSkipsRightHandSide() throws ExpressionParseException {
        assertEquals(false, eval("false && missing.value"));
        assertEquals(true, eval("true || missing.value"));
    }

    @Test
    void testCompiledExpressionIsReusable() throws ExpressionParseException {
        CompiledExpression doubled = ExpressionParser.parse("v * 2");

        for (long v = 0; v < 5; v++) {
            assertEquals(v * 2, doubled.evaluate(Bindings.builder().bind("v", v).build()));
        }
    }

    @Test
    void testUnknownNameFailsAtEvaluation() throws ExpressionParseException {
        CompiledExpression expression = ExpressionParser.parse("missing.value * 2");

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> expression.evaluate(Bindings.builder().bind("x", 1).build()));
        assertEquals("Unknown name 'missing'", e.getMessage());
    }

    @Test
    void testFieldErrors() throws ExpressionParseException {
        Bindings bindings = Bindings.builder()
                .bind("n", null)
                .bind("s", "text")
                .bind("m", Map.of("a", 1))
                .build();

        assertEquals("Cannot read field 'x' of null",
                assertThrows(EvaluationException.class, () -> eval("n.x", bindings)).getMessage());
        assertEquals("Cannot read field 'x' of string",
                assertThrows(EvaluationException.class, () -> eval("s.x", bindings)).getMessage());
        assertEquals("Field 'x' not found",
                assertThrows(EvaluationException.class, () -> eval("m.x", bindings)).getMessage());
    }

    @Test
    void testDivisionByZero() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("1 / 0"));
        assertEquals("Division by zero", e.getMessage());
    }

    @Test
    void testStringEscapes() throws ExpressionParseException {
        assertEquals("it's", eval("'it\\'s'"));
        assertEquals("say \"hi\"", eval("\"say \\\"hi\\\"\""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "1 +", "(1 + 2", "a.", "1 2", "'open", "a # b", "? 1 : 2"})
    void testInvalidSyntaxIsRejected(String source) {
        assertThrows(ExpressionParseException.class, () -> ExpressionParser.parse(source));
    }

    @Test
    void testParseErrorReportsPosition() {
        ExpressionParseException e = assertThrows(ExpressionParseException.class,
                () -> ExpressionParser.parse("1 + * 2"));

        assertEquals(4, e.getPosition());
        assertEquals("1 + * 2", e.getExpression());
        assertThat(e.getMessage()).contains("position 4");
    }
}
