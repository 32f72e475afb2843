package org.pragmatica.css.compiler;

import org.junit.jupiter.api.Test;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.lexer.CssLexer;
import org.pragmatica.css.parser.Parser;
import org.pragmatica.css.tree.Position;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {
    private Diagnostics diagnostics;

    private Optional<ExpressionEvaluator.Value> evaluate(String expression) {
        diagnostics = new Diagnostics();
        var tokens = Parser.create(CssLexer.create(expression, "expr", diagnostics), diagnostics)
                           .componentValueList();
        return ExpressionEvaluator.evaluate(tokens.children(), Position.start("expr"), diagnostics);
    }

    private boolean holds(String expression) {
        var value = evaluate(expression);
        assertFalse(diagnostics.hasErrors(), diagnostics::format);
        return ExpressionEvaluator.isTrue(value.orElseThrow());
    }

    @Test
    void arithmeticAndComparison() {
        assertTrue(holds("1 + 2 == 3"));
        assertTrue(holds("2 * 3 - 1 = 5"));
        assertTrue(holds("10 / 4 == 2.5"));
        assertTrue(holds("7 % 4 != 2"));
        assertFalse(holds("3 < 2"));
    }

    @Test
    void unitsAreCarriedAndChecked() {
        assertTrue(holds("10px > 5px"));
        assertTrue(holds("2px * 3 == 6px"));
        assertEquals(new ExpressionEvaluator.Num(15, "px"), evaluate("10px + 5").orElseThrow());

        assertTrue(evaluate("1px + 1em").isEmpty());
        assertThat(diagnostics.diagnostics().get(0).message()).contains("incompatible units");
    }

    @Test
    void booleanOperators() {
        assertTrue(holds("not false and (1 < 2)"));
        assertTrue(holds("false or true"));
        assertFalse(holds("true and null"));
        assertTrue(holds("not (1 > 2 or 3 > 4)"));
    }

    @Test
    void strings_compareAndConcatenate() {
        assertTrue(holds("\"a\" + \"b\" == \"ab\""));
        assertTrue(holds("dark == \"dark\""));
        assertTrue(holds("\"abc\" < \"abd\""));
    }

    @Test
    void negation() {
        assertTrue(holds("- 3 < 0"));
        assertTrue(holds("-3 + 3 == 0"));
    }

    @Test
    void truthiness() {
        assertFalse(ExpressionEvaluator.isTrue(new ExpressionEvaluator.Num(0, "")));
        assertFalse(ExpressionEvaluator.isTrue(new ExpressionEvaluator.Str("")));
        assertFalse(ExpressionEvaluator.isTrue(new ExpressionEvaluator.Null()));
        assertTrue(ExpressionEvaluator.isTrue(new ExpressionEvaluator.Str("x")));
        assertTrue(ExpressionEvaluator.isTrue(new ExpressionEvaluator.Num(0.1, "em")));
    }

    @Test
    void malformedExpressions_areReported() {
        for (var expression : List.of("1 +", "1 / 0", "1 2", "\"a\" * 2", "-\"a\"")) {
            assertTrue(evaluate(expression).isEmpty(), expression);
            assertTrue(diagnostics.hasErrors(), expression);
        }
    }

    @Test
    void emptyExpression_isReported() {
        var result = ExpressionEvaluator.evaluate(List.of(), Position.start("expr"), diagnostics = new Diagnostics());

        assertTrue(result.isEmpty());
        assertEquals(1, diagnostics.errorCount());
    }
}
