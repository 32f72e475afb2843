package org.pragmatica.css.compiler;

import org.pragmatica.css.assembler.Assembler;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates the conditions of {@code @if} and {@code @else if}.
 *
 * <pre>
 * or             := and ('or' and)*
 * and            := not ('and' not)*
 * not            := 'not' not | comparison
 * comparison     := additive (('=' | '==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)?
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/' | '%') unary)*
 * unary          := '-' unary | primary
 * primary        := number | string | identifier | hash | '(' or ')'
 * </pre>
 *
 * Variables are expected to be substituted before evaluation.
 */
final class ExpressionEvaluator {

    sealed interface Value {}

    record Num(double value, String unit) implements Value {}

    record Str(String value) implements Value {}

    record Bool(boolean value) implements Value {}

    record Null() implements Value {}

    /**
     * Raised while evaluating; carries the message reported to the diagnostics sink.
     */
    private static final class EvaluationError extends RuntimeException {
        EvaluationError(String message) {
            super(message, null, false, false);
        }
    }

    private final List<Node> tokens;
    private int pos;

    private ExpressionEvaluator(List<Node> tokens) {
        this.tokens = tokens;
    }

    /**
     * Evaluate an expression; problems are reported and yield an empty result.
     */
    static Optional<Value> evaluate(List<Node> tokens, Position position, Diagnostics diagnostics) {
        var significant = new ArrayList<Node>();
        for (var token : tokens) {
            if (!token.is(NodeKind.WHITESPACE)) {
                significant.add(token);
            }
        }
        if (significant.isEmpty()) {
            diagnostics.error(position, "an empty expression cannot be evaluated.");
            return Optional.empty();
        }
        var evaluator = new ExpressionEvaluator(significant);
        try {
            var value = evaluator.or();
            if (evaluator.pos < significant.size()) {
                throw new EvaluationError("unexpected " + describe(significant.get(evaluator.pos)) + " in expression.");
            }
            return Optional.of(value);
        } catch (EvaluationError e) {
            diagnostics.error(position, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Truthiness: false, null, zero and the empty string are false.
     */
    static boolean isTrue(Value value) {
        if (value instanceof Bool bool) {
            return bool.value();
        }
        if (value instanceof Num num) {
            return num.value() != 0;
        }
        if (value instanceof Str str) {
            return !str.value().isEmpty();
        }
        return false;
    }

    private Value or() {
        var left = and();
        while (isKeyword("or")) {
            pos++;
            var right = and();
            left = new Bool(isTrue(left) || isTrue(right));
        }
        return left;
    }

    private Value and() {
        var left = not();
        while (isKeyword("and")) {
            pos++;
            var right = not();
            left = new Bool(isTrue(left) && isTrue(right));
        }
        return left;
    }

    private Value not() {
        if (isKeyword("not")) {
            pos++;
            return new Bool(!isTrue(not()));
        }
        return comparison();
    }

    private Value comparison() {
        var left = additive();
        var op = delimiter().orElse("");
        switch (op) {
            case "=", "==", "!=", "<", "<=", ">", ">=" -> pos++;
            default -> {
                return left;
            }
        }
        var right = additive();
        return new Bool(switch (op) {
            case "=", "==" -> equal(left, right);
            case "!=" -> !equal(left, right);
            case "<" -> compare(left, right, op) < 0;
            case "<=" -> compare(left, right, op) <= 0;
            case ">" -> compare(left, right, op) > 0;
            default -> compare(left, right, op) >= 0;
        });
    }

    private Value additive() {
        var left = multiplicative();
        for (;;) {
            var op = delimiter();
            if (op.isEmpty() || !(op.get().equals("+") || op.get().equals("-"))) {
                return left;
            }
            pos++;
            left = arithmetic(left, multiplicative(), op.get());
        }
    }

    private Value multiplicative() {
        var left = unary();
        for (;;) {
            var op = delimiter();
            if (op.isEmpty() || !(op.get().equals("*") || op.get().equals("/") || op.get().equals("%"))) {
                return left;
            }
            pos++;
            left = arithmetic(left, unary(), op.get());
        }
    }

    private Value unary() {
        if (delimiter().filter("-"::equals).isPresent()) {
            pos++;
            var operand = unary();
            if (operand instanceof Num num) {
                return new Num(-num.value(), num.unit());
            }
            throw new EvaluationError("unary '-' expects a number.");
        }
        return primary();
    }

    private Value primary() {
        if (pos >= tokens.size()) {
            throw new EvaluationError("unexpected end of expression.");
        }
        var token = tokens.get(pos++);
        switch (token.kind()) {
            case NUMBER -> {
                return new Num(token.number(), token.string());
            }
            case STRING -> {
                return new Str(token.string());
            }
            case HASH -> {
                return new Str("#" + token.string());
            }
            case IDENTIFIER -> {
                return switch (token.string()) {
                    case "true" -> new Bool(true);
                    case "false" -> new Bool(false);
                    case "null" -> new Null();
                    default -> new Str(token.string());
                };
            }
            case OPEN_PARENTHESIS -> {
                return evaluateNested(token);
            }
            default -> throw new EvaluationError("unexpected " + describe(token) + " in expression.");
        }
    }

    private Value evaluateNested(Node parenthesis) {
        var inner = new ArrayList<Node>();
        for (var child : parenthesis.children()) {
            if (!child.is(NodeKind.WHITESPACE)) {
                inner.add(child);
            }
        }
        if (inner.isEmpty()) {
            throw new EvaluationError("empty parenthesis in expression.");
        }
        var nested = new ExpressionEvaluator(inner);
        var value = nested.or();
        if (nested.pos < inner.size()) {
            throw new EvaluationError("unexpected " + describe(inner.get(nested.pos)) + " in expression.");
        }
        return value;
    }

    private Value arithmetic(Value left, Value right, String op) {
        if (op.equals("+") && left instanceof Str l && right instanceof Str r) {
            return new Str(l.value() + r.value());
        }
        if (!(left instanceof Num l) || !(right instanceof Num r)) {
            throw new EvaluationError("operator '" + op + "' expects numbers.");
        }
        var unit = l.unit().isEmpty() ? r.unit() : l.unit();
        if ((op.equals("+") || op.equals("-")) && !compatible(l, r)) {
            throw new EvaluationError("incompatible units \"" + l.unit() + "\" and \"" + r.unit() + "\".");
        }
        return switch (op) {
            case "+" -> new Num(l.value() + r.value(), unit);
            case "-" -> new Num(l.value() - r.value(), unit);
            case "*" -> new Num(l.value() * r.value(), unit);
            case "/" -> {
                if (r.value() == 0) {
                    throw new EvaluationError("division by zero.");
                }
                yield new Num(l.value() / r.value(), l.unit().equals(r.unit()) ? "" : unit);
            }
            default -> {
                if (r.value() == 0) {
                    throw new EvaluationError("modulo by zero.");
                }
                yield new Num(l.value() % r.value(), unit);
            }
        };
    }

    private static boolean equal(Value left, Value right) {
        if (left instanceof Num l && right instanceof Num r) {
            return compatible(l, r) && l.value() == r.value();
        }
        return left.equals(right);
    }

    private int compare(Value left, Value right, String op) {
        if (left instanceof Num l && right instanceof Num r) {
            if (!compatible(l, r)) {
                throw new EvaluationError("incompatible units \"" + l.unit() + "\" and \"" + r.unit() + "\".");
            }
            return Double.compare(l.value(), r.value());
        }
        if (left instanceof Str l && right instanceof Str r) {
            return l.value().compareTo(r.value());
        }
        throw new EvaluationError("operator '" + op + "' expects two numbers or two strings.");
    }

    private static boolean compatible(Num left, Num right) {
        return left.unit().isEmpty() || right.unit().isEmpty() || left.unit().equals(right.unit());
    }

    private boolean isKeyword(String keyword) {
        return pos < tokens.size()
               && tokens.get(pos).is(NodeKind.IDENTIFIER)
               && tokens.get(pos).string().equals(keyword);
    }

    private Optional<String> delimiter() {
        if (pos < tokens.size() && tokens.get(pos).is(NodeKind.DELIMITER)) {
            return Optional.of(tokens.get(pos).string());
        }
        return Optional.empty();
    }

    private static String describe(Node token) {
        var text = Assembler.text(token);
        return text.isEmpty()
               ? token.kind().display()
               : "\"" + text + "\"";
    }
}
