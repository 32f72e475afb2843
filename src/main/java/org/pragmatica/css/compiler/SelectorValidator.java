package org.pragmatica.css.compiler;

import org.pragmatica.css.assembler.Assembler;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Normalizes and checks selectors against the supported subset.
 *
 * <pre>
 * selector-list := selector (',' selector)*
 * selector      := compound (combinator compound)*
 * combinator    := whitespace | '&gt;' | '+' | '~'
 * compound      := simple-term+
 * simple-term   := identifier | '*' | '.' identifier | hash
 *                | '[' attribute ']' | ':' pseudo | '::' pseudo
 * </pre>
 */
final class SelectorValidator {
    private static final Set<String> COMBINATORS = Set.of(">", "+", "~");
    private static final Set<String> ATTRIBUTE_OPERATORS = Set.of("=", "~=", "|=", "^=", "$=", "*=");
    private static final Set<String> SELECTOR_FUNCTIONS = Set.of("not", "is", "where", "has", "matches");

    private final Diagnostics diagnostics;
    private final Position position;

    private SelectorValidator(Diagnostics diagnostics, Position position) {
        this.diagnostics = diagnostics;
        this.position = position;
    }

    /**
     * Check a normalized, flattened selector list. Problems are reported and yield {@code false}.
     */
    static boolean parseSelector(List<Node> selector, Position position, Diagnostics diagnostics) {
        return new SelectorValidator(diagnostics, position).selectorList(selector);
    }

    /**
     * Trim whitespace, collapse runs of whitespace and drop whitespace around commas and combinators.
     */
    static List<Node> normalize(List<Node> tokens) {
        var result = new ArrayList<Node>();
        for (var token : tokens) {
            if (token.is(NodeKind.WHITESPACE)) {
                if (!result.isEmpty() && !result.get(result.size() - 1).is(NodeKind.WHITESPACE)
                    && !isSeparator(result.get(result.size() - 1))) {
                    result.add(token);
                }
                continue;
            }
            if (isSeparator(token) && !result.isEmpty() && result.get(result.size() - 1).is(NodeKind.WHITESPACE)) {
                result.remove(result.size() - 1);
            }
            result.add(token);
        }
        if (!result.isEmpty() && result.get(result.size() - 1).is(NodeKind.WHITESPACE)) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    /**
     * Split a normalized selector list on its top level commas.
     */
    static List<List<Node>> split(List<Node> selectorList) {
        var result = new ArrayList<List<Node>>();
        var current = new ArrayList<Node>();
        for (var token : selectorList) {
            if (token.is(NodeKind.COMMA)) {
                result.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        result.add(current);
        return result;
    }

    private static boolean isSeparator(Node token) {
        return token.is(NodeKind.COMMA)
               || (token.is(NodeKind.DELIMITER) && COMBINATORS.contains(token.string()));
    }

    private boolean selectorList(List<Node> tokens) {
        if (tokens.isEmpty()) {
            return fail("a qualified rule must have a selector.");
        }
        for (var selector : split(tokens)) {
            if (!selectorTerm(selector)) {
                return false;
            }
        }
        return true;
    }

    private boolean selectorTerm(List<Node> selector) {
        if (selector.isEmpty()) {
            return fail("a selector list cannot include an empty selector.");
        }
        int pos = 0;
        boolean expectCompound = true;
        while (pos < selector.size()) {
            var token = selector.get(pos);
            if (isCombinator(token)) {
                if (expectCompound) {
                    return fail("a combinator (" + Assembler.text(token) + ") must be preceded and followed by a selector.");
                }
                expectCompound = true;
                pos++;
                continue;
            }
            var end = pos;
            while (end < selector.size() && !isCombinator(selector.get(end))) {
                end++;
            }
            if (!selectorCompound(selector.subList(pos, end))) {
                return false;
            }
            expectCompound = false;
            pos = end;
        }
        if (expectCompound) {
            return fail("a selector cannot end with a combinator.");
        }
        return true;
    }

    private boolean selectorCompound(List<Node> compound) {
        int pos = 0;
        while (pos < compound.size()) {
            int next = selectorSimpleTerm(compound, pos);
            if (next < 0) {
                return false;
            }
            pos = next;
        }
        return true;
    }

    /**
     * Check one simple selector starting at {@code pos}; returns the position after it, or -1.
     */
    private int selectorSimpleTerm(List<Node> compound, int pos) {
        var token = compound.get(pos);
        switch (token.kind()) {
            case IDENTIFIER -> {
                if (pos != 0) {
                    fail("a type selector (" + token.string() + ") must come first in a compound selector.");
                    return -1;
                }
                return pos + 1;
            }
            case HASH -> {
                var name = token.string();
                if (name.isEmpty() || Character.isDigit(name.charAt(0))
                    || (name.startsWith("-") && name.length() > 1 && Character.isDigit(name.charAt(1)))) {
                    fail("\"#" + name + "\" is not a valid identifier for an ID selector.");
                    return -1;
                }
                return pos + 1;
            }
            case DELIMITER -> {
                return delimiterTerm(compound, pos);
            }
            case OPEN_SQUAREBRACKET -> {
                return selectorAttributeCheck(token)
                       ? pos + 1
                       : -1;
            }
            case COLON -> {
                return pseudoTerm(compound, pos);
            }
            default -> {
                fail("found unexpected " + describe(token) + " in selector.");
                return -1;
            }
        }
    }

    private int delimiterTerm(List<Node> compound, int pos) {
        var token = compound.get(pos);
        switch (token.string()) {
            case "*" -> {
                if (pos != 0) {
                    fail("the universal selector (*) must come first in a compound selector.");
                    return -1;
                }
                return pos + 1;
            }
            case "&" -> {
                fail("the parent reference (&) can only be used in a nested rule.");
                return -1;
            }
            case "." -> {
                if (pos + 1 >= compound.size() || !compound.get(pos + 1).is(NodeKind.IDENTIFIER)) {
                    fail("a class selector (.) must be followed by an identifier.");
                    return -1;
                }
                return pos + 2;
            }
            default -> {
                fail("found unexpected " + describe(token) + " in selector.");
                return -1;
            }
        }
    }

    private int pseudoTerm(List<Node> compound, int pos) {
        int next = pos + 1;
        boolean element = next < compound.size() && compound.get(next).is(NodeKind.COLON);
        if (element) {
            next++;
        }
        if (next >= compound.size()) {
            fail("a pseudo-class or pseudo-element must be named after the ':'.");
            return -1;
        }
        var name = compound.get(next);
        if (name.is(NodeKind.IDENTIFIER)) {
            return next + 1;
        }
        if (name.is(NodeKind.FUNCTION)) {
            if (!element && SELECTOR_FUNCTIONS.contains(name.string())) {
                var nested = normalize(name.children());
                if (!selectorList(nested)) {
                    return -1;
                }
            }
            return next + 1;
        }
        fail("a pseudo-class or pseudo-element must be named, found " + describe(name) + " instead.");
        return -1;
    }

    /**
     * Check the contents of an attribute selector: {@code [name]}, {@code [name op value]} or
     * {@code [name op value flag]}.
     */
    private boolean selectorAttributeCheck(Node attribute) {
        if (!attribute.isComplete()) {
            return fail("an attribute selector is missing its closing ']'.");
        }
        var parts = new ArrayList<Node>();
        for (var child : attribute.children()) {
            if (!child.is(NodeKind.WHITESPACE)) {
                parts.add(child);
            }
        }
        if (parts.isEmpty() || !parts.get(0).is(NodeKind.IDENTIFIER)) {
            return fail("an attribute selector expects to first find an identifier.");
        }
        if (parts.size() == 1) {
            return true;
        }
        var op = parts.get(1);
        if (!op.is(NodeKind.DELIMITER) || !ATTRIBUTE_OPERATORS.contains(op.string())) {
            return fail("expected attribute operator, found " + describe(op) + " instead.");
        }
        if (parts.size() == 2) {
            return fail("the attribute operator (" + op.string() + ") must be followed by a value.");
        }
        var value = parts.get(2);
        if (!value.is(NodeKind.IDENTIFIER) && !value.is(NodeKind.STRING) && !value.is(NodeKind.NUMBER)) {
            return fail("an attribute value must be an identifier, a string or a number, found "
                        + describe(value) + " instead.");
        }
        if (parts.size() == 3) {
            return true;
        }
        var flag = parts.get(3);
        if (parts.size() == 4 && flag.is(NodeKind.IDENTIFIER)
            && (flag.string().equalsIgnoreCase("i") || flag.string().equalsIgnoreCase("s"))) {
            return true;
        }
        return fail("found unexpected " + describe(flag) + " after the attribute value.");
    }

    private static boolean isCombinator(Node token) {
        return token.is(NodeKind.WHITESPACE)
               || (token.is(NodeKind.DELIMITER) && COMBINATORS.contains(token.string()));
    }

    private boolean fail(String message) {
        diagnostics.error(position, message);
        return false;
    }

    private static String describe(Node token) {
        var text = Assembler.text(token);
        return text.isEmpty() || token.kind().opensBlock()
               ? token.kind().display()
               : "\"" + text + "\"";
    }
}
