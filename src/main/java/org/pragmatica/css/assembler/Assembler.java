package org.pragmatica.css.assembler;

import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;

import java.math.BigDecimal;
import java.util.List;

/**
 * Serializes a compiled tree into compact CSS text, one rule or at-rule per line.
 */
public final class Assembler {
    private Assembler() {}

    /**
     * Render a compiled stylesheet.
     */
    public static String assemble(Node root) {
        var sb = new StringBuilder();
        for (var child : root.children()) {
            statement(sb, child);
        }
        return sb.toString();
    }

    /**
     * Render a token sequence as source text, leading and trailing whitespace removed.
     */
    public static String text(List<Node> nodes) {
        var sb = new StringBuilder();
        int start = 0;
        int end = nodes.size();
        while (start < end && nodes.get(start).is(NodeKind.WHITESPACE)) {
            start++;
        }
        while (end > start && nodes.get(end - 1).is(NodeKind.WHITESPACE)) {
            end--;
        }
        for (int i = start; i < end; i++) {
            token(sb, nodes.get(i));
        }
        return sb.toString();
    }

    /**
     * Render a single node as source text.
     */
    public static String text(Node node) {
        var sb = new StringBuilder();
        token(sb, node);
        return sb.toString();
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value)
                         .stripTrailingZeros()
                         .toPlainString();
    }

    private static void statement(StringBuilder sb, Node n) {
        switch (n.kind()) {
            case COMMENT -> sb.append("/* ").append(n.string()).append(" */\n");
            case COMPONENT_VALUE -> {
                rule(sb, n);
                sb.append('\n');
            }
            case AT_KEYWORD -> {
                atRule(sb, n);
                sb.append('\n');
            }
            case DECLARATION -> {
                declaration(sb, n);
                sb.append(";\n");
            }
            default -> {
                token(sb, n);
                sb.append('\n');
            }
        }
    }

    private static void rule(StringBuilder sb, Node rule) {
        var selector = rule.children().subList(0, rule.size() - 1);
        sb.append(text(selector));
        block(sb, rule.lastChild());
    }

    private static void atRule(StringBuilder sb, Node n) {
        sb.append('@').append(n.string());
        if (n.isEmpty()) {
            sb.append(';');
            return;
        }
        var last = n.lastChild();
        var prelude = last.is(NodeKind.OPEN_CURLYBRACKET) || last.is(NodeKind.SEMICOLON)
                      ? n.children().subList(0, n.size() - 1)
                      : n.children();
        var preludeText = text(prelude);
        if (!preludeText.isEmpty()) {
            sb.append(' ').append(preludeText);
        }
        if (last.is(NodeKind.OPEN_CURLYBRACKET)) {
            block(sb, last);
        } else {
            sb.append(';');
        }
    }

    private static void block(StringBuilder sb, Node block) {
        sb.append('{');
        boolean first = true;
        for (var item : block.children()) {
            switch (item.kind()) {
                case DECLARATION -> {
                    if (!first) {
                        sb.append(';');
                    }
                    declaration(sb, item);
                    first = false;
                }
                case COMPONENT_VALUE -> {
                    rule(sb, item);
                    first = true;
                }
                case AT_KEYWORD -> {
                    atRule(sb, item);
                    first = true;
                }
                case COMMENT -> sb.append("/* ").append(item.string()).append(" */");
                case WHITESPACE -> {}
                default -> token(sb, item);
            }
        }
        sb.append('}');
    }

    private static void declaration(StringBuilder sb, Node declaration) {
        sb.append(declaration.string()).append(':');
        for (var child : declaration.children()) {
            if (child.is(NodeKind.EXCLAMATION)) {
                sb.append('!').append(child.string());
            } else {
                sb.append(text(child.children()));
            }
        }
    }

    private static void token(StringBuilder sb, Node n) {
        switch (n.kind()) {
            case EOF_TOKEN, CDO, CDC -> {}
            case WHITESPACE -> sb.append(' ');
            case COMMENT -> sb.append("/* ").append(n.string()).append(" */");
            case IDENTIFIER, DELIMITER -> sb.append(n.string());
            case AT_KEYWORD -> atRule(sb, n);
            case STRING -> string(sb, n.string());
            case NUMBER -> sb.append(formatNumber(n.number())).append(n.string());
            case HASH -> sb.append('#').append(n.string());
            case URL -> sb.append("url(").append(n.string()).append(')');
            case VARIABLE -> sb.append('$').append(n.string());
            case COLON -> sb.append(':');
            case SEMICOLON -> sb.append(';');
            case COMMA -> sb.append(',');
            case EXCLAMATION -> sb.append('!').append("!".equals(n.string()) ? "" : n.string());
            case OPEN_CURLYBRACKET -> enclose(sb, n, "{", "}");
            case OPEN_SQUAREBRACKET -> enclose(sb, n, "[", "]");
            case OPEN_PARENTHESIS -> enclose(sb, n, "(", ")");
            case FUNCTION -> enclose(sb, n, n.string() + "(", ")");
            case CLOSE_CURLYBRACKET -> sb.append('}');
            case CLOSE_SQUAREBRACKET -> sb.append(']');
            case CLOSE_PARENTHESIS -> sb.append(')');
            case LIST -> {
                for (var child : n.children()) {
                    token(sb, child);
                }
            }
            case COMPONENT_VALUE -> rule(sb, n);
            case DECLARATION -> declaration(sb, n);
            case VARIABLE_DECLARATION -> {
                sb.append('$').append(n.string()).append(':');
                for (var child : n.children()) {
                    token(sb, child);
                }
            }
        }
    }

    private static void enclose(StringBuilder sb, Node n, String open, String close) {
        sb.append(open);
        for (var child : n.children()) {
            token(sb, child);
        }
        sb.append(close);
    }

    private static void string(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\a ");
                default -> sb.append(c);
            }
        }
        sb.append('"');
    }
}
