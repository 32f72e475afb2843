package org.pragmatica.css.lexer;

import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the extended CSS syntax.
 *
 * <p>Whitespace runs collapse into a single {@code WHITESPACE} token. Comments are dropped
 * unless they contain {@code @preserve}, in which case they become {@code COMMENT} tokens.
 */
public final class CssLexer implements TokenSource {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final Diagnostics diagnostics;
    private Position position;
    private int pos;

    private CssLexer(String input, String filename, Diagnostics diagnostics) {
        this.input = input;
        this.diagnostics = diagnostics;
        this.position = Position.start(filename);
        this.pos = 0;
    }

    public static CssLexer create(String input, String filename, Diagnostics diagnostics) {
        return new CssLexer(input, filename, diagnostics);
    }

    /**
     * Tokenize the whole input, the trailing end of input token included.
     */
    public static List<Node> tokenize(String input, String filename, Diagnostics diagnostics) {
        var lexer = create(input, filename, diagnostics);
        var tokens = new ArrayList<Node>();
        Node token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (!token.is(NodeKind.EOF_TOKEN));
        return tokens;
    }

    @Override
    public Node nextToken() {
        for (;;) {
            if (isAtEnd()) {
                return Node.of(NodeKind.EOF_TOKEN, position);
            }
            var start = position;
            char c = peek();
            if (isWhitespace(c)) {
                while (!isAtEnd() && isWhitespace(peek())) {
                    advance();
                }
                return Node.of(NodeKind.WHITESPACE, start);
            }
            if (c == '/' && peekAt(1) == '*') {
                var comment = scanComment(start);
                if (comment != null) {
                    return comment;
                }
                continue;
            }
            if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
                continue;
            }
            return scanToken(start, c);
        }
    }

    private Node scanToken(Position start, char c) {
        if (c == '"' || c == '\'') {
            return scanString(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1))) || ((c == '-' || c == '+') && startsNumber(1))) {
            return scanNumber(start);
        }
        if (c == '<' && input.startsWith("<!--", pos)) {
            skip(4);
            return Node.of(NodeKind.CDO, start);
        }
        if (c == '-' && input.startsWith("-->", pos)) {
            skip(3);
            return Node.of(NodeKind.CDC, start);
        }
        if (startsIdentifier(0)) {
            return scanIdentifierLike(start);
        }
        if (c == '@' && startsIdentifier(1)) {
            advance();
            return Node.token(NodeKind.AT_KEYWORD, start, scanName());
        }
        if (c == '$' && startsIdentifier(1)) {
            advance();
            return Node.token(NodeKind.VARIABLE, start, scanName());
        }
        if (c == '#' && isNameChar(peekAt(1))) {
            advance();
            return Node.token(NodeKind.HASH, start, scanName());
        }
        advance();
        return switch (c) {
            case ':' -> Node.of(NodeKind.COLON, start);
            case ';' -> Node.of(NodeKind.SEMICOLON, start);
            case ',' -> Node.of(NodeKind.COMMA, start);
            case '{' -> Node.of(NodeKind.OPEN_CURLYBRACKET, start);
            case '}' -> Node.of(NodeKind.CLOSE_CURLYBRACKET, start);
            case '[' -> Node.of(NodeKind.OPEN_SQUAREBRACKET, start);
            case ']' -> Node.of(NodeKind.CLOSE_SQUAREBRACKET, start);
            case '(' -> Node.of(NodeKind.OPEN_PARENTHESIS, start);
            case ')' -> Node.of(NodeKind.CLOSE_PARENTHESIS, start);
            case '!' -> {
                if (!isAtEnd() && peek() == '=') {
                    advance();
                    yield Node.token(NodeKind.DELIMITER, start, "!=");
                }
                yield Node.token(NodeKind.EXCLAMATION, start, "!");
            }
            case '~', '|', '^', '*', '$', '<', '>', '=' -> {
                if (!isAtEnd() && peek() == '=') {
                    advance();
                    yield Node.token(NodeKind.DELIMITER, start, c + "=");
                }
                yield Node.token(NodeKind.DELIMITER, start, String.valueOf(c));
            }
            default -> Node.token(NodeKind.DELIMITER, start, String.valueOf(c));
        };
    }

    private Node scanComment(Position start) {
        skip(2);
        int contentStart = pos;
        while (!isAtEnd() && !input.startsWith("*/", pos)) {
            advance();
        }
        var content = input.substring(contentStart, pos);
        if (isAtEnd()) {
            diagnostics.error(start, "unclosed C-like comment at the end of your input.");
        } else {
            skip(2);
        }
        if (content.contains("@preserve")) {
            return Node.token(NodeKind.COMMENT, start, content.trim());
        }
        return null;
    }

    private Node scanString(Position start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            char c = peek();
            if (c == '\n') {
                diagnostics.error(start, "a string cannot include a newline character.");
                return Node.token(NodeKind.STRING, start, sb.toString());
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    break;
                }
                if (peek() == '\n') {
                    // escaped newline continues the string
                    advance();
                    continue;
                }
                sb.appendCodePoint(scanEscape());
                continue;
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            diagnostics.error(start, "found an unterminated string.");
        } else {
            advance();
        }
        return Node.token(NodeKind.STRING, start, sb.toString());
    }

    private int scanEscape() {
        if (isHexDigit(peek())) {
            int value = 0;
            int count = 0;
            while (count < 6 && !isAtEnd() && isHexDigit(peek())) {
                value = value * 16 + Character.digit(advance(), 16);
                count++;
            }
            if (!isAtEnd() && isWhitespace(peek())) {
                advance();
            }
            return value == 0 || value > Character.MAX_CODE_POINT
                   ? 0xFFFD
                   : value;
        }
        return advance();
    }

    private Node scanNumber(Position start) {
        int numberStart = pos;
        if (peek() == '+' || peek() == '-') {
            advance();
        }
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.' && isDigit(peekAt(1))) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        var value = Double.parseDouble(input.substring(numberStart, pos));
        if (!isAtEnd() && peek() == '%') {
            advance();
            return Node.number(start, value, "%");
        }
        if (startsIdentifier(0)) {
            return Node.number(start, value, scanName());
        }
        return Node.number(start, value, "");
    }

    private Node scanIdentifierLike(Position start) {
        var name = scanName();
        if (isAtEnd() || peek() != '(') {
            return Node.token(NodeKind.IDENTIFIER, start, name);
        }
        advance();
        if (name.equalsIgnoreCase("url")) {
            int lookahead = pos;
            while (lookahead < input.length() && isWhitespace(input.charAt(lookahead))) {
                lookahead++;
            }
            if (lookahead >= input.length()
                || (input.charAt(lookahead) != '"' && input.charAt(lookahead) != '\'')) {
                return scanUrl(start);
            }
        }
        return Node.token(NodeKind.FUNCTION, start, name);
    }

    private Node scanUrl(Position start) {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ')' && !isWhitespace(peek())) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                sb.appendCodePoint(scanEscape());
            } else {
                sb.append(c);
            }
        }
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
        if (isAtEnd() || peek() != ')') {
            diagnostics.error(start, "found an invalid URL, one with forbidden characters or a missing ')'.");
        } else {
            advance();
        }
        return Node.token(NodeKind.URL, start, sb.toString());
    }

    private String scanName() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            char c = peek();
            if (isNameChar(c)) {
                sb.append(advance());
            } else if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                advance();
                sb.appendCodePoint(scanEscape());
            } else {
                break;
            }
        }
        return sb.toString();
    }

    // === Character classes ===

    private boolean startsIdentifier(int offset) {
        char c = peekAt(offset);
        if (c == '-') {
            char next = peekAt(offset + 1);
            return isNameStart(next) || next == '-' || next == '\\';
        }
        return isNameStart(c) || (c == '\\' && peekAt(offset + 1) != '\n' && peekAt(offset + 1) != '\0');
    }

    private boolean startsNumber(int offset) {
        char c = peekAt(offset);
        return isDigit(c) || (c == '.' && isDigit(peekAt(offset + 1)));
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
    }

    // === Input access ===

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        return pos + offset < input.length()
               ? input.charAt(pos + offset)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            position = position.nextLine();
        } else if (c == '\f') {
            position = position.nextPage();
        }
        return c;
    }

    private void skip(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }
}
