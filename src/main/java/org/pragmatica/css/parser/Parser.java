package org.pragmatica.css.parser;

import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.lexer.CssLexer;
import org.pragmatica.css.lexer.TokenSource;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;

/**
 * Recursive descent parser following the CSS 3 syntax productions.
 *
 * <p>The parser only matches blocks and groups component values; it does not interpret them.
 * A {@code { }} block found where a declaration value is expected is captured like any other
 * component value and it is the compiler that later decides whether it is a nested rule.
 *
 * <p>Grammar violations are reported to the {@link Diagnostics} sink and parsing continues
 * with a best-effort node, so a tree is always returned.
 */
public final class Parser {
    private final TokenSource tokens;
    private final Diagnostics diagnostics;
    private Node lastToken;
    private boolean declaration;
    private boolean atRulePrelude;
    private boolean blockInterior;
    private boolean curlyEndsBlock;

    private Parser(TokenSource tokens, Diagnostics diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        nextToken();
    }

    public static Parser create(TokenSource tokens, Diagnostics diagnostics) {
        return new Parser(tokens, diagnostics);
    }

    /**
     * Lex and parse a whole stylesheet.
     */
    public static ParseResult parse(String source, String filename) {
        var diagnostics = new Diagnostics();
        var root = create(CssLexer.create(source, filename, diagnostics), diagnostics).stylesheet();
        return new ParseResult(root, diagnostics.diagnostics());
    }

    // === Entry points, starting at the current token ===

    public Node stylesheet() {
        return stylesheet(lastToken);
    }

    public Node ruleList() {
        return ruleList(lastToken);
    }

    public Node rule() {
        return rule(lastToken);
    }

    public Node declarationList() {
        var saved = declaration;
        declaration = true;
        try {
            return declarationList(lastToken);
        } finally {
            declaration = saved;
        }
    }

    public Node componentValueList() {
        return componentValueList(lastToken);
    }

    public Node componentValue() {
        return componentValue(lastToken);
    }

    // === Productions ===

    private Node stylesheet(Node n) {
        var result = Node.list(n.position());

        for (; !n.is(NodeKind.EOF_TOKEN); n = lastToken) {
            // HTML comment delimiters and whitespace carry nothing at this level
            if (n.is(NodeKind.CDO) || n.is(NodeKind.CDC) || n.is(NodeKind.WHITESPACE)) {
                nextToken();
                continue;
            }
            if (n.kind().closesBlock()) {
                diagnostics.error(n.position(), "Unexpected closing block of type: " + n.kind() + ".");
                break;
            }
            if (n.is(NodeKind.COMMENT)) {
                result.addChild(n);
                nextToken();
                continue;
            }
            result.addChild(dispatch(n));
        }

        return result;
    }

    private Node ruleList(Node n) {
        var result = Node.list(n.position());

        for (Node q = null; (q == null || !q.is(NodeKind.EOF_TOKEN)) && !n.is(NodeKind.EOF_TOKEN); n = lastToken) {
            q = rule(n);
            result.addChild(q);
        }

        return result;
    }

    private Node rule(Node n) {
        if (n.is(NodeKind.CDO) || n.is(NodeKind.CDC)) {
            diagnostics.error(n.position(),
                              "HTML comment delimiters (<!-- and -->) are not allowed in this CSS document.");
            return Node.of(NodeKind.EOF_TOKEN, n.position());
        }
        if (n.kind().closesBlock()) {
            diagnostics.error(n.position(), "Unexpected closing block of type: " + n.kind() + ".");
            return Node.of(NodeKind.EOF_TOKEN, n.position());
        }
        if (n.is(NodeKind.WHITESPACE)) {
            n = nextToken();
        }
        return dispatch(n);
    }

    private Node dispatch(Node n) {
        if (n.is(NodeKind.AT_KEYWORD)) {
            return atRule(n);
        }
        if (n.is(NodeKind.VARIABLE)) {
            return variableDeclaration(n);
        }
        // anything else is a qualified rule
        return qualifiedRule(n);
    }

    private Node atRule(Node atKeyword) {
        var savedPrelude = atRulePrelude;
        var savedInterior = blockInterior;
        atRulePrelude = true;
        blockInterior = false;
        try {
            // the '@' token was already read, it becomes the result
            var n = componentValueList(nextToken());

            if (n.isEmpty()) {
                diagnostics.error(atKeyword.position(),
                                  "At '@' command cannot be empty (missing block) unless ended by a semicolon (;).");
            } else {
                var last = n.lastChild();
                if (!last.is(NodeKind.OPEN_CURLYBRACKET) && !last.is(NodeKind.SEMICOLON)) {
                    diagnostics.error(atKeyword.position(), "At '@' command must end with a block or a ';'.");
                }
                atKeyword.takeOverChildrenOf(n);
            }

            return atKeyword;
        } finally {
            atRulePrelude = savedPrelude;
            blockInterior = savedInterior;
        }
    }

    private Node qualifiedRule(Node n) {
        if (n.is(NodeKind.EOF_TOKEN)) {
            return n;
        }
        if (n.is(NodeKind.SEMICOLON)) {
            // i.e. the ';' in 'foo { blah: 123 };'
            nextToken();
            diagnostics.error(n.position(), "A qualified rule cannot end a { ... } block with a ';'.");
            return Node.of(NodeKind.EOF_TOKEN, n.position());
        }

        // a qualified rule is a component value list ending with a block
        var result = componentValueList(n);

        if (result.isEmpty()) {
            diagnostics.error(n.position(), "A qualified rule cannot be empty; you are missing a { ... } block.");
        } else if (!result.lastChild().is(NodeKind.OPEN_CURLYBRACKET)) {
            diagnostics.error(n.position(), "A qualified rule must end with a { ... } block.");
        }

        return result;
    }

    private Node variableDeclaration(Node variable) {
        var saved = declaration;
        declaration = true;
        try {
            var result = declaration(variable);
            if (lastToken.is(NodeKind.SEMICOLON)) {
                nextToken();
            } else if (!lastToken.is(NodeKind.EOF_TOKEN) && !lastToken.kind().closesBlock()) {
                diagnostics.error(lastToken.position(),
                                  "Variable \"$" + variable.string() + "\" must be terminated by a ';'.");
            }
            return result;
        } finally {
            declaration = saved;
        }
    }

    private Node declarationList(Node n) {
        var result = Node.list(n.position());

        for (;;) {
            if (n.is(NodeKind.WHITESPACE)) {
                n = nextToken();
            }

            if (n.is(NodeKind.IDENTIFIER) || n.is(NodeKind.VARIABLE)) {
                result.addChild(declaration(n));
                if (!lastToken.is(NodeKind.SEMICOLON)) {
                    // trailing spaces would otherwise be reported as the stopping token
                    if (lastToken.is(NodeKind.WHITESPACE)) {
                        nextToken();
                    }
                    break;
                }
                n = nextToken();
            } else if (n.is(NodeKind.AT_KEYWORD)) {
                result.addChild(atRule(n));
                n = lastToken;
            } else {
                break;
            }
        }

        if (!lastToken.is(NodeKind.EOF_TOKEN)) {
            diagnostics.error(lastToken.position(),
                              "the end of the stream was not reached in this declaration, we stopped on a "
                              + lastToken.kind() + ".");
        }

        return result;
    }

    private Node declaration(Node name) {
        var kind = name.is(NodeKind.VARIABLE)
                   ? NodeKind.VARIABLE_DECLARATION
                   : NodeKind.DECLARATION;
        var result = Node.token(kind, name.position(), name.string());

        var n = nextToken();
        if (n.is(NodeKind.WHITESPACE)) {
            n = nextToken();
        }

        if (n.is(NodeKind.COLON)) {
            // the colon itself is not kept
            n = nextToken();
        } else {
            diagnostics.error(n.position(),
                              "':' missing in your declaration starting with \"" + name.string() + "\".");
        }

        if (!n.is(NodeKind.EXCLAMATION)) {
            result.addChild(componentValueList(n));
            n = lastToken;
        }

        if (n.is(NodeKind.EXCLAMATION)) {
            var flag = nextToken();
            if (flag.is(NodeKind.WHITESPACE)) {
                flag = nextToken();
            }
            if (flag.is(NodeKind.IDENTIFIER)) {
                // the '!' node itself becomes the marker, e.g. "important" or "global"
                n.setString(flag.string());
                result.addChild(n);

                n = nextToken();
                if (n.is(NodeKind.WHITESPACE)) {
                    nextToken();
                }
            } else {
                diagnostics.error(flag.position(),
                                  "A '!' must be followed by an identifier, got a " + flag.kind() + " instead.");
            }
        }

        return result;
    }

    private Node componentValueList(Node n) {
        var result = Node.list(n.position());

        for (;; n = lastToken) {
            if (n.is(NodeKind.EOF_TOKEN)
                || n.kind().closesBlock()
                || (!blockInterior && n.is(NodeKind.AT_KEYWORD))
                || (curlyEndsBlock && n.is(NodeKind.OPEN_CURLYBRACKET))
                || (declaration && n.is(NodeKind.EXCLAMATION))
                || (declaration && !atRulePrelude && n.is(NodeKind.SEMICOLON))
                || n.is(NodeKind.CDO)
                || n.is(NodeKind.CDC)) {
                break;
            }
            if (atRulePrelude && n.is(NodeKind.SEMICOLON)) {
                // an at-rule ends on its own ';', which is kept as the last child
                result.addChild(n);
                nextToken();
                break;
            }
            if (!blockInterior && n.is(NodeKind.OPEN_CURLYBRACKET)) {
                // a {}-block ends a prelude (end of a rule, an @-rule, etc.)
                result.addChild(componentValue(n));
                break;
            }
            result.addChild(componentValue(n));
        }

        return result;
    }

    private Node componentValue(Node n) {
        // replayed nodes went through block() already, closed or not
        if (n.kind().opensBlock() && !n.isComplete() && !tokens.replaysParsedNodes()) {
            return block(n, n.kind().closing());
        }

        nextToken();

        // n is the token we keep
        return n;
    }

    private Node block(Node b, NodeKind closing) {
        var savedDeclaration = declaration;
        var savedPrelude = atRulePrelude;
        var savedInterior = blockInterior;
        var savedCurlyEnds = curlyEndsBlock;
        declaration = false;
        atRulePrelude = false;
        blockInterior = true;
        // an unclosed '[' or '(' stops at the next '{' instead of swallowing the rules after it
        curlyEndsBlock = closing != NodeKind.CLOSE_CURLYBRACKET;
        try {
            var children = componentValueList(nextToken());
            b.takeOverChildrenOf(children);
        } finally {
            declaration = savedDeclaration;
            atRulePrelude = savedPrelude;
            blockInterior = savedInterior;
            curlyEndsBlock = savedCurlyEnds;
        }

        if (lastToken.is(NodeKind.WHITESPACE)) {
            nextToken();
        }
        if (lastToken.is(closing)) {
            nextToken();
            b.markComplete();
        } else {
            diagnostics.error(b.position(),
                              "Block expected to end with " + closing + " but got " + lastToken.kind() + " instead.");
        }

        return b;
    }

    private Node nextToken() {
        lastToken = tokens.nextToken();
        return lastToken;
    }
}
