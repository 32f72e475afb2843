package org.pragmatica.css.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CssLexerTest {

    private static List<Node> tokenize(String input, Diagnostics diagnostics) {
        return CssLexer.tokenize(input, "test.scss", diagnostics);
    }

    private static List<Node> tokenize(String input) {
        var diagnostics = new Diagnostics();
        var tokens = tokenize(input, diagnostics);
        assertFalse(diagnostics.hasErrors(), diagnostics::format);
        return tokens;
    }

    @Test
    void simpleRule_producesExpectedKinds() {
        assertThat(tokenize("a{color:#fff}")).extracting(Node::kind)
                                               .containsExactly(NodeKind.IDENTIFIER,
                                                                NodeKind.OPEN_CURLYBRACKET,
                                                                NodeKind.IDENTIFIER,
                                                                NodeKind.COLON,
                                                                NodeKind.HASH,
                                                                NodeKind.CLOSE_CURLYBRACKET,
                                                                NodeKind.EOF_TOKEN);
    }

    @Test
    void whitespaceRuns_collapse() {
        assertThat(tokenize("a  \n\t b")).extracting(Node::kind)
                                         .containsExactly(NodeKind.IDENTIFIER,
                                                          NodeKind.WHITESPACE,
                                                          NodeKind.IDENTIFIER,
                                                          NodeKind.EOF_TOKEN);
    }

    @Test
    void variablesAndAtKeywords_keepTheirNames() {
        var tokens = tokenize("$main-color @media");

        assertEquals(NodeKind.VARIABLE, tokens.get(0).kind());
        assertEquals("main-color", tokens.get(0).string());
        assertEquals(NodeKind.AT_KEYWORD, tokens.get(2).kind());
        assertEquals("media", tokens.get(2).string());
    }

    @Test
    void numbers_carryTheirUnit() {
        var tokens = tokenize("10px 50% -1.5 .5em");

        assertEquals(10, tokens.get(0).number());
        assertEquals("px", tokens.get(0).string());
        assertEquals("%", tokens.get(2).string());
        assertEquals(-1.5, tokens.get(4).number());
        assertEquals("", tokens.get(4).string());
        assertEquals(0.5, tokens.get(6).number());
        assertEquals("em", tokens.get(6).string());
    }

    @Test
    void comments_areDroppedUnlessPreserved() {
        var tokens = tokenize("/* plain */a// line\n/* @preserve keep me */");

        assertThat(tokens).extracting(Node::kind)
                          .containsExactly(NodeKind.IDENTIFIER,
                                           NodeKind.WHITESPACE,
                                           NodeKind.COMMENT,
                                           NodeKind.EOF_TOKEN);
        assertEquals("@preserve keep me", tokens.get(2).string());
    }

    @Test
    void strings_handleEscapes() {
        var tokens = tokenize("'it\\'s' \"\\41 b\"");

        assertEquals("it's", tokens.get(0).string());
        assertEquals("Ab", tokens.get(2).string());
    }

    @Test
    void unterminatedString_isReported() {
        var diagnostics = new Diagnostics();
        var tokens = tokenize("\"abc", diagnostics);

        assertEquals(NodeKind.STRING, tokens.get(0).kind());
        assertEquals("abc", tokens.get(0).string());
        assertEquals(1, diagnostics.errorCount());
    }

    @Test
    void unclosedComment_isReported() {
        var diagnostics = new Diagnostics();
        tokenize("a /* never closed", diagnostics);

        assertThat(diagnostics.diagnostics()).singleElement()
                                             .satisfies(d -> assertThat(d.message()).contains("unclosed"));
    }

    @Test
    void unquotedUrl_isASingleToken() {
        var tokens = tokenize("url( images/logo.png )");

        assertEquals(NodeKind.URL, tokens.get(0).kind());
        assertEquals("images/logo.png", tokens.get(0).string());
    }

    @Test
    void quotedUrl_isAFunction() {
        var tokens = tokenize("url(\"logo.png\")");

        assertEquals(NodeKind.FUNCTION, tokens.get(0).kind());
        assertEquals("url", tokens.get(0).string());
        assertEquals(NodeKind.STRING, tokens.get(1).kind());
    }

    @Test
    void operators_formTwoCharacterDelimiters() {
        var tokens = tokenize("~= != == >= !");

        assertThat(tokens).filteredOn(t -> t.is(NodeKind.DELIMITER))
                          .extracting(Node::string)
                          .containsExactly("~=", "!=", "==", ">=");
        assertEquals(NodeKind.EXCLAMATION, tokens.get(8).kind());
    }

    @Test
    void htmlCommentDelimiters_areRecognized() {
        assertThat(tokenize("<!-- -->")).extracting(Node::kind)
                                        .containsExactly(NodeKind.CDO,
                                                         NodeKind.WHITESPACE,
                                                         NodeKind.CDC,
                                                         NodeKind.EOF_TOKEN);
    }

    @Test
    void positions_trackLinesAndPages() {
        var tokens = tokenize("a\nb\fc");

        assertEquals(Position.at("test.scss", 1, 1), tokens.get(0).position());
        assertEquals(Position.at("test.scss", 1, 2), tokens.get(2).position());
        assertEquals(Position.at("test.scss", 2, 1), tokens.get(4).position());
    }

    @Test
    void nodeTokenSource_replaysThenEndsForever() {
        var pos = Position.start("replay");
        var source = NodeTokenSource.of(List.of(Node.token(NodeKind.IDENTIFIER, pos, "a")), pos);

        assertEquals("a", source.nextToken().string());
        assertTrue(source.nextToken().is(NodeKind.EOF_TOKEN));
        assertTrue(source.nextToken().is(NodeKind.EOF_TOKEN));
    }
}
