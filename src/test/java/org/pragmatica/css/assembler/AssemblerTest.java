package org.pragmatica.css.assembler;

import org.junit.jupiter.api.Test;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssemblerTest {
    private static final Position POS = Position.start("asm");

    private static Node ident(String name) {
        return Node.token(NodeKind.IDENTIFIER, POS, name);
    }

    private static Node declaration(String name, Node... value) {
        var list = Node.list(POS);
        for (var v : value) {
            list.addChild(v);
        }
        var declaration = Node.token(NodeKind.DECLARATION, POS, name);
        declaration.addChild(list);
        return declaration;
    }

    private static Node block(Node... items) {
        var block = Node.of(NodeKind.OPEN_CURLYBRACKET, POS);
        block.markComplete();
        for (var item : items) {
            block.addChild(item);
        }
        return block;
    }

    private static Node rule(String selector, Node block) {
        var rule = Node.of(NodeKind.COMPONENT_VALUE, POS);
        rule.addChild(ident(selector));
        rule.addChild(block);
        return rule;
    }

    @Test
    void formatNumber_dropsUselessDecimals() {
        assertEquals("2", Assembler.formatNumber(2.0));
        assertEquals("1.5", Assembler.formatNumber(1.5));
        assertEquals("-0.25", Assembler.formatNumber(-0.25));
        assertEquals("0.1", Assembler.formatNumber(0.1));
    }

    @Test
    void rules_areWrittenOnePerLine() {
        var root = Node.list(POS);
        root.addChild(rule("a", block(declaration("color", ident("red")),
                                      declaration("margin", Node.number(POS, 0, ""), Node.of(NodeKind.WHITESPACE, POS),
                                                  Node.number(POS, 1.5, "em")))));
        root.addChild(rule("b", block(declaration("width", Node.number(POS, 50, "%")))));

        assertEquals("a{color:red;margin:0 1.5em}\nb{width:50%}\n", Assembler.assemble(root));
    }

    @Test
    void atRules_renderPreludeAndBlockOrSemicolon() {
        var media = Node.token(NodeKind.AT_KEYWORD, POS, "media");
        media.addChild(ident("print"));
        media.addChild(block(rule("a", block(declaration("color", ident("black"))))));
        var charset = Node.token(NodeKind.AT_KEYWORD, POS, "charset");
        charset.addChild(Node.token(NodeKind.STRING, POS, "UTF-8"));
        var root = Node.list(POS);
        root.addChild(charset);
        root.addChild(media);

        assertEquals("@charset \"UTF-8\";\n@media print{a{color:black}}\n", Assembler.assemble(root));
    }

    @Test
    void importantMarker_followsTheValue() {
        var declaration = declaration("color", ident("red"));
        declaration.addChild(Node.token(NodeKind.EXCLAMATION, POS, "important"));

        assertEquals("a{color:red!important}", Assembler.text(rule("a", block(declaration))));
    }

    @Test
    void strings_areRequotedAndEscaped() {
        assertEquals("\"say \\\"hi\\\"\"", Assembler.text(Node.token(NodeKind.STRING, POS, "say \"hi\"")));
        assertEquals("\"a\\\\b\"", Assembler.text(Node.token(NodeKind.STRING, POS, "a\\b")));
        assertEquals("\"x\\a y\"", Assembler.text(Node.token(NodeKind.STRING, POS, "x\ny")));
    }

    @Test
    void preservedComments_keepTheirText() {
        var root = Node.list(POS);
        root.addChild(Node.token(NodeKind.COMMENT, POS, "@preserve (c) 2024"));

        assertEquals("/* @preserve (c) 2024 */\n", Assembler.assemble(root));
    }

    @Test
    void tokenText_isTrimmed() {
        var function = Node.token(NodeKind.FUNCTION, POS, "rgba");
        function.addChild(Node.number(POS, 0, ""));
        function.addChild(Node.of(NodeKind.COMMA, POS));
        function.addChild(Node.number(POS, 0.5, ""));
        var tokens = List.of(Node.of(NodeKind.WHITESPACE, POS),
                             Node.token(NodeKind.HASH, POS, "fff"),
                             Node.of(NodeKind.WHITESPACE, POS),
                             function,
                             Node.of(NodeKind.WHITESPACE, POS));

        assertEquals("#fff rgba(0,0.5)", Assembler.text(tokens));
    }
}
