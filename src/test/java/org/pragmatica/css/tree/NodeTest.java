package org.pragmatica.css.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeTest {
    private static final Position POS = Position.start("test.scss");

    @Test
    void copy_isDeepAndIndependent() {
        var block = Node.of(NodeKind.OPEN_CURLYBRACKET, POS);
        block.markComplete();
        block.addChild(Node.token(NodeKind.IDENTIFIER, POS, "red"));
        var rule = Node.of(NodeKind.COMPONENT_VALUE, POS)
                       .addChild(Node.token(NodeKind.IDENTIFIER, POS, "a"))
                       .addChild(block);

        var copy = rule.copy();
        copy.lastChild().child(0).setString("blue");

        assertEquals("red", rule.lastChild().child(0).string());
        assertTrue(copy.lastChild().isComplete());
        assertFalse(copy.sameAs(rule));
    }

    @Test
    void sameAs_ignoresPositions() {
        var first = Node.number(POS, 10, "px");
        var second = Node.number(POS.nextLine().nextLine(), 10, "px");

        assertTrue(first.sameAs(second));
        assertFalse(first.sameAs(Node.number(POS, 10, "em")));
    }

    @Test
    void splice_replacesOneChildWithMany() {
        var list = Node.list(POS)
                       .addChild(Node.token(NodeKind.IDENTIFIER, POS, "a"))
                       .addChild(Node.token(NodeKind.VARIABLE, POS, "v"))
                       .addChild(Node.token(NodeKind.IDENTIFIER, POS, "d"));

        list.splice(1, List.of(Node.token(NodeKind.IDENTIFIER, POS, "b"),
                               Node.token(NodeKind.IDENTIFIER, POS, "c")));

        assertThat(list.children()).extracting(Node::string)
                                   .containsExactly("a", "b", "c", "d");
    }

    @Test
    void insertChildren_keepsEveryExistingChild() {
        var list = Node.list(POS)
                       .addChild(Node.token(NodeKind.IDENTIFIER, POS, "a"))
                       .addChild(Node.token(NodeKind.IDENTIFIER, POS, "d"));

        list.insertChildren(1, List.of(Node.token(NodeKind.IDENTIFIER, POS, "b"),
                                       Node.token(NodeKind.IDENTIFIER, POS, "c")));
        list.insertChildren(list.size(), List.of(Node.token(NodeKind.IDENTIFIER, POS, "e")));

        assertThat(list.children()).extracting(Node::string)
                                   .containsExactly("a", "b", "c", "d", "e");
    }

    @Test
    void takeOverChildrenOf_movesChildren() {
        var source = Node.list(POS).addChild(Node.of(NodeKind.COMMA, POS));
        var target = Node.token(NodeKind.AT_KEYWORD, POS, "media");

        target.takeOverChildrenOf(source);

        assertTrue(source.isEmpty());
        assertEquals(1, target.size());
    }

    @Test
    void lastChild_ofEmptyNode_throws() {
        assertThrows(IllegalStateException.class, () -> Node.list(POS).lastChild());
    }

    @Test
    void children_areReadOnly() {
        var list = Node.list(POS);
        assertThrows(UnsupportedOperationException.class,
                     () -> list.children().add(Node.of(NodeKind.COMMA, POS)));
    }

    @Test
    void indexOf_usesIdentity() {
        var a = Node.token(NodeKind.IDENTIFIER, POS, "x");
        var b = Node.token(NodeKind.IDENTIFIER, POS, "x");
        var list = Node.list(POS).addChild(a).addChild(b);

        assertEquals(1, list.indexOf(b));
        assertEquals(-1, list.indexOf(a.copy()));
    }

    @Test
    void position_formatsPageOnlyAfterFirst() {
        assertEquals("f.css:1", Position.start("f.css").toString());
        assertEquals("f.css:3", Position.start("f.css").nextLine().nextLine().toString());
        assertEquals("f.css(2):1", Position.start("f.css").nextLine().nextPage().toString());
    }
}
