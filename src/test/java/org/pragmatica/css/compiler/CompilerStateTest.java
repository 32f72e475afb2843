package org.pragmatica.css.compiler;

import org.junit.jupiter.api.Test;
import org.pragmatica.css.error.CompilerLogicException;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CompilerStateTest {
    private static final Position POS = Position.start("state");

    private static Node value(String text) {
        return Node.list(POS).addChild(Node.token(NodeKind.IDENTIFIER, POS, text));
    }

    @Test
    void scopes_popTheirFrame() {
        var state = new CompilerState();
        var root = Node.list(POS);
        state.setRoot(root);

        try (var global = state.enter(root)) {
            var rule = Node.of(NodeKind.COMPONENT_VALUE, POS);
            try (var inner = state.enter(rule)) {
                assertEquals(2, state.depth());
                assertSame(rule, state.currentParent());
            }
            assertEquals(1, state.depth());
        }
        assertTrue(state.emptyParents());
    }

    @Test
    void lookups_searchInnermostFirst() {
        var state = new CompilerState();
        var root = Node.list(POS);
        state.setRoot(root);

        try (var global = state.enter(root)) {
            state.setVariable("c", value("red"), false);
            try (var inner = state.enter(Node.list(POS))) {
                state.setVariable("c", value("blue"), false);

                assertEquals("blue", state.getVariable("c", false).get().child(0).string());
                assertEquals("red", state.getVariable("c", true).get().child(0).string());
            }
            assertEquals("red", state.getVariable("c", false).get().child(0).string());
        }
    }

    @Test
    void globalWrites_goToTheOutermostFrame() {
        var state = new CompilerState();
        var root = Node.list(POS);
        state.setRoot(root);

        try (var global = state.enter(root)) {
            try (var inner = state.enter(Node.list(POS))) {
                state.setVariable("g", value("x"), true);
                assertEquals("x", state.getVariable("g", true).get().child(0).string());
            }
            assertTrue(state.getVariable("g", false).isPresent());
        }
    }

    @Test
    void mixins_areVisibleFromInnerFrames() {
        var state = new CompilerState();
        var root = Node.list(POS);
        state.setRoot(root);
        var mixin = new MixinDefinition("m", List.of(new MixinDefinition.Parameter("a", Optional.empty())),
                                        Node.of(NodeKind.OPEN_CURLYBRACKET, POS), POS);

        try (var global = state.enter(root)) {
            state.setMixin(mixin);
            try (var inner = state.enter(Node.list(POS))) {
                assertSame(mixin, state.getMixin("m").get());
            }
        }
        assertTrue(state.getMixin("m").isEmpty());
    }

    @Test
    void underflow_isALogicError() {
        var state = new CompilerState();

        assertThrows(CompilerLogicException.class, state::popParent);
        assertThrows(CompilerLogicException.class, () -> state.setVariable("x", value("y"), false));
    }

    @Test
    void closingOutOfOrder_isALogicError() {
        var state = new CompilerState();
        var outer = state.enter(Node.list(POS));
        state.enter(Node.list(POS));

        assertThrows(CompilerLogicException.class, outer::close);
    }

    @Test
    void setRoot_resetsTheStack() {
        var state = new CompilerState();
        state.pushParent(Node.list(POS));
        state.setRoot(Node.list(POS));

        assertTrue(state.emptyParents());
        assertTrue(state.getVariable("anything", false).isEmpty());
    }
}
