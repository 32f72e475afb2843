package org.pragmatica.css.compiler;

import org.pragmatica.css.error.CompilerLogicException;
import org.pragmatica.css.tree.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one compilation: the root being compiled and the stack of parent frames.
 *
 * <p>Each frame belongs to a node (the root, a rule, an at-rule block or a mixin call) and
 * holds the variables and mixins defined while that node was being compiled. Lookups search
 * the innermost frame first. The first frame pushed is the global one.
 */
final class CompilerState {

    static final class Frame {
        private final Node node;
        private final Map<String, Node> variables = new HashMap<>();
        private final Map<String, MixinDefinition> mixins = new HashMap<>();

        private Frame(Node node) {
            this.node = node;
        }

        Node node() {
            return node;
        }
    }

    /**
     * Pops its frame when closed, whatever way the guarded block is left.
     */
    static final class ParentScope implements AutoCloseable {
        private final CompilerState state;
        private final Node parent;

        private ParentScope(CompilerState state, Node parent) {
            this.state = state;
            this.parent = parent;
        }

        @Override
        public void close() {
            state.popParent(parent);
        }
    }

    private final List<Frame> parents = new ArrayList<>();
    private Node root;

    void setRoot(Node root) {
        this.root = root;
        parents.clear();
    }

    Node root() {
        return root;
    }

    ParentScope enter(Node parent) {
        pushParent(parent);
        return new ParentScope(this, parent);
    }

    void pushParent(Node parent) {
        parents.add(new Frame(parent));
    }

    void popParent() {
        if (parents.isEmpty()) {
            throw new CompilerLogicException("parent stack underflow");
        }
        parents.remove(parents.size() - 1);
    }

    private void popParent(Node expected) {
        if (parents.isEmpty() || current().node() != expected) {
            throw new CompilerLogicException("unbalanced parent stack, expected " + expected + " on top");
        }
        popParent();
    }

    boolean emptyParents() {
        return parents.isEmpty();
    }

    int depth() {
        return parents.size();
    }

    Node currentParent() {
        return current().node();
    }

    /**
     * Search the frames for a variable, innermost first, or only the global frame.
     */
    Optional<Node> getVariable(String name, boolean globalOnly) {
        if (parents.isEmpty()) {
            return Optional.empty();
        }
        if (globalOnly) {
            return Optional.ofNullable(parents.get(0).variables.get(name));
        }
        for (int i = parents.size() - 1; i >= 0; i--) {
            var value = parents.get(i).variables.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Assign a variable in the innermost frame, or in the global frame when {@code global} is set.
     */
    void setVariable(String name, Node value, boolean global) {
        var frame = global
                    ? global()
                    : current();
        frame.variables.put(name, value);
    }

    Optional<MixinDefinition> getMixin(String name) {
        for (int i = parents.size() - 1; i >= 0; i--) {
            var mixin = parents.get(i).mixins.get(name);
            if (mixin != null) {
                return Optional.of(mixin);
            }
        }
        return Optional.empty();
    }

    void setMixin(MixinDefinition mixin) {
        current().mixins.put(mixin.name(), mixin);
    }

    private Frame current() {
        if (parents.isEmpty()) {
            throw new CompilerLogicException("no parent frame, compile() was not started");
        }
        return parents.get(parents.size() - 1);
    }

    private Frame global() {
        if (parents.isEmpty()) {
            throw new CompilerLogicException("no global frame, compile() was not started");
        }
        return parents.get(0);
    }
}
