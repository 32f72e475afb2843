package org.pragmatica.css.compiler;

import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns nested rules into a flat sequence of rules.
 *
 * <p>A nested rule is moved out of its parent and inserted right after it, with a selector
 * combining every outer selector with every inner one. Rules extracted from the same parent
 * keep their depth-first order. Nested at-rules carrying a block ({@code @media} and friends)
 * are moved out as well, with the enclosing selector wrapped inside them. Nested property
 * groups ({@code border: { width: 1px }}) become prefixed declarations ({@code border-width}).
 */
final class RuleFlattener {
    private final Diagnostics diagnostics;

    private RuleFlattener(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    static void expandNestedComponents(Node container, Diagnostics diagnostics) {
        new RuleFlattener(diagnostics).expandContainer(container);
    }

    private void expandContainer(Node container) {
        for (int i = 0; i < container.size(); i++) {
            var n = container.child(i);
            if (n.is(NodeKind.COMPONENT_VALUE)) {
                var selectors = SelectorValidator.split(SelectorValidator.normalize(selectorOf(n)));
                var extracted = new ArrayList<Node>();
                expandNestedRules(n, selectors, extracted);
                for (var rule : extracted) {
                    container.insertChild(++i, rule);
                }
            } else if (n.is(NodeKind.AT_KEYWORD) && hasBlock(n) && !isKeyframes(n)) {
                expandContainer(n.lastChild());
            }
        }
    }

    private void expandNestedRules(Node rule, List<List<Node>> selectors, List<Node> extracted) {
        var block = rule.lastChild();
        var kept = new ArrayList<Node>();
        for (var item : block.children()) {
            if (item.is(NodeKind.DECLARATION)) {
                expandNestedDeclarations(item.string(), item, kept);
            } else if (item.is(NodeKind.COMPONENT_VALUE)) {
                var inner = SelectorValidator.split(SelectorValidator.normalize(selectorOf(item)));
                var combined = combine(selectors, inner);
                setSelector(item, join(combined));
                extracted.add(item);
                expandNestedRules(item, combined, extracted);
            } else if (item.is(NodeKind.AT_KEYWORD) && hasBlock(item)) {
                extracted.add(item);
                if (!isKeyframes(item)) {
                    wrapSelector(item, selectors);
                }
            } else {
                kept.add(item);
            }
        }
        block.clearChildren();
        kept.forEach(block::addChild);
    }

    /**
     * Move the declarations of a nested at-rule into a rule using the enclosing selectors.
     */
    private void wrapSelector(Node atRule, List<List<Node>> selectors) {
        var atBlock = atRule.lastChild();
        var wrapper = Node.of(NodeKind.COMPONENT_VALUE, atRule.position());
        for (var token : join(selectors)) {
            wrapper.addChild(token);
        }
        var wrapperBlock = Node.of(NodeKind.OPEN_CURLYBRACKET, atRule.position());
        wrapperBlock.markComplete();
        wrapperBlock.takeOverChildrenOf(atBlock);
        wrapper.addChild(wrapperBlock);

        var rules = new ArrayList<Node>();
        rules.add(wrapper);
        expandNestedRules(wrapper, selectors, rules);
        rules.forEach(atBlock::addChild);
    }

    /**
     * Flatten {@code name: { sub: value }} into {@code name-sub: value}, recursively.
     */
    private void expandNestedDeclarations(String name, Node declaration, List<Node> out) {
        declaration.setString(name);
        if (declaration.isEmpty() || !declaration.child(0).is(NodeKind.LIST)) {
            out.add(declaration);
            return;
        }
        var value = declaration.child(0);
        var group = trailingGroup(value);
        if (group == null) {
            out.add(declaration);
            return;
        }
        // "font: 12px { family: serif }" keeps "font: 12px" next to the nested declarations
        value.removeChild(value.size() - 1);
        Compiler.trim(value);
        if (!value.isEmpty()) {
            out.add(declaration);
        }
        for (var item : group.children()) {
            if (item.is(NodeKind.DECLARATION)) {
                expandNestedDeclarations(name + "-" + item.string(), item, out);
            } else if (!item.is(NodeKind.COMMENT)) {
                diagnostics.error(item.position(),
                                  "a nested declaration group (" + name + ") can only contain declarations.");
            }
        }
    }

    private static Node trailingGroup(Node value) {
        if (value.isEmpty()) {
            return null;
        }
        var last = value.lastChild();
        return last.is(NodeKind.OPEN_CURLYBRACKET) && last.isComplete()
               ? last
               : null;
    }

    /**
     * Cartesian combination of outer and inner selectors; {@code &} in an inner selector
     * is replaced by the outer one, otherwise the two are joined as descendants.
     */
    static List<List<Node>> combine(List<List<Node>> outer, List<List<Node>> inner) {
        var result = new ArrayList<List<Node>>();
        for (var o : outer) {
            for (var i : inner) {
                result.add(hasParentReference(i)
                           ? substituteParent(o, i)
                           : descendant(o, i));
            }
        }
        return result;
    }

    private static List<Node> descendant(List<Node> outer, List<Node> inner) {
        var combined = new ArrayList<Node>();
        outer.forEach(token -> combined.add(token.copy()));
        if (!inner.isEmpty() && !isCombinator(inner.get(0))) {
            combined.add(Node.of(NodeKind.WHITESPACE, inner.get(0).position()));
        }
        inner.forEach(token -> combined.add(token.copy()));
        return combined;
    }

    private static List<Node> substituteParent(List<Node> outer, List<Node> inner) {
        var combined = new ArrayList<Node>();
        for (int k = 0; k < inner.size(); k++) {
            var token = inner.get(k);
            if (!isParentReference(token)) {
                combined.add(token.copy());
                continue;
            }
            outer.forEach(o -> combined.add(o.copy()));
            // "&-suffix" extends the last name of the outer selector
            if (k + 1 < inner.size() && inner.get(k + 1).is(NodeKind.IDENTIFIER) && !combined.isEmpty()) {
                var last = combined.get(combined.size() - 1);
                if (last.is(NodeKind.IDENTIFIER) || last.is(NodeKind.HASH)) {
                    last.setString(last.string() + inner.get(k + 1).string());
                    k++;
                }
            }
        }
        return combined;
    }

    private static boolean hasParentReference(List<Node> selector) {
        return selector.stream().anyMatch(RuleFlattener::isParentReference);
    }

    private static boolean isParentReference(Node token) {
        return token.is(NodeKind.DELIMITER) && token.string().equals("&");
    }

    private static boolean isCombinator(Node token) {
        return token.is(NodeKind.DELIMITER)
               && (token.string().equals(">") || token.string().equals("+") || token.string().equals("~"));
    }

    static List<Node> join(List<List<Node>> selectors) {
        var tokens = new ArrayList<Node>();
        for (var selector : selectors) {
            if (!tokens.isEmpty()) {
                var position = selector.isEmpty()
                               ? tokens.get(0).position()
                               : selector.get(0).position();
                tokens.add(Node.of(NodeKind.COMMA, position));
            }
            selector.forEach(token -> tokens.add(token.copy()));
        }
        return tokens;
    }

    static List<Node> selectorOf(Node rule) {
        return rule.children().subList(0, rule.size() - 1);
    }

    static void setSelector(Node rule, List<Node> selector) {
        var block = rule.lastChild();
        rule.clearChildren();
        selector.forEach(rule::addChild);
        rule.addChild(block);
    }

    static boolean hasBlock(Node atRule) {
        return !atRule.isEmpty() && atRule.lastChild().is(NodeKind.OPEN_CURLYBRACKET);
    }

    static boolean isKeyframes(Node atRule) {
        return atRule.string().toLowerCase().endsWith("keyframes");
    }
}
