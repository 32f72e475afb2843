package org.pragmatica.css.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the stylesheet tree.
 *
 * <p>The same type represents lexer tokens, bracketed blocks, declarations and synthetic lists;
 * the {@link NodeKind} tells them apart. Children are ordered and owned by their parent.
 * The tree is rewritten in place by the compiler.
 */
public final class Node {
    private final NodeKind kind;
    private final Position position;
    private final List<Node> children = new ArrayList<>();
    private String string;
    private double number;
    private boolean complete;

    private Node(NodeKind kind, Position position, String string, double number) {
        this.kind = kind;
        this.position = position;
        this.string = string;
        this.number = number;
    }

    public static Node of(NodeKind kind, Position position) {
        return new Node(kind, position, "", 0);
    }

    public static Node token(NodeKind kind, Position position, String string) {
        return new Node(kind, position, string, 0);
    }

    /**
     * Numeric token; the unit is kept in the string value ("" for plain numbers, "%" for percentages).
     */
    public static Node number(Position position, double value, String unit) {
        return new Node(NodeKind.NUMBER, position, unit, value);
    }

    public static Node list(Position position) {
        return of(NodeKind.LIST, position);
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Position position() {
        return position;
    }

    public String string() {
        return string;
    }

    public void setString(String string) {
        this.string = string;
    }

    public double number() {
        return number;
    }

    public void setNumber(double number) {
        this.number = number;
    }

    /**
     * Whether a block-opening node already received its contents from the parser.
     */
    public boolean isComplete() {
        return complete;
    }

    public void markComplete() {
        this.complete = true;
    }

    // === Children ===

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public Node child(int index) {
        return children.get(index);
    }

    public Node lastChild() {
        if (children.isEmpty()) {
            throw new IllegalStateException("node " + kind + " has no children");
        }
        return children.get(children.size() - 1);
    }

    public int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public Node addChild(Node child) {
        children.add(child);
        return this;
    }

    public void insertChild(int index, Node child) {
        children.add(index, child);
    }

    public Node removeChild(int index) {
        return children.remove(index);
    }

    public void replaceChild(int index, Node child) {
        children.set(index, child);
    }

    /**
     * Replace the child at {@code index} with the given nodes, in order.
     */
    public void splice(int index, List<Node> replacement) {
        children.remove(index);
        children.addAll(index, replacement);
    }

    /**
     * Insert the given nodes at {@code index}, in order, shifting the following children.
     */
    public void insertChildren(int index, List<Node> nodes) {
        children.addAll(index, nodes);
    }

    public void clearChildren() {
        children.clear();
    }

    /**
     * Move all children of {@code other} to the end of this node's children.
     */
    public void takeOverChildrenOf(Node other) {
        children.addAll(other.children);
        other.children.clear();
    }

    /**
     * Deep copy of this node and its whole subtree.
     */
    public Node copy() {
        var copy = new Node(kind, position, string, number);
        copy.complete = complete;
        for (var child : children) {
            copy.children.add(child.copy());
        }
        return copy;
    }

    /**
     * Structural equality: same kinds, values and children, positions ignored.
     */
    public boolean sameAs(Node other) {
        if (kind != other.kind
            || !string.equals(other.string)
            || Double.compare(number, other.number) != 0
            || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameAs(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Indented debug dump of the subtree.
     */
    public String dump() {
        var sb = new StringBuilder();
        dump(sb, 0);
        return sb.toString();
    }

    private void dump(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(kind.name());
        if (!string.isEmpty()) {
            sb.append(" \"").append(string).append('"');
        }
        if (kind == NodeKind.NUMBER) {
            sb.append(' ').append(number);
        }
        sb.append('\n');
        for (var child : children) {
            child.dump(sb, indent + 1);
        }
    }

    @Override
    public String toString() {
        return string.isEmpty()
               ? kind.name()
               : kind.name() + "(" + string + ")";
    }
}
