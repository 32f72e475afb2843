package org.pragmatica.css.lexer;

import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;

import java.util.List;

/**
 * Replays already built nodes as a token stream, followed by end of input.
 *
 * <p>Used to run parser productions over a piece of an existing tree, for example
 * the contents of a {@code { }} block. Completed blocks are handed out as single tokens.
 */
public final class NodeTokenSource implements TokenSource {
    private final List<Node> nodes;
    private final Position end;
    private int pos;

    private NodeTokenSource(List<Node> nodes, Position end) {
        this.nodes = nodes;
        this.end = end;
    }

    public static NodeTokenSource of(List<Node> nodes, Position end) {
        return new NodeTokenSource(List.copyOf(nodes), end);
    }

    @Override
    public Node nextToken() {
        if (pos < nodes.size()) {
            return nodes.get(pos++);
        }
        var last = nodes.isEmpty()
                   ? end
                   : nodes.get(nodes.size() - 1).position();
        return Node.of(NodeKind.EOF_TOKEN, last);
    }

    @Override
    public boolean replaysParsedNodes() {
        return true;
    }
}
