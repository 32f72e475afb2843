package org.pragmatica.css.lexer;

import org.pragmatica.css.tree.Node;

/**
 * Pull source of tokens consumed by the parser.
 *
 * <p>Each call advances exactly one token. Once the input is exhausted every call
 * returns an {@link org.pragmatica.css.tree.NodeKind#EOF_TOKEN} node.
 */
@FunctionalInterface
public interface TokenSource {
    Node nextToken();

    /**
     * Whether the tokens are nodes of an already parsed tree, whose blocks must not be parsed again.
     */
    default boolean replaysParsedNodes() {
        return false;
    }
}
