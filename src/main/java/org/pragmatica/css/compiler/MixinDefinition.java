package org.pragmatica.css.compiler;

import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.Position;

import java.util.List;
import java.util.Optional;

/**
 * A mixin declared with {@code @mixin name($a, $b: default) { ... }}.
 *
 * @param name       Mixin name
 * @param parameters Parameters in declaration order
 * @param body       The {@code { }} block, copied out of the tree
 * @param position   Where the mixin was declared
 */
record MixinDefinition(String name, List<Parameter> parameters, Node body, Position position) {

    /**
     * @param name         Parameter name, without the {@code $}
     * @param defaultValue Tokens used when the call does not provide the argument
     */
    record Parameter(String name, Optional<List<Node>> defaultValue) {}
}
