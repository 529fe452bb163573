package org.pragmatica.markup.syntax;

import java.util.List;

/**
 * An ordered sequence of top-level markup nodes.
 *
 * <p>Immutable; templates hold a reference to their tree instead of copying it.
 */
public record Tree(List<Node> nodes) {
    public static final Tree EMPTY = new Tree(List.of());

    public Tree {
        nodes = List.copyOf(nodes);
    }

    public static Tree of(Node... nodes) {
        return new Tree(List.of(nodes));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
