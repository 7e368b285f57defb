package org.sml;

/**
 * An element of the syntax tree.
 *
 * Nodes are values: {@link #copy()} and {@link #reduce()} always build new
 * nodes and never touch the receiver, so a tree can be printed before and
 * after reduction.
 */
public sealed interface Node permits ListNode, NumberNode, OperatorNode, ObjectNode {
    NodeType type();

    // offset of the start of the node in the source text
    int pos();

    // Deep copy of the node and all its children
    Node copy();

    default Node reduce() {
        return reduce(CancellationToken.none());
    }

    Node reduce(CancellationToken cancellation);
}
