package org.sml;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary set operator. The operators are not evaluated yet: reducing one
 * collects both reduced operands into a {@link ListNode}.
 *
 * Operators associate left, so a long chain nests through its left operands.
 * Copying, reducing and rendering follow that left spine with a loop and only
 * recurse into right operands.
 */
public sealed interface OperatorNode extends Node permits DiffNode, IntersectionNode, UnionNode {
    Node left();

    Node right();

    // operator as written in the source
    String symbol();

    // Same operator at the same position over other operands
    OperatorNode with(Node left, Node right);

    // This operator and every operator nested as a left operand, outermost first
    default List<OperatorNode> spine() {
        var spine = new ArrayList<OperatorNode>();
        Node node = this;
        while (node instanceof OperatorNode op) {
            spine.add(op);
            node = op.left();
        }
        return spine;
    }

    @Override
    default OperatorNode copy() {
        var spine = spine();
        Node left = spine.get(spine.size() - 1).left().copy();
        OperatorNode copied = null;
        for (int i = spine.size() - 1; i >= 0; i--) {
            var op = spine.get(i);
            copied = op.with(left, op.right().copy());
            left = copied;
        }
        return copied;
    }

    @Override
    default ListNode reduce(CancellationToken cancellation) {
        cancellation.throwIfCancelled("reduce");

        var spine = spine();
        Node left = spine.get(spine.size() - 1).left().reduce(cancellation);
        ListNode list = null;
        for (int i = spine.size() - 1; i >= 0; i--) {
            cancellation.throwIfCancelled("reduce");
            var op = spine.get(i);
            list = new ListNode(op.pos(), List.of(left, op.right().reduce(cancellation)));
            left = list;
        }
        return list;
    }

    static String render(OperatorNode node) {
        var spine = node.spine();
        var sb = new StringBuilder();
        sb.append(spine.get(spine.size() - 1).left());
        for (int i = spine.size() - 1; i >= 0; i--) {
            var op = spine.get(i);
            sb.append(' ').append(op.symbol()).append(' ').append(op.right());
        }
        return sb.toString();
    }
}
