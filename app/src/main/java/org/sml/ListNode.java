package org.sml;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

// ListNode = { Node }, children in lexical order
//
// Reducing a chain of operators nests lists through their first child. Those
// chains can be thousands of lists deep, so they are walked with a loop.
public record ListNode(int pos, List<Node> nodes) implements Node {
    public ListNode {
        nodes = List.copyOf(nodes);
    }

    public ListNode(int pos) {
        this(pos, List.of());
    }

    @Override
    public NodeType type() {
        return NodeType.LIST;
    }

    @Override
    public ListNode copy() {
        return rebuild(Node::copy);
    }

    @Override
    public ListNode reduce(CancellationToken cancellation) {
        cancellation.throwIfCancelled("reduce");
        return rebuild(node -> node.reduce(cancellation));
    }

    // This list and every list nested as a first child, outermost first
    List<ListNode> spine() {
        var spine = new ArrayList<ListNode>();
        Node node = this;
        while (node instanceof ListNode list) {
            spine.add(list);
            node = list.nodes.isEmpty() ? null : list.nodes.get(0);
        }
        return spine;
    }

    // New spine, built innermost first; children off the spine go through each
    private ListNode rebuild(UnaryOperator<Node> each) {
        var spine = spine();
        ListNode inner = null;
        for (int i = spine.size() - 1; i >= 0; i--) {
            var list = spine.get(i);
            var children = new ArrayList<Node>(list.nodes.size());
            for (var node : list.nodes) {
                children.add(inner != null && children.isEmpty() ? inner : each.apply(node));
            }
            inner = new ListNode(list.pos, children);
        }
        return inner;
    }

    @Override
    public String toString() {
        var spine = spine();
        var sb = new StringBuilder("(".repeat(spine.size() - 1));
        for (int i = spine.size() - 1; i >= 0; i--) {
            var list = spine.get(i);
            int first = 0;
            if (i < spine.size() - 1) {
                // closes the nested list rendered just before
                sb.append(')');
                first = 1;
            }
            for (int j = first; j < list.nodes.size(); j++) {
                sb.append('(').append(list.nodes.get(j)).append(')');
            }
        }
        return sb.toString();
    }
}
