package org.sml;

// DiffNode = Node '-' Node
public record DiffNode(int pos, Node left, Node right) implements OperatorNode {
    @Override
    public NodeType type() {
        return NodeType.DIFF;
    }

    @Override
    public String symbol() {
        return "-";
    }

    @Override
    public DiffNode with(Node left, Node right) {
        return new DiffNode(pos, left, right);
    }

    @Override
    public String toString() {
        return OperatorNode.render(this);
    }
}
