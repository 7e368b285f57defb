package org.sml;

// UnionNode = Node '||' Node
public record UnionNode(int pos, Node left, Node right) implements OperatorNode {
    @Override
    public NodeType type() {
        return NodeType.UNION;
    }

    @Override
    public String symbol() {
        return "||";
    }

    @Override
    public UnionNode with(Node left, Node right) {
        return new UnionNode(pos, left, right);
    }

    @Override
    public String toString() {
        return OperatorNode.render(this);
    }
}
