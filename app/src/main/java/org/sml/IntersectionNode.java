package org.sml;

// IntersectionNode = Node '&&' Node
public record IntersectionNode(int pos, Node left, Node right) implements OperatorNode {
    @Override
    public NodeType type() {
        return NodeType.INTERSECTION;
    }

    @Override
    public String symbol() {
        return "&&";
    }

    @Override
    public IntersectionNode with(Node left, Node right) {
        return new IntersectionNode(pos, left, right);
    }

    @Override
    public String toString() {
        return OperatorNode.render(this);
    }
}
