package org.sml;

import java.util.ArrayList;
import java.util.List;

// ObjectNode = Ident { Param } [ '@' { Param } ]
//
// A placed geometric primitive. A bare identifier used as a parameter is an
// object without parameters.
public record ObjectNode(
    int pos,
    String ident,
    List<Node> params,
    List<Node> locationParams
) implements Node {
    public ObjectNode {
        params = List.copyOf(params);
        locationParams = List.copyOf(locationParams);
    }

    public ObjectNode(int pos, String ident) {
        this(pos, ident, List.of(), List.of());
    }

    @Override
    public NodeType type() {
        return NodeType.OBJECT;
    }

    @Override
    public ObjectNode copy() {
        var paramsCopy = new ArrayList<Node>();
        for (var param : params) {
            paramsCopy.add(param.copy());
        }
        var locationParamsCopy = new ArrayList<Node>();
        for (var param : locationParams) {
            locationParamsCopy.add(param.copy());
        }
        return new ObjectNode(pos, ident, paramsCopy, locationParamsCopy);
    }

    // Objects are placements, already as reduced as they get
    @Override
    public ObjectNode reduce(CancellationToken cancellation) {
        cancellation.throwIfCancelled("reduce");
        return copy();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(ident);
        for (var param : params) {
            sb.append(' ').append(renderParam(param));
        }
        if (!locationParams.isEmpty()) {
            sb.append(" @");
            for (var param : locationParams) {
                sb.append(' ').append(renderParam(param));
            }
        }
        return sb.toString();
    }

    // Operators and objects with parameters need parens to read back the same
    private static String renderParam(Node param) {
        if (param instanceof OperatorNode) {
            return "(" + param + ")";
        }
        if (param instanceof ObjectNode object && (!object.params.isEmpty() || !object.locationParams.isEmpty())) {
            return "(" + param + ")";
        }
        return param.toString();
    }
}
