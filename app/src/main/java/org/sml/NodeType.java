package org.sml;

public enum NodeType {
    // a list of nodes
    LIST,
    // a numerical constant
    NUMBER,
    // a - b
    DIFF,
    // a && b
    INTERSECTION,
    // a || b
    UNION,
    // a placed object, rect 1 2 @ 3 4
    OBJECT
}
