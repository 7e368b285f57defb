package org.sml;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One parsed document: its name, the source text and the root node.
 */
public record Tree(String name, String text, Node root) {
    private static final Logger log = LogManager.getLogger("tree");

    public Tree copy() {
        return new Tree(name, text, root.copy());
    }

    public Tree reduce() {
        return reduce(CancellationToken.none());
    }

    // The receiver stays as it was
    public Tree reduce(CancellationToken cancellation) {
        log.debug("reduce " + name + ", root " + root.type());
        var reduced = new Tree(name, text, root.reduce(cancellation));
        log.debug("reduced " + name + " to " + reduced.root().type());
        return reduced;
    }

    public SpanUtils.Location locate(int pos) {
        return SpanUtils.locate(pos, text);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
