package org.sml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pretty-prints the *structure* of a syntax tree in a human-readable
 * format, one node per line with its (line:column) position.
 */
class PrinterST {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;
    private static final String INDENT_CHAR = "  "; // 2 spaces per indent level

    private final List<Integer> lineIndex;

    // Steps still to print; nodes schedule their children here instead of
    // recursing, so long operator chains print in constant stack
    private final Deque<Runnable> work = new ArrayDeque<>();

    public PrinterST(List<Integer> lineIndex) {
        this.lineIndex = lineIndex;
    }

    public PrinterST(String text) {
        this(SpanUtils.lineIndex(text));
    }

    public String print(Tree tree) {
        sb.setLength(0);
        indentLevel = 0;

        printLine("Tree (name=" + tree.name() + ")");
        increaseIndent();
        schedule(List.of(() -> print(tree.root()), this::decreaseIndent));
        while (!work.isEmpty()) {
            work.pop().run();
        }
        return sb.toString();
    }

    // Run the steps in order, before anything scheduled earlier
    private void schedule(List<Runnable> steps) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            work.push(steps.get(i));
        }
    }

    private void scheduleChildren(List<Runnable> steps, List<Node> children) {
        for (Node child : children) {
            steps.add(() -> print(child));
        }
    }

    // --- Indentation & Node Helpers ---

    private void increaseIndent() { indentLevel++; }
    private void decreaseIndent() { indentLevel--; }

    private void printLine(String line) {
        sb.append(INDENT_CHAR.repeat(indentLevel)).append(line).append("\n");
    }

    private void printNode(String nodeName, int pos, String... fields) {
        StringBuilder fieldsStr = new StringBuilder();
        if (fields.length > 0) {
            fieldsStr.append(" (");
            fieldsStr.append(String.join(", ", fields));
            fieldsStr.append(")");
        }
        printLine(nodeName + fieldsStr + " @ " + SpanUtils.locate(pos, lineIndex));
    }

    // --- Dispatcher ---

    private void print(Node node) {
        if (node instanceof ListNode n) {
            print(n);
        } else if (node instanceof NumberNode n) {
            print(n);
        } else if (node instanceof OperatorNode n) {
            print(n);
        } else if (node instanceof ObjectNode n) {
            print(n);
        }
    }

    // --- Node Printers ---

    private void print(ListNode node) {
        printNode("List", node.pos(), "size=" + node.nodes().size());
        increaseIndent();
        var steps = new ArrayList<Runnable>();
        scheduleChildren(steps, node.nodes());
        steps.add(this::decreaseIndent);
        schedule(steps);
    }

    private void print(NumberNode node) {
        var fields = new ArrayList<String>();
        fields.add("text=" + node.text());
        node.intValue().ifPresent(v -> fields.add("int=" + v));
        node.uintValue().ifPresent(v -> fields.add("uint=" + Long.toUnsignedString(v)));
        node.floatValue().ifPresent(v -> fields.add("float=" + v));
        node.complexValue().ifPresent(v -> fields.add("complex=" + v));
        printNode("Number", node.pos(), fields.toArray(new String[0]));
    }

    private void print(OperatorNode node) {
        var nodeName = switch (node.type()) {
            case DIFF -> "Diff";
            case INTERSECTION -> "Intersection";
            default -> "Union";
        };
        printNode(nodeName, node.pos(), "op=" + node.symbol());
        increaseIndent();
        schedule(List.of(() -> print(node.left()), () -> print(node.right()), this::decreaseIndent));
    }

    private void print(ObjectNode node) {
        printNode("Object", node.pos(), "ident=" + node.ident());
        increaseIndent();
        var steps = new ArrayList<Runnable>();
        if (!node.params().isEmpty()) {
            steps.add(() -> printLine("Params"));
            steps.add(this::increaseIndent);
            scheduleChildren(steps, node.params());
            steps.add(this::decreaseIndent);
        }
        if (!node.locationParams().isEmpty()) {
            steps.add(() -> printLine("Location"));
            steps.add(this::increaseIndent);
            scheduleChildren(steps, node.locationParams());
            steps.add(this::decreaseIndent);
        }
        steps.add(this::decreaseIndent);
        schedule(steps);
    }
}
