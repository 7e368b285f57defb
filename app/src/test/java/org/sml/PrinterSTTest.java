package org.sml;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class PrinterSTTest {
    @Test
    void testObjectTree() {
        var tree = Parser.parse("doc", "rect (1 - 2) @ x");

        var expected = String.join("\n",
            "Tree (name=doc)",
            "  Object (ident=rect) @ 1:1",
            "    Params",
            "      Diff (op=-) @ 1:9",
            "        Number (text=1, int=1, uint=1, float=1.0) @ 1:7",
            "        Number (text=2, int=2, uint=2, float=2.0) @ 1:11",
            "    Location",
            "      Object (ident=x) @ 1:16",
            ""
        );

        assertEquals(expected, new PrinterST(tree.text()).print(tree));
    }

    @Test
    void testReducedTree() {
        var tree = Parser.parse("doc", "a ||\n  b").reduce();

        var expected = String.join("\n",
            "Tree (name=doc)",
            "  List (size=2) @ 1:3",
            "    Object (ident=a) @ 1:1",
            "    Object (ident=b) @ 2:3",
            ""
        );

        assertEquals(expected, new PrinterST(tree.text()).print(tree));
    }

    @Test
    void testLongChain() {
        int terms = 5001;
        var tree = Parser.parse("doc", "1" + " - 1".repeat(terms - 1));

        var lines = new PrinterST(tree.text()).print(tree).split("\n");

        // header, one line per operator, one per number
        assertEquals(1 + (terms - 1) + terms, lines.length);
        assertEquals("  Diff (op=-) @ 1:" + (4 * terms - 5), lines[1]);
        assertTrue(lines[terms].startsWith(" ".repeat(2 * terms) + "Number (text=1"));
    }

    @Test
    void testPrinterIsReusable() {
        var printer = new PrinterST("1 - 2");
        var tree = Parser.parse("doc", "1 - 2");

        assertEquals(printer.print(tree), printer.print(tree));
    }
}
