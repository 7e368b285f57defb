package org.sml;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class AppTest {
    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return App.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String writeSource(String code) throws IOException {
        var file = dir.resolve("doc.sml");
        Files.writeString(file, code, StandardCharsets.UTF_8);
        return file.toString();
    }

    private String[] outLines() {
        return out.toString(StandardCharsets.UTF_8).split("\\R");
    }

    @Test
    void testPrintsTreeBeforeAndAfterReduce() throws IOException {
        var exitCode = run(writeSource("1 - 2\n"));

        assertEquals(App.EXIT_OK, exitCode);
        assertArrayEquals(new String[]{"1 - 2", "1 - 2", "(1)(2)"}, outLines());
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testConcurrentScanner() throws IOException {
        var exitCode = run("--concurrent", writeSource("rect 1 2 @ 3 4 && rect 2 2"));

        assertEquals(App.EXIT_OK, exitCode);
        assertArrayEquals(
            new String[]{"rect 1 2 @ 3 4 && rect 2 2", "rect 1 2 @ 3 4 && rect 2 2", "(rect 1 2 @ 3 4)(rect 2 2)"},
            outLines()
        );
    }

    @Test
    void testSyntaxError() throws IOException {
        var exitCode = run(writeSource("(1 - 2"));

        assertEquals(App.EXIT_SYNTAX, exitCode);
        assertEquals("doc:1:7: unexpected EOF, expected ')' to close '(' at 1:1",
            err.toString(StandardCharsets.UTF_8).strip());
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testMissingFile() {
        var exitCode = run(dir.resolve("missing.sml").toString());

        assertEquals(App.EXIT_IO, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Critical I/O Error: Cannot find file:"));
    }

    @Test
    void testTokenDump() throws IOException {
        var exitCode = run("--tokens", writeSource("1 - 2"));

        assertEquals(App.EXIT_OK, exitCode);
        var output = out.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("\"type\": \"DIFF\""));
        assertTrue(output.contains("\"type\": \"EOF\""));
    }

    @Test
    void testTreeDump() throws IOException {
        var exitCode = run("--tree", writeSource("rect 1 2 @ 3 4"));

        assertEquals(App.EXIT_OK, exitCode);
        var output = out.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Tree (name=doc)"));
        assertTrue(output.contains("Object (ident=rect)"));
    }

    @Test
    void testLongChain() throws IOException {
        var exitCode = run("--tree", writeSource("1" + " || 1".repeat(5000)));

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testNestedTooDeeply() throws IOException {
        var exitCode = run(writeSource("(".repeat(3000) + "1" + ")".repeat(3000)));

        assertEquals(App.EXIT_SYNTAX, exitCode);
        assertEquals("doc:1:257: expression nested too deeply", err.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void testDefaultSample() {
        var exitCode = run();

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals(3, outLines().length);
    }

    @Test
    void testOptions() {
        var options = App.Options.parse(new String[]{"--tree", "a.sml", "--concurrent"});

        assertEquals(new App.Options(false, true, true, "a.sml"), options);
    }
}
