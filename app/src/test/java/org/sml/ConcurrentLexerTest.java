package org.sml;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

class ConcurrentLexerTest {
    private static final String code = "(rect 4 2 @ 0 0 || rect 2 4 @ 1 -1) - rect 1 1\n  && circle 1+2i // done\n";

    private static List<Token> drain(TokenStream tokens) {
        var result = new ArrayList<Token>();
        Token token;
        do {
            token = tokens.nextToken();
            result.add(token);
        } while (!token.isTerminal());
        return result;
    }

    @Test
    void testSameTokensAsLexer() throws InterruptedException {
        try (var lexer = new ConcurrentLexer("test", code)) {
            assertEquals(Lexer.tokenize("test", code), drain(lexer));

            lexer.join(5000);
            assertFalse(lexer.isRunning());
        }
    }

    @Test
    void testRepeatsTerminalToken() {
        try (var lexer = new ConcurrentLexer("test", "1 +")) {
            var tokens = drain(lexer);
            var last = tokens.get(tokens.size() - 1);

            assertEquals(TokenType.ERROR, last.type());
            assertEquals(last, lexer.nextToken());
            assertEquals(last, lexer.nextToken());
        }
    }

    @Test
    void testSameTreeAsParser() {
        assertEquals(Parser.parse("test", code), Parser.parseConcurrent("test", code));
    }

    @Test
    void testSameErrorAsParser() {
        var expected = assertThrows(ScanException.class, () -> Parser.parse("test", "1 - (2 #)"));
        var actual = assertThrows(ScanException.class, () -> Parser.parseConcurrent("test", "1 - (2 #)"));

        assertEquals(expected.getMessage(), actual.getMessage());
    }

    @Test
    void testCloseStopsScanner() throws InterruptedException {
        var lexer = new ConcurrentLexer("test", code);
        lexer.nextToken();

        lexer.close();
        lexer.join(5000);

        assertFalse(lexer.isRunning());
    }

    @Test
    void testParseErrorStopsScanner() throws InterruptedException {
        // the parser gives up on the second token, long before the scanner is done
        var lexer = new ConcurrentLexer("test", "1 2 3 4 5 6 7 8 9");

        assertThrows(ParseException.class,
            () -> Parser.parse("test", "1 2 3 4 5 6 7 8 9", lexer, CancellationToken.none()));
        lexer.join(5000);

        assertFalse(lexer.isRunning());
    }
}
