package org.sml;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive descent parser over a {@link TokenStream}. Spaces separate
 * grammatical units and are otherwise ignored.
 *
 * <pre>
 * Expression = Term { '||' Term }
 * Term       = Factor { ( '&amp;&amp;' | '-' ) Factor }
 * Factor     = Number | Object | '(' Expression ')'
 * Object     = Ident { Param } [ '@' { Param } ]
 * Param      = Number | Ident | '(' Expression ')'
 * </pre>
 *
 * The first error ends the parse; there is no recovery.
 */
public class Parser {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("parser");

    // deepest ( ) nesting accepted; trees are walked recursively through groups
    static final int MAX_NESTING = 256;

    /*
     * Parser data
     */
    final String name;
    final String text;
    final TokenStream tokens;
    final CancellationToken cancellation;
    final List<Integer> lineIndex;

    /*
     * Parser state
     */
    // one token of lookahead, never a space
    Token peeked;
    // number of groups currently open
    int nesting = 0;

    Parser(String name, String text, TokenStream tokens, CancellationToken cancellation) {
        this.name = name;
        this.text = text;
        this.tokens = tokens;
        this.cancellation = cancellation;
        this.lineIndex = SpanUtils.lineIndex(text);
    }

    public static Tree parse(String name, String text) {
        return parse(name, text, new Lexer(name, text), CancellationToken.none());
    }

    // Parse with the scanner on its own thread
    public static Tree parseConcurrent(String name, String text) {
        return parse(name, text, new ConcurrentLexer(name, text), CancellationToken.none());
    }

    /**
     * Parse one document from the given token stream. The stream is closed
     * when the parse ends, successfully or not.
     *
     * @throws ScanException  if the scanner hit malformed input
     * @throws ParseException if the tokens don't form an expression
     */
    public static Tree parse(String name, String text, TokenStream tokens, CancellationToken cancellation) {
        try (tokens) {
            return new Parser(name, text, tokens, cancellation).parseTree();
        }
    }

    Tree parseTree() {
        log.debug("parse " + name);

        var root = this.parseExpression();

        var next = this.nextToken();
        if (!next.is(TokenType.EOF)) {
            throw fail(next, "end of input");
        }

        return new Tree(name, text, root);
    }

    Node parseExpression() {
        log.debug("parse expression");

        var left = this.parseTerm();
        while (this.peek().is(TokenType.UNION)) {
            var op = this.nextToken();
            var right = this.parseTerm();
            left = new UnionNode(op.pos(), left, right);
        }
        return left;
    }

    Node parseTerm() {
        log.debug("parse term");

        var left = this.parseFactor();
        while (true) {
            var op = this.peek();
            if (op.is(TokenType.INTERSECTION)) {
                this.nextToken();
                left = new IntersectionNode(op.pos(), left, this.parseFactor());
            } else if (op.is(TokenType.DIFF)) {
                this.nextToken();
                left = new DiffNode(op.pos(), left, this.parseFactor());
            } else {
                return left;
            }
        }
    }

    Node parseFactor() {
        log.debug("parse factor");

        var token = this.nextToken();
        if (token.isNumeric()) {
            return this.parseNumber(token);
        }
        if (token.isWord()) {
            return this.parseObject(token);
        }
        if (token.is(TokenType.LEFT_PAREN)) {
            return this.parseGroup(token);
        }
        throw fail(token, "number, object or '('");
    }

    ObjectNode parseObject(Token ident) {
        log.debug("parse object " + ident.val());

        var params = this.parseParams();

        var locationParams = new ArrayList<Node>();
        if (this.peek().is(TokenType.LOCATION)) {
            this.nextToken();
            locationParams = this.parseParams();
        }

        return new ObjectNode(ident.pos(), ident.val(), params, locationParams);
    }

    ArrayList<Node> parseParams() {
        var params = new ArrayList<Node>();
        while (isParamStart(this.peek())) {
            params.add(this.parseParam());
        }
        return params;
    }

    boolean isParamStart(Token token) {
        return token.isNumeric() || token.isWord() || token.is(TokenType.LEFT_PAREN);
    }

    Node parseParam() {
        var token = this.nextToken();
        if (token.isNumeric()) {
            return this.parseNumber(token);
        }
        if (token.isWord()) {
            return new ObjectNode(token.pos(), token.val());
        }
        if (token.is(TokenType.LEFT_PAREN)) {
            return this.parseGroup(token);
        }
        throw fail(token, "parameter");
    }

    // The '(' has already been consumed
    Node parseGroup(Token open) {
        if (this.nesting >= MAX_NESTING) {
            throw new ParseException(name, open.pos(), locate(open.pos()), "expression nested too deeply");
        }

        this.nesting++;
        var expr = this.parseExpression();
        this.nesting--;

        var close = this.nextToken();
        if (!close.is(TokenType.RIGHT_PAREN)) {
            throw fail(close, "')' to close '(' at " + locate(open.pos()));
        }
        return expr;
    }

    NumberNode parseNumber(Token token) {
        try {
            return NumberNode.parse(token.pos(), token.val(), token.type());
        } catch (NumberFormatException e) {
            throw new ParseException(
                name, token.pos(), locate(token.pos()),
                "illegal number syntax: " + Token.quote(token.val()), e
            );
        }
    }

    /*
     * Token helpers
     */

    // Next token that is not a space
    Token nextToken() {
        if (this.peeked != null) {
            var token = this.peeked;
            this.peeked = null;
            return token;
        }

        while (true) {
            cancellation.throwIfCancelled("parse");
            var token = tokens.nextToken();
            log.debug("[" + token.type() + "] " + token + " at " + locate(token.pos()));
            if (!token.is(TokenType.SPACE)) {
                return token;
            }
        }
    }

    Token peek() {
        if (this.peeked == null) {
            this.peeked = this.nextToken();
        }
        return this.peeked;
    }

    SpanUtils.Location locate(int pos) {
        return SpanUtils.locate(pos, this.lineIndex);
    }

    // A scanner error wins over whatever the grammar expected
    SmlException fail(Token token, String expected) {
        // an unbalanced ')' is followed by the scanner's report of it
        if (token.is(TokenType.RIGHT_PAREN) && this.peek().is(TokenType.ERROR)) {
            token = this.peek();
        }
        if (token.is(TokenType.ERROR)) {
            return new ScanException(name, token.pos(), locate(token.pos()), token.val());
        }
        return new ParseException(
            name, token.pos(), locate(token.pos()),
            MessageFormat.format("unexpected {0}, expected {1}", token, expected)
        );
    }
}
