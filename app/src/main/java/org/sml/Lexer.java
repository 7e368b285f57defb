package org.sml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static org.sml.CharClass.EOF_RUNE;

/**
 * Pull-based scanner. Each state function consumes some input, possibly
 * emits a token, and returns the state to enter next, or null to stop.
 */
public class Lexer implements TokenStream {
    @FunctionalInterface
    interface StateFn {
        StateFn next(Lexer lexer);
    }

    /*
     * Static data
     */
    static final String lineComment = "//";
    static final String leftComment = "/*";
    static final String rightComment = "*/";
    static final String decimalDigits = "0123456789";
    static final String hexDigits = "0123456789abcdefABCDEF";

    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("lexer");

    /*
     * Lexer data
     */
    // the name of the input; used only for error reports
    final String name;
    final String input;

    /*
     * Lexer state
     */
    StateFn state = Lexer::lexBase;
    // current position in the input
    int pos = 0;
    // start position of the pending token
    int start = 0;
    // width of the last rune read, so that it can be put back
    int width = 0;
    // nesting depth of ( ) groups
    int parenDepth = 0;

    /*
     * Output
     */
    final ArrayDeque<Token> pending = new ArrayDeque<>();
    Token last;

    public Lexer(String name, String input) {
        this.name = name;
        this.input = input;
    }

    // Scan the whole input, terminal token included
    public static List<Token> tokenize(String name, String input) {
        var lexer = new Lexer(name, input);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (!token.isTerminal());
        return tokens;
    }

    @Override
    public Token nextToken() {
        while (pending.isEmpty()) {
            if (state == null) {
                // halted, keep repeating the terminal token
                return last;
            }
            state = state.next(this);
        }
        last = pending.poll();
        return last;
    }

    /*
     * Rune level helpers
     */

    // Get the next rune, or EOF_RUNE if the source code ends
    int next() {
        if (pos >= input.length()) {
            width = 0;
            return EOF_RUNE;
        }
        var r = input.codePointAt(pos);
        width = Character.charCount(r);
        pos += width;
        return r;
    }

    int peek() {
        var r = next();
        backup();
        return r;
    }

    // Can only be called once per call of next()
    void backup() {
        pos -= width;
    }

    void emit(TokenType type) {
        var token = new Token(type, start, input.substring(start, pos));
        log.debug("emit " + type + " " + token + " at " + start);
        pending.add(token);
        start = pos;
    }

    // Skip over the pending input before this point
    void ignore() {
        start = pos;
    }

    boolean accept(String valid) {
        var r = next();
        if (r != EOF_RUNE && valid.indexOf(r) >= 0) {
            return true;
        }
        backup();
        return false;
    }

    void acceptRun(String valid) {
        while (accept(valid)) {
            // absorb
        }
    }

    // Emit an error token and stop the scan
    StateFn errorf(String format, Object... args) {
        var message = String.format(format, args);
        log.debug("error in " + name + " at " + start + ": " + message);
        pending.add(new Token(TokenType.ERROR, start, message));
        return null;
    }

    static String describe(int r) {
        return String.format("U+%04X '%s'", r, new String(Character.toChars(r)));
    }

    /*
     * State functions
     */

    StateFn lexBase() {
        if (input.startsWith(lineComment, pos)) {
            return Lexer::lexLineComment;
        }
        if (input.startsWith(leftComment, pos)) {
            return Lexer::lexBlockComment;
        }
        if (input.startsWith("&&", pos)) {
            pos += 2;
            emit(TokenType.INTERSECTION);
            return Lexer::lexBase;
        }
        if (input.startsWith("||", pos)) {
            pos += 2;
            emit(TokenType.UNION);
            return Lexer::lexBase;
        }

        var r = next();
        switch (CharClass.classOfChar(r)) {
            case WS, NL -> {
                return Lexer::lexSpace;
            }
            case PLUS, MINUS -> {
                backup();
                return Lexer::lexNumber;
            }
            case DIGIT -> {
                backup();
                // only ASCII digits start a number, the rest are letters to us
                return r >= '0' && r <= '9' ? Lexer::lexNumber : Lexer::lexIdentifier;
            }
            case LETTER, UNDERSCORE -> {
                backup();
                return Lexer::lexIdentifier;
            }
            case LPAREN -> {
                emit(TokenType.LEFT_PAREN);
                parenDepth++;
                return Lexer::lexBase;
            }
            case RPAREN -> {
                emit(TokenType.RIGHT_PAREN);
                parenDepth--;
                if (parenDepth < 0) {
                    return errorf("unexpected right paren %s", describe(r));
                }
                return Lexer::lexBase;
            }
            case AT -> {
                emit(TokenType.LOCATION);
                return Lexer::lexBase;
            }
            case QUOTE -> {
                return Lexer::lexQuote;
            }
            case EOF -> {
                emit(TokenType.EOF);
                return null;
            }
            default -> {
                return errorf("unrecognized character: %s", describe(r));
            }
        }
    }

    StateFn lexLineComment() {
        pos += lineComment.length();
        var i = input.indexOf('\n', pos);
        if (i < 0) {
            // comment runs to the end of input
            pos = input.length();
            ignore();
            emit(TokenType.EOF);
            return null;
        }
        pos = i + 1;
        ignore();
        return Lexer::lexBase;
    }

    StateFn lexBlockComment() {
        pos += leftComment.length();
        var i = input.indexOf(rightComment, pos);
        if (i < 0) {
            return errorf("unclosed comment");
        }
        pos = i + rightComment.length();
        ignore();
        return Lexer::lexBase;
    }

    // One space has already been seen
    StateFn lexSpace() {
        while (CharClass.classOfChar(peek()).isSpace()) {
            next();
        }
        emit(TokenType.SPACE);
        return Lexer::lexBase;
    }

    StateFn lexIdentifier() {
        while (true) {
            var r = next();
            if (CharClass.classOfChar(r).isAlphaNumeric()) {
                continue;
            }
            backup();
            var word = input.substring(start, pos);
            if (!atTerminator()) {
                return errorf("bad character %s", describe(peek()));
            }

            var keyword = TokenType.keyword(word);
            if (keyword != null) {
                emit(keyword);
            } else if (word.equals("true") || word.equals("false")) {
                emit(TokenType.BOOL);
            } else {
                emit(TokenType.IDENTIFIER);
            }
            return Lexer::lexBase;
        }
    }

    // Whether the next rune may directly follow an identifier
    boolean atTerminator() {
        return CharClass.classOfChar(peek()).isTerminator();
    }

    // Decimal, octal, hex, float or imaginary. Not a perfect number scanner,
    // "089" and "0x0.2" get through; the parser rejects what it can't read.
    StateFn lexNumber() {
        if (atBareSign()) {
            var sign = next();
            var after = CharClass.classOfChar(peek());
            if (sign == '-' && (after.isSpace() || after == CharClass.LPAREN)) {
                emit(TokenType.DIFF);
                return Lexer::lexBase;
            }
            return errorf("bad number syntax: %s", Token.quote(input.substring(start, pos)));
        }

        if (!scanNumber()) {
            return errorf("bad number syntax: %s", Token.quote(input.substring(start, pos)));
        }
        var sign = peek();
        if (sign == '+' || sign == '-') {
            // Complex: 1+2i. No spaces, must end in 'i'.
            if (!scanNumber() || input.charAt(pos - 1) != 'i') {
                return errorf("bad number syntax: %s", Token.quote(input.substring(start, pos)));
            }
            emit(TokenType.COMPLEX);
        } else {
            emit(TokenType.NUMBER);
        }
        return Lexer::lexBase;
    }

    // A sign that no digits or dot follow
    boolean atBareSign() {
        if (!CharClass.classOfChar(peek()).isSign()) {
            return false;
        }
        var after = pos + 1;
        if (after >= input.length()) {
            return true;
        }
        var c = input.charAt(after);
        return !(c >= '0' && c <= '9') && c != '.';
    }

    boolean scanNumber() {
        // Optional leading sign
        accept("+-");
        // Is it hex?
        var digits = decimalDigits;
        if (accept("0") && accept("xX")) {
            digits = hexDigits;
        }
        acceptRun(digits);
        if (accept(".")) {
            acceptRun(digits);
        }
        if (accept("eE")) {
            accept("+-");
            acceptRun(decimalDigits);
        }
        // Is it imaginary?
        accept("i");
        // Next thing mustn't be alphanumeric
        if (CharClass.classOfChar(peek()).isAlphaNumeric()) {
            next();
            return false;
        }
        return true;
    }

    // The opening quote has already been consumed
    StateFn lexQuote() {
        while (true) {
            var r = next();
            if (r == '\\') {
                r = next();
                if (r != EOF_RUNE && r != '\n') {
                    continue;
                }
                return errorf("unterminated quoted string");
            }
            if (r == EOF_RUNE || r == '\n') {
                return errorf("unterminated quoted string");
            }
            if (r == '"') {
                break;
            }
        }
        emit(TokenType.STRING);
        return Lexer::lexBase;
    }
}
