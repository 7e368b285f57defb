package org.sml;

enum CharClass {
    // basic
    LETTER, DIGIT, UNDERSCORE, DOT,
    // strings
    QUOTE, BACKSLASH,
    // whitespaces
    NL, WS,
    // signs
    PLUS, MINUS,
    // separators allowed right after an identifier
    COMMA, COLON,
    // parens
    LPAREN, RPAREN,
    // set operators and placement
    AMPERSAND, PIPE, AT,
    // comments
    SLASH, STAR,
    /*
     * special
     */
    // end of input, never a real character
    EOF,
    // represents a character outside of allowed alphabet
    NOT_A_CHAR;

    static final int EOF_RUNE = -1;

    static CharClass classOfChar(int c) {
        if (c == EOF_RUNE) return EOF;

        // First, check for character groups (letters and digits)
        if (Character.isLetter(c)) return LETTER;
        if (Character.isDigit(c)) return DIGIT;

        // Then, switch on specific single characters
        return switch (c) {
            case '_' -> UNDERSCORE;
            case '.' -> DOT;
            case '"' -> QUOTE;
            case '\\' -> BACKSLASH;
            case '\n', '\r' -> NL;
            case ' ', '\t' -> WS;
            case '+' -> PLUS;
            case '-' -> MINUS;
            case ',' -> COMMA;
            case ':' -> COLON;
            case '(' -> LPAREN;
            case ')' -> RPAREN;
            case '&' -> AMPERSAND;
            case '|' -> PIPE;
            case '@' -> AT;
            case '/' -> SLASH;
            case '*' -> STAR;
            default -> NOT_A_CHAR;
        };
    }

    boolean isSpace() {
        return this == WS || this == NL;
    }

    boolean isAlphaNumeric() {
        return this == LETTER || this == DIGIT || this == UNDERSCORE;
    }

    boolean isSign() {
        return this == PLUS || this == MINUS;
    }

    // Whether the class may directly follow an identifier
    boolean isTerminator() {
        return switch (this) {
            case WS, NL, EOF, DOT, COMMA, PIPE, COLON, RPAREN, LPAREN -> true;
            default -> false;
        };
    }
}
