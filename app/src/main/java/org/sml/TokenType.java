package org.sml;

import java.util.Map;

public enum TokenType {
    // error occurred; value is the text of the error
    ERROR,
    // true or false
    BOOL,
    // complex constant (1+2i); a plain imaginary is just a number
    COMPLEX,
    EOF,
    // alphanumeric identifier
    IDENTIFIER,
    LEFT_PAREN,
    // simple number, including imaginary
    NUMBER,
    RIGHT_PAREN,
    // run of spaces separating arguments
    SPACE,
    // quoted string, quotes included
    STRING,
    // -
    DIFF,
    // &&
    INTERSECTION,
    // ||
    UNION,
    // @
    LOCATION,
    /*
     * Keywords go after this marker, nothing else does
     */
    KEYWORD,
    RECT;

    static final Map<String, TokenType> keywords = Map.of(
        "rect", RECT
    );

    public boolean isKeyword() {
        return this.ordinal() > KEYWORD.ordinal();
    }

    // Keyword type of the word, or null if it is not a keyword
    static TokenType keyword(String word) {
        return keywords.get(word);
    }
}
