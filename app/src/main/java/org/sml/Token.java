package org.sml;

/**
 * A token or text string returned from the scanner.
 *
 * @param type what kind of token this is
 * @param pos  starting offset of the token in the input
 * @param val  the text of the token, or the message for {@link TokenType#ERROR}
 */
public record Token(TokenType type, int pos, String val) {

    boolean is(TokenType type) {
        return this.type == type;
    }

    // Nothing follows an end of input or an error
    boolean isTerminal() {
        return this.type == TokenType.EOF || this.type == TokenType.ERROR;
    }

    // Identifiers and keywords are interchangeable for the grammar
    boolean isWord() {
        return this.type == TokenType.IDENTIFIER || this.type.isKeyword();
    }

    boolean isNumeric() {
        return this.type == TokenType.NUMBER || this.type == TokenType.COMPLEX;
    }

    @Override
    public String toString() {
        if (type == TokenType.EOF) {
            return "EOF";
        }
        if (type == TokenType.ERROR) {
            return val;
        }
        if (type.isKeyword()) {
            return "<" + val + ">";
        }
        if (val.length() > 10) {
            return quote(val.substring(0, 10)) + "...";
        }
        return quote(val);
    }

    static String quote(String text) {
        var escaped = text
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
        return '"' + escaped + '"';
    }
}
