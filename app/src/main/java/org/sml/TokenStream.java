package org.sml;

/**
 * Source of tokens for the parser. The last token of every stream is either
 * {@link TokenType#EOF} or {@link TokenType#ERROR}; asking for more after
 * that returns the same token again.
 */
public interface TokenStream extends AutoCloseable {
    Token nextToken();

    @Override
    default void close() {
    }
}
