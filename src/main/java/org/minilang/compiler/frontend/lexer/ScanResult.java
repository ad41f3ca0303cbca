package org.minilang.compiler.frontend.lexer;

import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

/**
 * Outcome of a single scan step of the {@link Lexer}: either a well-formed token
 * or the text of a lexical error.
 */
public sealed interface ScanResult {

    /**
     * Converts this result into the token that is placed into the token stream.
     * Lexical errors become {@link TokenType#ERROR} tokens so that the parsers report
     * them at the position where they occur.
     * @return The token for the stream.
     */
    Token toToken();

    /**
     * A successfully scanned token.
     * @param token The token.
     */
    record Scanned(Token token) implements ScanResult {
        @Override
        public Token toToken() {
            return token;
        }
    }

    /**
     * Malformed input: a digit-led or non-alphanumeric word, an unknown character or a lone {@code =}.
     * @param text The offending source text.
     */
    record LexicalError(String text) implements ScanResult {
        @Override
        public Token toToken() {
            return new Token(TokenType.ERROR, text);
        }
    }
}
