package org.minilang.compiler.model;

import java.util.Objects;

/**
 * Represents a single token produced by the lexer.
 * @param type The type of the token.
 * @param text The exact text of the token as it appears in the source, original case preserved.
 */
public record Token(TokenType type, String text) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    /**
     * @return true if this token has the given type.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + " '" + text + "'";
    }
}
