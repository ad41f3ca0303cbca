package org.minilang.compiler.model;

/**
 * Coarse classification of {@link TokenType}s, used for diagnostics and token dumps.
 */
public enum TokenCategory {
    KEYWORD,
    OPERATOR,
    DELIMITER,
    IDENTIFIER,
    LITERAL,
    ERROR
}
