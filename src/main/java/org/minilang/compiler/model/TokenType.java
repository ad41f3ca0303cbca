package org.minilang.compiler.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Defines the types of tokens that the lexer can produce.
 * Keyword types carry their lower-case spelling, operators and delimiters their fixed lexeme.
 */
public enum TokenType {
    // Keywords
    VAR(TokenCategory.KEYWORD, "var"),
    INTEGER(TokenCategory.KEYWORD, "integer"),
    LONGINT(TokenCategory.KEYWORD, "longint"),
    BOOL(TokenCategory.KEYWORD, "bool"),
    IF(TokenCategory.KEYWORD, "if"),
    THEN(TokenCategory.KEYWORD, "then"),
    ELSE(TokenCategory.KEYWORD, "else"),
    WHILE(TokenCategory.KEYWORD, "while"),
    DO(TokenCategory.KEYWORD, "do"),
    FOR(TokenCategory.KEYWORD, "for"),
    BEGIN(TokenCategory.KEYWORD, "begin"),
    END(TokenCategory.KEYWORD, "end"),
    AND(TokenCategory.KEYWORD, "and"),
    OR(TokenCategory.KEYWORD, "or"),

    // Operators
    PLUS(TokenCategory.OPERATOR, "+"),
    MINUS(TokenCategory.OPERATOR, "-"),
    STAR(TokenCategory.OPERATOR, "*"),
    SLASH(TokenCategory.OPERATOR, "/"),
    ASSIGN(TokenCategory.OPERATOR, ":="),
    LESS(TokenCategory.OPERATOR, "<"),
    GREATER(TokenCategory.OPERATOR, ">"),
    NOT_EQUAL(TokenCategory.OPERATOR, "<>"),
    GREATER_EQUAL(TokenCategory.OPERATOR, ">="),
    LESS_EQUAL(TokenCategory.OPERATOR, "<="),
    EQUAL_EQUAL(TokenCategory.OPERATOR, "=="),

    // Delimiters
    SEMICOLON(TokenCategory.DELIMITER, ";"),
    COLON(TokenCategory.DELIMITER, ":"),
    LEFT_PAREN(TokenCategory.DELIMITER, "("),
    RIGHT_PAREN(TokenCategory.DELIMITER, ")"),
    COMMA(TokenCategory.DELIMITER, ","),

    IDENTIFIER(TokenCategory.IDENTIFIER, null),
    NUMBER(TokenCategory.LITERAL, null),
    ERROR(TokenCategory.ERROR, null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.category == TokenCategory.KEYWORD) {
                KEYWORDS.put(type.lexeme, type);
            }
        }
    }

    private final TokenCategory category;
    private final String lexeme;

    TokenType(TokenCategory category, String lexeme) {
        this.category = category;
        this.lexeme = lexeme;
    }

    /**
     * @return The category of this token type.
     */
    public TokenCategory category() {
        return category;
    }

    /**
     * @return The fixed spelling of this type, or {@code null} for identifiers, numbers and errors.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * Looks up a keyword case-insensitively.
     * @param word The scanned word in its original casing.
     * @return The keyword type, or empty if the word is not a keyword.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }
}
