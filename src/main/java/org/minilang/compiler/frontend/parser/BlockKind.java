package org.minilang.compiler.frontend.parser;

/**
 * The block-opening keywords whose {@code end} is still outstanding.
 */
public enum BlockKind {
    BEGIN("begin"),
    IF("if"),
    WHILE("while");

    private final String keyword;

    BlockKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The opening keyword as written in source (lower case).
     */
    public String keyword() {
        return keyword;
    }
}
