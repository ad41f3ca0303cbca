package org.minilang.compiler.diagnostics;

/**
 * A single message reported by one of the analysis phases.
 * @param category Which part of the error taxonomy the message belongs to.
 * @param message The human-readable message.
 */
public record Diagnostic(Category category, String message) {

    /**
     * Error taxonomy of the analyzer.
     */
    public enum Category {
        /** Malformed identifier, unrecognized character or lone {@code =}. */
        LEXICAL,
        /** Missing keyword or delimiter, unmatched or unterminated block, misplaced {@code else}. */
        SYNTAX,
        /** Undeclared variable, duplicate declaration, unknown type name. */
        SEMANTIC
    }

    @Override
    public String toString() {
        return message;
    }
}
