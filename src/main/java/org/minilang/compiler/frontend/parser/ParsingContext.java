package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

/**
 * Provides the validators and statement handlers with access to the token stream and
 * to the per-run state (symbol table, block stack, diagnostics).
 * This interface decouples handlers from the concrete {@link AnalysisContext}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise (also at the end of the stream).
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token, or null if the stream is exhausted.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token, or null if the stream is exhausted.
     */
    Token peek();

    /**
     * Returns the text of the current token for use in diagnostics.
     * @return The token text, or {@code "none"} if the stream is exhausted.
     */
    String currentText();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports a syntax error.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token, or null if the type did not match.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * @return The symbol table of this run.
     */
    SymbolTable getSymbolTable();

    /**
     * @return The stack of open blocks of this run.
     */
    BlockStack getBlockStack();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
