package org.minilang.compiler.frontend.parser;

/**
 * Handler interface for the statements of the realization section.
 * A handler is selected by the type of the statement's first token, consumes the
 * statement and reports at most one diagnostic.
 */
public interface IStatementHandler {

    /**
     * Parses one statement starting at the current token.
     * @param context The parsing context providing access to the token stream and run state.
     */
    void parse(ParsingContext context);
}
