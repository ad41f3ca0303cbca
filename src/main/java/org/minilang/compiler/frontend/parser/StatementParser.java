package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.Diagnostic;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

import java.util.Optional;

/**
 * Validates the realization section. Statements are dispatched by their first token through a
 * {@link StatementHandlerRegistry}; block nesting is tracked on the context's {@link BlockStack}.
 * <p>
 * Parsing ends at the {@code end} that closes the last open block (left unconsumed), when the
 * tokens run out, or at the first reported error.
 */
public class StatementParser {

    private final ParsingContext context;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry registry;

    /**
     * Constructs a statement parser with the built-in statement handlers.
     * @param context The parsing context.
     */
    public StatementParser(ParsingContext context) {
        this(context, StatementHandlerRegistry.initialize());
    }

    /**
     * Constructs a statement parser with a custom handler registry.
     * @param context  The parsing context.
     * @param registry The statement handlers to dispatch to.
     */
    public StatementParser(ParsingContext context, StatementHandlerRegistry registry) {
        this.context = context;
        this.diagnostics = context.getDiagnostics();
        this.registry = registry;
    }

    /**
     * Parses the body of the program. The caller has consumed the outer {@code begin};
     * it is recorded here as the outermost block.
     */
    public void parseRealization() {
        context.getBlockStack().push(BlockKind.BEGIN);
        parse();
    }

    /**
     * Parses statements until the open blocks are closed, the tokens run out or an error is reported.
     * Blocks that were already open when this method was entered are left for the caller to report.
     */
    public void parse() {
        BlockStack blocks = context.getBlockStack();
        int enclosingDepth = blocks.depth();
        while (!context.isAtEnd() && !diagnostics.hasErrors()) {
            Token token = context.peek();
            Optional<IStatementHandler> handler = registry.get(token.type());
            if (handler.isPresent()) {
                handler.get().parse(context);
                if (token.is(TokenType.END) && blocks.isEmpty()) {
                    return;
                }
            } else if (token.is(TokenType.ERROR)) {
                diagnostics.report(Diagnostic.Category.LEXICAL, "invalid token in realization: " + token.text());
            } else {
                diagnostics.reportError("unexpected token: " + token.text());
            }
        }

        if (!diagnostics.hasErrors() && blocks.depth() > enclosingDepth) {
            diagnostics.reportError("missing 'end' to match '" + blocks.peek().orElseThrow().keyword() + "'");
        }
    }
}
