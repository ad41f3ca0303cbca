package org.minilang.compiler.frontend.parser.features.assign;

import org.minilang.compiler.diagnostics.Diagnostic;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.parser.IStatementHandler;
import org.minilang.compiler.frontend.parser.ParsingContext;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

/**
 * Handler for assignment statements.
 * Expected format: {@code <declared name> := <number | declared name> ;}
 */
public class AssignmentStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        DiagnosticsEngine diagnostics = context.getDiagnostics();
        SymbolTable symbols = context.getSymbolTable();

        Token target = context.peek();
        if (!symbols.isDefined(target.text())) {
            diagnostics.report(Diagnostic.Category.SEMANTIC, "undefined variable: " + target.text());
            return;
        }
        context.advance();

        if (reportedLexicalError(context)) {
            return;
        }
        if (context.consume(TokenType.ASSIGN, "missing ':=' after identifier: " + target.text()) == null) {
            return;
        }

        if (reportedLexicalError(context)) {
            return;
        }
        if (!context.check(TokenType.NUMBER) && !context.check(TokenType.IDENTIFIER)) {
            diagnostics.reportError("expected number or identifier after ':=', found: " + context.currentText());
            return;
        }
        Token value = context.advance();
        if (value.is(TokenType.IDENTIFIER) && !symbols.isDefined(value.text())) {
            diagnostics.report(Diagnostic.Category.SEMANTIC, "undefined variable in assignment: " + value.text());
            return;
        }

        context.consume(TokenType.SEMICOLON, "missing ';' after assignment");
    }

    /**
     * Reports a malformed token (for example a lone {@code =}) in operator or operand position.
     * @return true if the current token was a lexical error.
     */
    private boolean reportedLexicalError(ParsingContext context) {
        if (!context.check(TokenType.ERROR)) {
            return false;
        }
        context.getDiagnostics().report(Diagnostic.Category.LEXICAL,
                "invalid token in realization: " + context.currentText());
        return true;
    }
}
