package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.Diagnostic;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.frontend.semantics.VariableType;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates the declaration section that follows {@code var} and fills the symbol table.
 * <p>
 * Grammar: {@code ( name {, name} : type ; )*} up to the {@code begin} keyword.
 * The parser stops at the first violation; groups after a faulty group are not examined.
 */
public class DeclarationParser {

    private final ParsingContext context;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;

    /**
     * Constructs a new declaration parser.
     * @param context The parsing context, positioned after the {@code var} keyword.
     */
    public DeclarationParser(ParsingContext context) {
        this.context = context;
        this.diagnostics = context.getDiagnostics();
        this.symbolTable = context.getSymbolTable();
    }

    /**
     * Parses declaration groups until {@code begin}, the end of the tokens or the first error.
     */
    public void parse() {
        while (!context.isAtEnd() && !context.check(TokenType.BEGIN)) {
            if (!parseGroup()) {
                return;
            }
        }
    }

    private boolean parseGroup() {
        List<String> names = parseNames();
        if (names == null) return false;

        if (context.consume(TokenType.COLON, "missing ':' after variable(s)") == null) {
            return false;
        }

        Optional<VariableType> type = context.isAtEnd()
                ? Optional.empty()
                : VariableType.fromName(context.peek().text());
        if (type.isEmpty()) {
            diagnostics.report(Diagnostic.Category.SEMANTIC,
                    "expected type (integer, longint, bool), found: " + context.currentText());
            return false;
        }
        context.advance();

        for (String name : names) {
            if (!symbolTable.define(name, type.get())) {
                diagnostics.report(Diagnostic.Category.SEMANTIC, "repeated definition of variable: " + name);
                return false;
            }
        }

        return context.consume(TokenType.SEMICOLON, "missing ';' after variable declaration") != null;
    }

    /**
     * Parses {@code name {, name}}.
     * @return The names in source order, or null if an error was reported.
     */
    private List<String> parseNames() {
        Token first = context.peek();
        if (first.is(TokenType.ERROR)) {
            diagnostics.report(Diagnostic.Category.LEXICAL, "invalid identifier: " + first.text());
            return null;
        }
        if (!first.is(TokenType.IDENTIFIER)) {
            diagnostics.reportError("expected identifier, found: " + first.text());
            return null;
        }
        context.advance();

        List<String> names = new ArrayList<>();
        names.add(first.text());
        while (context.match(TokenType.COMMA)) {
            if (!context.check(TokenType.IDENTIFIER)) {
                diagnostics.reportError("expected identifier after comma");
                return null;
            }
            names.add(context.advance().text());
        }
        if (context.check(TokenType.IDENTIFIER)) {
            diagnostics.reportError("missing comma between identifiers");
            return null;
        }
        return names;
    }
}
