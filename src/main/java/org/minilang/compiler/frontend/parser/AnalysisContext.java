package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.semantics.SymbolTable;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

import java.util.List;

/**
 * The state owned by a single analysis run: the token cursor, the symbol table,
 * the block stack and the diagnostics. A new context is created for every run and
 * passed explicitly through all phases.
 */
public class AnalysisContext implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable = new SymbolTable();
    private final BlockStack blockStack = new BlockStack();
    private int current = 0;

    /**
     * Constructs a new context over a token list.
     * @param tokens The tokens produced by the lexer.
     * @param diagnostics The engine for reporting errors.
     */
    public AnalysisContext(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = List.copyOf(tokens);
        this.diagnostics = diagnostics;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (isAtEnd()) return null;
        return tokens.get(current++);
    }

    @Override
    public Token peek() {
        if (isAtEnd()) return null;
        return tokens.get(current);
    }

    @Override
    public String currentText() {
        return isAtEnd() ? "none" : peek().text();
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        diagnostics.reportError(errorMessage);
        return null;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    @Override
    public BlockStack getBlockStack() {
        return blockStack;
    }

    @Override
    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    /**
     * @return The index of the current token.
     */
    public int position() {
        return current;
    }
}
