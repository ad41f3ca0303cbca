package org.minilang.compiler.frontend.parser;

import org.minilang.compiler.frontend.parser.features.assign.AssignmentStatementHandler;
import org.minilang.compiler.frontend.parser.features.block.BeginStatementHandler;
import org.minilang.compiler.frontend.parser.features.block.EndStatementHandler;
import org.minilang.compiler.frontend.parser.features.control.ElseStatementHandler;
import org.minilang.compiler.frontend.parser.features.control.IfStatementHandler;
import org.minilang.compiler.frontend.parser.features.control.WhileStatementHandler;
import org.minilang.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers.
 * Maps the type of a statement's first token to its handler.
 */
public class StatementHandlerRegistry {

    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for statements starting with the given token type.
     * @param type    The leading token type.
     * @param handler The handler for this statement.
     */
    public void register(TokenType type, IStatementHandler handler) {
        handlers.put(type, handler);
    }

    /**
     * Looks up the handler for a leading token type.
     * @param type The token type.
     * @return The handler, or empty if no statement starts with this type.
     */
    public Optional<IStatementHandler> get(TokenType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.IDENTIFIER, new AssignmentStatementHandler());
        registry.register(TokenType.WHILE, new WhileStatementHandler());
        registry.register(TokenType.IF, new IfStatementHandler());
        registry.register(TokenType.ELSE, new ElseStatementHandler());
        registry.register(TokenType.BEGIN, new BeginStatementHandler());
        registry.register(TokenType.END, new EndStatementHandler());
        return registry;
    }
}
