package org.minilang.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records the declared variables of one analysis run. Names are case-sensitive and unique;
 * a name is bound once and never updated.
 */
public class SymbolTable {

    private final Map<String, VariableType> symbols = new LinkedHashMap<>();

    /**
     * Defines a variable.
     * @param name The variable name.
     * @param type The declared type.
     * @return true if the name was added, false if it was already defined (the existing binding is kept).
     */
    public boolean define(String name, VariableType type) {
        return symbols.putIfAbsent(name, type) == null;
    }

    /**
     * @return true if the name has been declared.
     */
    public boolean isDefined(String name) {
        return symbols.containsKey(name);
    }

    /**
     * Resolves the declared type of a variable.
     * @param name The variable name.
     * @return The type, or empty if the name is not declared.
     */
    public Optional<VariableType> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return An unmodifiable view of all bindings, in declaration order.
     */
    public Map<String, VariableType> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public int size() {
        return symbols.size();
    }
}
