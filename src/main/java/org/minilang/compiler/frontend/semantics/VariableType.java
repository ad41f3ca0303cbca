package org.minilang.compiler.frontend.semantics;

import java.util.Locale;
import java.util.Optional;

/**
 * The declarable variable types of the mini-language.
 */
public enum VariableType {
    INTEGER("integer"),
    LONGINT("longint"),
    BOOL("bool");

    private final String typeName;

    VariableType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return The type name as written in declarations (lower case).
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Resolves a type name case-insensitively.
     * @param text The text of the token in type position.
     * @return The type, or empty if the text names no known type.
     */
    public static Optional<VariableType> fromName(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.typeName.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return typeName;
    }
}
