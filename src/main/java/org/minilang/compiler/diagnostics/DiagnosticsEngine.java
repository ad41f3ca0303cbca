package org.minilang.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one analysis run. The list is append-only and keeps
 * insertion order.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a syntax error.
     * @param message The error message.
     */
    public void reportError(String message) {
        report(Diagnostic.Category.SYNTAX, message);
    }

    /**
     * Reports an error of the given category.
     * @param category The taxonomy category.
     * @param message The error message.
     */
    public void report(Diagnostic.Category category, String message) {
        diagnostics.add(new Diagnostic(category, message));
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return An unmodifiable view of the reported diagnostics, in insertion order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The plain messages, in insertion order.
     */
    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::message).collect(Collectors.toList());
    }

    /**
     * @return All messages joined by newlines, or an empty string if there are none.
     */
    public String summary() {
        return String.join("\n", messages());
    }
}
