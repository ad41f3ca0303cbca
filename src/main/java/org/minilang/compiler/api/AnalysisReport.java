package org.minilang.compiler.api;

import org.minilang.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of analyzing one program.
 *
 * @param success     true if no diagnostic was reported.
 * @param diagnostics The reported diagnostics in the order they were reported.
 */
public record AnalysisReport(boolean success, List<Diagnostic> diagnostics) {

    public static final String SUCCESS_LINE = "Analysis successful: No errors found.";
    public static final String FAILURE_HEADER = "Errors found:";

    public AnalysisReport {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Creates a report from the diagnostics of a finished run.
     * @param diagnostics The diagnostics; an empty list means success.
     * @return The report.
     */
    public static AnalysisReport of(List<Diagnostic> diagnostics) {
        return new AnalysisReport(diagnostics.isEmpty(), diagnostics);
    }

    /**
     * @return The plain diagnostic messages in report order.
     */
    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::message).collect(Collectors.toList());
    }

    /**
     * Renders the report for console output: a success line, or a header followed by
     * one {@code - message} line per diagnostic.
     * @return The rendered text, lines separated by {@code \n}.
     */
    public String render() {
        if (success) {
            return SUCCESS_LINE;
        }
        StringBuilder sb = new StringBuilder(FAILURE_HEADER);
        for (Diagnostic diagnostic : diagnostics) {
            sb.append("\n- ").append(diagnostic.message());
        }
        return sb.toString();
    }
}
