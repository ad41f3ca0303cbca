package org.minilang.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.minilang.cli.config.OutputFormat;
import org.minilang.compiler.api.AnalysisReport;
import org.minilang.compiler.diagnostics.Diagnostic;

/**
 * Renders {@link AnalysisReport}s in the selected {@link OutputFormat}.
 */
final class ReportWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ReportWriter() {
    }

    static String render(AnalysisReport report, String sourceName, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return GSON.toJson(toJson(report, sourceName));
        }
        return report.render();
    }

    static JsonObject toJson(AnalysisReport report, String sourceName) {
        JsonObject root = new JsonObject();
        root.addProperty("source", sourceName);
        root.addProperty("success", report.success());
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic diagnostic : report.diagnostics()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("category", diagnostic.category().name());
            entry.addProperty("message", diagnostic.message());
            diagnostics.add(entry);
        }
        root.add("diagnostics", diagnostics);
        return root;
    }
}
