package org.minilang.compiler;

import org.minilang.compiler.api.AnalysisReport;
import org.minilang.compiler.diagnostics.DiagnosticsEngine;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.frontend.parser.AnalysisContext;
import org.minilang.compiler.frontend.parser.DeclarationParser;
import org.minilang.compiler.frontend.parser.StatementParser;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The main entry point of the analyzer. Runs the lexer and then the two validation phases
 * ({@code var} section, then {@code begin ... end} section) over a fresh {@link AnalysisContext}.
 * Every phase stops at its first violation, so a failed report normally holds one diagnostic.
 * <p>
 * Instances keep no per-run state and may be shared between threads.
 */
public class Analyzer {

    private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

    private final AnalyzerSettings settings;

    public Analyzer() {
        this(AnalyzerSettings.DEFAULT);
    }

    /**
     * @param settings The analyzer settings.
     */
    public Analyzer(AnalyzerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Analyzes a program.
     * @param source The program text.
     * @return The report; never null, never throws for any non-null source.
     */
    public AnalysisReport analyze(String source) {
        Objects.requireNonNull(source, "source");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        if (source.length() > settings.maxSourceLength()) {
            diagnostics.reportError("source exceeds maximum length of " + settings.maxSourceLength() + " characters");
            return finish(diagnostics);
        }

        List<Token> tokens = new Lexer(source).scanTokens();
        log.debug("Lexer produced {} tokens", tokens.size());
        if (tokens.isEmpty()) {
            diagnostics.reportError("empty program");
            return finish(diagnostics);
        }

        AnalysisContext context = new AnalysisContext(tokens, diagnostics);
        if (!context.match(TokenType.VAR)) {
            diagnostics.reportError("program must start with 'var'");
            return finish(diagnostics);
        }

        new DeclarationParser(context).parse();
        log.debug("Declaration section done: {} variables, errors={}",
                context.getSymbolTable().size(), diagnostics.hasErrors());
        if (diagnostics.hasErrors()) {
            return finish(diagnostics);
        }
        if (!context.match(TokenType.BEGIN)) {
            diagnostics.reportError("missing 'begin' after definition body");
            return finish(diagnostics);
        }

        new StatementParser(context).parseRealization();
        if (!diagnostics.hasErrors() && !context.check(TokenType.END)) {
            diagnostics.reportError("missing 'end' at program termination");
        }
        return finish(diagnostics);
    }

    private AnalysisReport finish(DiagnosticsEngine diagnostics) {
        AnalysisReport report = AnalysisReport.of(diagnostics.getDiagnostics());
        if (report.success()) {
            log.debug("Analysis finished without errors");
        } else {
            log.debug("Analysis failed: {}", diagnostics.summary());
        }
        return report;
    }
}
