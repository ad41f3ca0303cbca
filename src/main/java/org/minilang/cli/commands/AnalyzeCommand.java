package org.minilang.cli.commands;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

import org.minilang.cli.CommandLineInterface;
import org.minilang.cli.config.CliSettings;
import org.minilang.cli.config.OutputFormat;
import org.minilang.compiler.Analyzer;
import org.minilang.compiler.api.AnalysisReport;
import org.minilang.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that analyzes one program and prints the report.
 * <p>
 * Exit codes: 0 on success, 1 if diagnostics were reported, 2 if the source or the
 * configuration could not be loaded.
 */
@Command(
    name = "analyze",
    description = "Analyze a program and report the first error, if any"
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_IO_ERROR = 2;

    /**
     * Mutually exclusive inputs: a file or inline program text.
     */
    static class SourceOptions {
        @Option(
            names = {"-f", "--file"},
            description = "Program file to analyze"
        )
        File file;

        @Option(
            names = {"-s", "--source"},
            description = "Program text to analyze"
        )
        String source;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    SourceOptions sourceOptions;

    @Option(
        names = {"--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: cli.output-format)"
    )
    private OutputFormat format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        final CliSettings settings;
        try {
            settings = parent.getSettings();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        final SourceLoader.LoadResult input;
        try {
            input = load();
        } catch (IOException e) {
            log.error("Failed to read {}: {}", sourceOptions.file, e.getMessage());
            err.println("Error: cannot read " + sourceOptions.file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        Analyzer analyzer = new Analyzer(settings.analyzer());
        AnalysisReport report = analyzer.analyze(input.content());
        out.println(ReportWriter.render(report, input.logicalName(), settings.formatOr(format)));
        out.flush();
        return report.success() ? 0 : EXIT_DIAGNOSTICS;
    }

    private SourceLoader.LoadResult load() throws IOException {
        if (sourceOptions.file != null) {
            return SourceLoader.loadFile(sourceOptions.file.toPath());
        }
        return new SourceLoader.LoadResult(sourceOptions.source, "<inline>");
    }
}
