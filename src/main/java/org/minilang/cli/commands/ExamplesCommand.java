package org.minilang.cli.commands;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

import org.minilang.cli.CommandLineInterface;
import org.minilang.cli.config.CliSettings;
import org.minilang.compiler.Analyzer;
import org.minilang.compiler.api.AnalysisReport;
import org.minilang.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs the bundled sample programs through the analyzer and prints,
 * per sample, the program followed by its report.
 */
@Command(
    name = "examples",
    description = "Analyze the bundled sample programs"
)
public class ExamplesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExamplesCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        final CliSettings settings;
        final List<ExampleProgram> programs;
        try {
            settings = parent.getSettings();
            programs = ExampleProgram.parse(SourceLoader.loadClasspath(ExampleProgram.RESOURCE).content());
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            log.error("Failed to load examples: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return AnalyzeCommand.EXIT_IO_ERROR;
        }

        Analyzer analyzer = new Analyzer(settings.analyzer());
        int failed = 0;
        for (ExampleProgram program : programs) {
            AnalysisReport report = analyzer.analyze(program.source());
            if (!report.success()) {
                failed++;
            }
            out.println();
            out.println("Testing (" + program.label() + "): " + program.source());
            out.println(report.render());
        }
        out.println();
        out.println(programs.size() + " programs, " + failed + " with errors");
        out.flush();
        return 0;
    }
}
