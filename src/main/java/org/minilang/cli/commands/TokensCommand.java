package org.minilang.cli.commands;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

import org.minilang.cli.CommandLineInterface;
import org.minilang.compiler.frontend.io.SourceLoader;
import org.minilang.compiler.frontend.lexer.Lexer;
import org.minilang.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the token list of a program, one {@code TYPE 'text'} per line.
 */
@Command(
    name = "tokens",
    description = "Print the tokens of a program"
)
public class TokensCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokensCommand.class);

    @Option(
        names = {"-f", "--file"},
        description = "Program file to tokenize"
    )
    private File file;

    @Parameters(
        arity = "0..1",
        paramLabel = "SOURCE",
        description = "Program text to tokenize (used when --file is absent)"
    )
    private String source;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            // only the log level applies here
            parent.getSettings();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return AnalyzeCommand.EXIT_IO_ERROR;
        }

        final String text;
        if (file != null) {
            try {
                text = SourceLoader.loadFile(file.toPath()).content();
            } catch (IOException e) {
                log.error("Failed to read {}: {}", file, e.getMessage());
                err.println("Error: cannot read " + file + ": " + e.getMessage());
                return AnalyzeCommand.EXIT_IO_ERROR;
            }
        } else if (source != null) {
            text = source;
        } else {
            throw new ParameterException(spec.commandLine(), "Either --file or SOURCE is required.");
        }

        List<Token> tokens = new Lexer(text).scanTokens();
        for (Token token : tokens) {
            out.println(token);
        }
        out.flush();
        return 0;
    }
}
