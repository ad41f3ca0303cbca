package org.minilang.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.minilang.cli.commands.AnalyzeCommand;
import org.minilang.cli.commands.ExamplesCommand;
import org.minilang.cli.commands.TokensCommand;
import org.minilang.cli.config.CliSettings;
import org.minilang.cli.config.ConfigLoader;
import org.minilang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "minilang",
    mixinStandardHelpOptions = true,
    version = "minilang-analyzer 1.0",
    description = "Front-end analyzer for the var/begin/end teaching language",
    subcommands = {
        AnalyzeCommand.class,
        TokensCommand.class,
        ExamplesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/minilang.conf)"
    )
    private File configFile;

    private CliSettings settings;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minilang");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its log level.
     *
     * @return the settings of this invocation.
     * @throws IllegalArgumentException            if the given config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public CliSettings getSettings() {
        if (settings == null) {
            settings = ConfigLoader.loadSettings(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
            LoggingConfigurator.configure(settings.logLevel());
        }
        return settings;
    }
}
