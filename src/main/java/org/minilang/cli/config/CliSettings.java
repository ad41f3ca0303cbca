package org.minilang.cli.config;

import com.typesafe.config.Config;
import org.minilang.compiler.AnalyzerSettings;

/**
 * Everything the commands read from the resolved configuration.
 *
 * @param analyzer     Settings handed to every {@link org.minilang.compiler.Analyzer}.
 * @param outputFormat Report format used when {@code --format} is not given.
 * @param logLevel     Root log level name, applied by {@link LoggingConfigurator}.
 */
public record CliSettings(AnalyzerSettings analyzer, OutputFormat outputFormat, String logLevel) {

    static final String OUTPUT_FORMAT_PATH = "cli.output-format";
    static final String LOG_LEVEL_PATH = "logging.level";

    public static final CliSettings DEFAULT = new CliSettings(AnalyzerSettings.DEFAULT, OutputFormat.TEXT, "WARN");

    /**
     * Reads the {@code analyzer}, {@code cli} and {@code logging} blocks. Absent keys keep the
     * values of {@link #DEFAULT}.
     *
     * @param config the resolved configuration.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException.BadValue if {@code cli.output-format} names no format.
     */
    public static CliSettings fromConfig(Config config) {
        OutputFormat format = config.hasPath(OUTPUT_FORMAT_PATH)
                ? config.getEnum(OutputFormat.class, OUTPUT_FORMAT_PATH)
                : DEFAULT.outputFormat();
        String level = config.hasPath(LOG_LEVEL_PATH)
                ? config.getString(LOG_LEVEL_PATH)
                : DEFAULT.logLevel();
        return new CliSettings(AnalyzerSettings.fromConfig(config), format, level);
    }

    /**
     * @param explicit the format given on the command line, or null.
     * @return the explicit format if present, otherwise the configured one.
     */
    public OutputFormat formatOr(OutputFormat explicit) {
        return explicit != null ? explicit : outputFormat;
    }
}
