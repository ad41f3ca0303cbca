package org.minilang.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.Optional;

/**
 * Finds the user's configuration file and layers it into one HOCON {@link Config}.
 * <p>
 * The file is taken from {@code --config}, else from the {@code config.file} system property,
 * else from {@code config/minilang.conf} in the working directory if it exists. System properties
 * and environment variables override the file; {@code reference.conf} supplies every key the
 * file leaves out.
 */
public final class ConfigLoader {

    static final String FILE_PROPERTY = "config.file";
    static final File WORKING_DIRECTORY_FILE = new File("config", "minilang.conf");

    private ConfigLoader() {
    }

    /** Severity of a {@link ConfigMessageHandler} message. */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives a note about which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration and maps it to the settings the commands use.
     *
     * @param optionFile the {@code --config} value, or null.
     * @param handler    receives the note about the chosen source.
     * @return the settings.
     * @throws IllegalArgumentException            if a named configuration file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration is malformed.
     */
    public static CliSettings loadSettings(final File optionFile, final ConfigMessageHandler handler) {
        return CliSettings.fromConfig(resolve(optionFile, handler));
    }

    /**
     * Resolves the layered configuration.
     *
     * @param optionFile the {@code --config} value, or null.
     * @param handler    receives the note about the chosen source.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if a named configuration file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration is malformed.
     */
    public static Config resolve(final File optionFile, final ConfigMessageHandler handler) {
        Optional<File> userFile = locate(optionFile);
        if (userFile.isPresent()) {
            handler.log(MessageLevel.INFO, "Reading configuration from " + userFile.get().getAbsolutePath());
            return compose(ConfigFactory.parseFile(userFile.get()));
        }
        handler.log(MessageLevel.WARN,
                "No configuration file given and no " + WORKING_DIRECTORY_FILE.getPath() + " found, using defaults");
        return compose(ConfigFactory.empty());
    }

    /**
     * @return the user configuration file, or empty if only the defaults apply.
     * @throws IllegalArgumentException if the file named by {@code --config} or {@code -Dconfig.file} is missing.
     */
    static Optional<File> locate(final File optionFile) {
        if (optionFile != null) {
            return Optional.of(requireFile(optionFile, "--config"));
        }
        String property = System.getProperty(FILE_PROPERTY);
        if (property != null && !property.isBlank()) {
            return Optional.of(requireFile(new File(property), "-D" + FILE_PROPERTY));
        }
        return WORKING_DIRECTORY_FILE.isFile() ? Optional.of(WORKING_DIRECTORY_FILE) : Optional.empty();
    }

    /**
     * Puts system properties and environment over the user configuration and the reference defaults.
     */
    static Config compose(final Config userConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userConfig)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static File requireFile(final File file, final String origin) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(
                    "Configuration file not found: " + file.getAbsolutePath() + " (given by " + origin + ")");
        }
        return file;
    }
}
