package org.minilang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured log level to Logback.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root log level. Unknown level names fall back to WARN.
     * Does nothing if the name is null or SLF4J is not bound to Logback.
     *
     * @param levelName the level name, e.g. {@code DEBUG}.
     */
    public static void configure(final String levelName) {
        if (levelName == null) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(levelName, Level.WARN));
    }
}
