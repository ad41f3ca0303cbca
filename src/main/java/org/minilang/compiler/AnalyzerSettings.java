package org.minilang.compiler;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link Analyzer}.
 *
 * @param maxSourceLength Sources longer than this many characters are rejected without tokenizing.
 */
public record AnalyzerSettings(int maxSourceLength) {

    public static final int DEFAULT_MAX_SOURCE_LENGTH = 1_000_000;
    public static final AnalyzerSettings DEFAULT = new AnalyzerSettings(DEFAULT_MAX_SOURCE_LENGTH);

    public AnalyzerSettings {
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("maxSourceLength must be positive, was " + maxSourceLength);
        }
    }

    /**
     * Reads the settings from the {@code analyzer} block of the application configuration.
     * Missing keys fall back to the defaults.
     * @param config The resolved application configuration.
     * @return The settings.
     */
    public static AnalyzerSettings fromConfig(Config config) {
        if (!config.hasPath("analyzer.max-source-length")) {
            return DEFAULT;
        }
        return new AnalyzerSettings(config.getInt("analyzer.max-source-length"));
    }
}
