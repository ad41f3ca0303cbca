package org.minilang.cli.config;

/**
 * Console rendering of analysis reports.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
