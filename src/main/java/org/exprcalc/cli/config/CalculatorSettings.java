package org.exprcalc.cli.config;

import com.typesafe.config.Config;

/**
 * Settings of the command line wrapper, read from the {@code exprcalc} block.
 *
 * @param format How results are printed.
 * @param printPostfix Whether the postfix stream is printed before the value.
 * @param errorExitCode The process exit code used when an expression fails.
 */
public record CalculatorSettings(OutputFormat format, boolean printPostfix, int errorExitCode) {

    private static final String ROOT = "exprcalc";

    /**
     * The supported output formats.
     */
    public enum OutputFormat {
        /** The bare value, or {@code ERROR: <message>}. */
        TEXT,
        /** A single JSON object per invocation. */
        JSON
    }

    /**
     * Reads the settings. Missing keys must be provided by {@code reference.conf}.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CalculatorSettings from(Config config) {
        Config root = config.getConfig(ROOT);
        return new CalculatorSettings(
                root.getEnum(OutputFormat.class, "output.format"),
                root.getBoolean("output.print-postfix"),
                root.getInt("cli.error-exit-code"));
    }
}
