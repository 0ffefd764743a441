package org.gridsweep.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration for the CLI.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dsimulation.seed=42})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are stacked, so user overrides reach
 * every value in {@code reference.conf} that refers to them.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "gridsweep.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        /** Informational progress, e.g. which file was selected. */
        INFO,
        /** Fallback behaviour, e.g. no file found. */
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * Called with a status message during resolution.
         *
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration by looking, in order, at:
     * <ol>
     *   <li>the file given via {@code --config},</li>
     *   <li>the file given via {@code -Dconfig.file},</li>
     *   <li>{@code config/gridsweep.conf} in the working directory,</li>
     *   <li>classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null}.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, new File("."), handler);
    }

    static Config resolve(final File explicitConfigFile, final File workingDirectory,
                          final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(new File(workingDirectory, CONFIG_DIR), CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                        + "' found in current directory. Using default configuration from classpath.");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved configuration.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     *
     * @return the fully resolved configuration.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
