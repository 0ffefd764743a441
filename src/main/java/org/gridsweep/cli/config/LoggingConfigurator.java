package org.gridsweep.cli.config;

import java.net.URL;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or COLOR
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.gridsweep.runtime.controller" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** System property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "gridsweep.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies logger levels from the configuration. Idempotent until {@link #reset()}.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String loggerName = entry.getKey();
                final String levelName = entry.getValue().unwrapped().toString();
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
        }
    }

    /**
     * Reloads {@code logback.xml} so a changed {@link #FORMAT_PROPERTY} takes effect.
     */
    public static void reloadLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
