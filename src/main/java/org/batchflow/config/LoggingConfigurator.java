package org.batchflow.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logger levels from HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "INFO"  # Level of the root logger
 *   levels {
 *     # Override the default for particular components
 *     "org.batchflow.pipeline.observations" = "WARN"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Static utility
    }

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults: {}", e.getMessage());
            LOGGER.debug("Logging configuration failure details:", e);
            loggingConfigured = true; // Prevent retry attempts
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }

        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
