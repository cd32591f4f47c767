package org.batchflow.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "batchflow.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code batchflow.conf} from the working directory, if present.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dbatchflow.pipeline.maxItems=50)
     * 3. Configuration File (the given file, else batchflow.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if {@code explicitFile} is given but does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File configFile = new File(CONFIG_FILE_NAME);
            if (configFile.isFile()) {
                LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults from classpath.", configFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
