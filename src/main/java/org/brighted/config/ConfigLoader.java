package org.brighted.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the engine configuration from its layered sources.
 * The loader respects a fixed precedence order so deployments can override single keys.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "brighted.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code brighted.conf} in the working directory.
     *
     * @return the resolved configuration
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties ({@code -Dbrighted.engine.progression.daily-cap=300})
     * 3. The given configuration file
     * 4. Defaults from {@code reference.conf} on the classpath
     *
     * @param configFile file layer; skipped when it does not exist
     * @return a resolved {@link Config} containing the merged configuration
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(propertyConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
