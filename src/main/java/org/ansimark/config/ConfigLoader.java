package org.ansimark.config;

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
    private static final String CONFIG_FILE_NAME = "ansimark.conf";
    private static final String DEFAULTS_RESOURCE = "reference.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. System Properties (e.g., -Dstyles.always.error=RED)
     * 3. Configuration File (ansimark.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the application configuration with an explicit configuration file, using the same
     * precedence order as {@link #load()}.
     *
     * @param configFile The configuration file. Skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        // 1. Environment Variables (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 2. System properties.
        final Config propertiesConfig = ConfigFactory.systemProperties();

        // 3. Configuration file from the filesystem.
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources(DEFAULTS_RESOURCE);

        // Chain the configs together. The one provided first wins.
        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Loads a configuration from a classpath resource: system properties override the resource,
     * which overrides reference.conf.
     *
     * @param resourceName The classpath resource, e.g. "org/ansimark/config/test-config.conf".
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        final Config resourceConfig = ConfigFactory.parseResources(resourceName);
        if (resourceConfig.isEmpty()) {
            LOG.debug("Configuration resource '{}' not found or empty.", resourceName);
        }
        return ConfigFactory.systemProperties()
            .withFallback(resourceConfig)
            .withFallback(ConfigFactory.parseResources(DEFAULTS_RESOURCE))
            .resolve();
    }
}
