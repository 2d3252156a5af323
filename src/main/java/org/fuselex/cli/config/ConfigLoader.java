package org.fuselex.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file picked up from the working directory when none is given. */
    public static final String CONFIG_FILE_NAME = "fuselex.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dkey=value)
     * 2. Environment Variables
     * 3. Configuration File (the explicit file, else fuselex.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file named on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed, or the explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            // Unlike the working-directory file, a named file must exist.
            fileConfig = ConfigFactory.parseFile(explicitFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        return load(fileConfig);
    }

    /**
     * Layers system properties and environment over the given file configuration and the classpath defaults.
     * @param fileConfig The file-level configuration.
     * @return The resolved configuration.
     */
    public static Config load(final Config fileConfig) {
        final Config combinedConfig = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.defaultReference());

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
