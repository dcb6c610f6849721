package org.cliffsynth.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "cliffsynth.conf";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the configuration, highest precedence first:
     * 1. Java system properties (-Dkey=value)
     * 2. Environment variables
     * 3. The given file, or cliffsynth.conf in the working directory if none is given
     * 4. Defaults from reference.conf on the classpath
     *
     * @param explicitFile A file passed via --config, or {@code null}.
     * @return The resolved configuration.
     * @throws ConfigException if an explicit file is missing or any source fails to parse.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(
                        ConfigOriginFactory.newFile(explicitFile.getPath()),
                        "Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("No '{}' in working directory, using defaults.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
