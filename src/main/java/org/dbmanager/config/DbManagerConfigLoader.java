package org.dbmanager.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads database manager configuration from various sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Ddbmanager.jdbcUrl=...})</li>
 *   <li>Configuration file ({@value #CONFIG_FILE_NAME} in the working directory, or the given file)</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class DbManagerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DbManagerConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "dbmanager.conf";
    public static final String ROOT_PATH = "dbmanager";

    private DbManagerConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} from the working directory.
     *
     * @return the resolved root configuration
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile the configuration file; skipped if it does not exist
     * @return the resolved root configuration
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            log.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            log.debug("Configuration file '{}' not found. Skipping file-based configuration.", configFile);
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Returns the options block of the manager called {@code name}: the settings under
     * {@code dbmanager.databases.<name>} with the common {@code dbmanager} settings as fallback.
     *
     * @throws IllegalArgumentException if no database with that name is configured
     */
    public static Config managerOptions(Config root, String name) {
        String path = ROOT_PATH + ".databases.\"" + name + "\"";
        if (!root.hasPath(path)) {
            throw new IllegalArgumentException(String.format(
                    "No database '%s' configured under '%s.databases'", name, ROOT_PATH));
        }
        return root.getConfig(path).withFallback(root.getConfig(ROOT_PATH).withoutPath("databases"));
    }
}
