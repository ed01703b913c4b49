package org.quasar.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Loads the front-end configuration and resolves the paths it contains.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *     <li>environment variables,</li>
 *     <li>Java system properties (e.g. {@code -Dquasar.frontend.verbosity=3}),</li>
 *     <li>{@code quasar.conf} in the working directory, or an explicitly given file,</li>
 *     <li>{@code reference.conf} on the classpath.</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "quasar.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration with {@code quasar.conf} from the working directory.
     *
     * @return The merged and resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit configuration file in place of {@code quasar.conf}.
     *
     * @param configFile The file consulted at precedence level 3. Skipped if it does not exist.
     * @return The merged and resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.debug("Loading quasar configuration from {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("No quasar configuration at '{}', using defaults and overrides only", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    /**
     * Reads a path setting. A relative path written in a configuration file is resolved
     * against that file's directory, so a project's {@code quasar.conf} works from any
     * working directory. Paths from the environment, system properties or the classpath
     * defaults stay relative to the working directory.
     *
     * @param config The configuration holding the setting.
     * @param key The key of the setting, relative to {@code config}.
     * @return The path.
     * @throws com.typesafe.config.ConfigException if the key is missing or not a string.
     */
    public static Path resolvePath(Config config, String key) {
        Path path = Path.of(config.getString(key));
        ConfigOrigin origin = config.getValue(key).origin();
        // Classpath resources report a filename when loaded from a directory; they still count as defaults.
        if (path.isAbsolute() || origin.filename() == null || origin.resource() != null) {
            return path;
        }
        Path directory = Path.of(origin.filename()).toAbsolutePath().getParent();
        Path resolved = directory.resolve(path).normalize();
        LOG.debug("Resolved '{}' = '{}' against {} to {}", key, path, origin.filename(), resolved);
        return resolved;
    }
}
