package org.quasar.compiler.config;

import com.typesafe.config.Config;

import java.nio.file.Path;

/**
 * The settings of the front end, read from the {@code quasar.frontend} block.
 *
 * @param defaultSourceId The source name used when the caller supplies none.
 * @param moduleBaseDirectory The directory local imports are resolved against. When it is set
 *                            in a configuration file, a relative value is taken relative to that file.
 * @param verbosity The {@link org.quasar.compiler.diagnostics.CompilerLogger} level, 0..4.
 */
public record FrontendOptions(String defaultSourceId, Path moduleBaseDirectory, int verbosity) {

    /** The configuration path of the front-end block. */
    public static final String CONFIG_PATH = "quasar.frontend";

    public FrontendOptions {
        if (defaultSourceId == null || defaultSourceId.isBlank()) {
            throw new IllegalArgumentException("default-source-id must not be blank");
        }
        if (verbosity < 0 || verbosity > 4) {
            throw new IllegalArgumentException("verbosity must be between 0 and 4, got " + verbosity);
        }
    }

    /**
     * Reads the options from a loaded configuration.
     * @param config The root configuration, e.g. from {@link ConfigLoader#load()}.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static FrontendOptions fromConfig(Config config) {
        Config frontend = config.getConfig(CONFIG_PATH);
        return new FrontendOptions(
                frontend.getString("default-source-id"),
                ConfigLoader.resolvePath(frontend, "module-base-dir"),
                frontend.getInt("verbosity"));
    }
}
