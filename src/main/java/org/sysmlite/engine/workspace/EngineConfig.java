package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.implicit.ImplicitPolicy;
import org.sysmlite.engine.validation.ValidationChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Engine defaults read from the classpath resource {@code sysml-lite.properties},
 * overridden by system properties with the same keys.
 */
public final class EngineConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "sysml-lite.properties";

    public static final String VALIDATION_CHECKS = "sysml.validation.checks";
    public static final String LIBRARY = "sysml.library";
    public static final String LIBRARY_PATH = "sysml.library.path";
    public static final String STANDALONE = "sysml.standalone";
    public static final String IMPLICIT_POLICY = "sysml.implicit.policy";
    public static final String IGNORE_METAMODEL_ERRORS = "sysml.ignoreMetamodelErrors";

    private final Properties properties;

    private EngineConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads the bundled defaults and applies system property overrides.
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOGGER.warn("Configuration resource {} not found, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read configuration resource {}: {}", RESOURCE, e.getMessage());
        }
        for (String key : new String[] {VALIDATION_CHECKS, LIBRARY, LIBRARY_PATH, STANDALONE,
                IMPLICIT_POLICY, IGNORE_METAMODEL_ERRORS}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return new EngineConfig(properties);
    }

    public static EngineConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new EngineConfig(copy);
    }

    public String get(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    /**
     * @throws IllegalArgumentException if a value is malformed
     */
    public BuildOptions toBuildOptions() {
        BuildOptions defaults = BuildOptions.defaults();
        ValidationChecks checks = ValidationChecks.parse(get(VALIDATION_CHECKS, "all"));
        StandardLibrary library = StandardLibrary.fromString(get(LIBRARY, defaults.standardLibrary().name()));
        String path = get(LIBRARY_PATH, null);
        Path libraryPath = path == null || path.isBlank() ? null : Path.of(path);
        return new BuildOptions(
                checks,
                library,
                Boolean.parseBoolean(get(STANDALONE, "false")),
                ImplicitPolicy.fromString(get(IMPLICIT_POLICY, defaults.implicitPolicy().name())),
                Boolean.parseBoolean(get(IGNORE_METAMODEL_ERRORS, "false")),
                libraryPath);
    }
}
