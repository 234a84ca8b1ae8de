package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.implicit.ImplicitPolicy;
import org.sysmlite.engine.validation.ModelValidator;
import org.sysmlite.engine.validation.ValidationChecks;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static EngineConfig config(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return EngineConfig.of(properties);
    }

    @Test
    void emptyConfigurationGivesDefaults() {
        assertEquals(BuildOptions.defaults(), config().toBuildOptions());
    }

    @Test
    void readsEveryOption() {
        BuildOptions options = config(
                EngineConfig.VALIDATION_CHECKS, ModelValidator.NAMESPACE_DISTINGUISHABILITY,
                EngineConfig.LIBRARY, "local",
                EngineConfig.LIBRARY_PATH, "lib/sysml",
                EngineConfig.STANDALONE, "true",
                EngineConfig.IMPLICIT_POLICY, "skip-if-reachable",
                EngineConfig.IGNORE_METAMODEL_ERRORS, "true").toBuildOptions();

        assertEquals(ValidationChecks.of(ModelValidator.NAMESPACE_DISTINGUISHABILITY), options.validationChecks());
        assertEquals(StandardLibrary.LOCAL, options.standardLibrary());
        assertEquals(Path.of("lib/sysml"), options.localLibraryPath());
        assertTrue(options.standalone());
        assertEquals(ImplicitPolicy.SKIP_IF_REACHABLE, options.implicitPolicy());
        assertTrue(options.ignoreMetamodelErrors());
    }

    @Test
    void blankLibraryPathIsUnset() {
        BuildOptions options = config(EngineConfig.LIBRARY_PATH, "  ").toBuildOptions();
        assertNull(options.localLibraryPath());
    }

    @Test
    void malformedValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> config(EngineConfig.LIBRARY, "bundled").toBuildOptions());
        assertThrows(IllegalArgumentException.class,
                () -> config(EngineConfig.IMPLICIT_POLICY, "sometimes").toBuildOptions());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> config(EngineConfig.VALIDATION_CHECKS, "noSuchCheck").toBuildOptions());
        assertEquals("Unknown validation check: noSuchCheck", e.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> config(EngineConfig.LIBRARY, "LOCAL").toBuildOptions());
    }

    @Test
    void copiesProperties() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.STANDALONE, "true");
        EngineConfig config = EngineConfig.of(properties);
        properties.setProperty(EngineConfig.STANDALONE, "false");
        assertEquals("true", config.get(EngineConfig.STANDALONE, null));
        assertEquals("x", config.get("sysml.unknown", "x"));
    }

    @Test
    void loadsBundledResource() {
        EngineConfig config = EngineConfig.load();
        assertEquals("EXPLICIT_KIND_SUPPRESSES", config.get(EngineConfig.IMPLICIT_POLICY, null));
        assertNotNull(config.toBuildOptions());
    }
}
