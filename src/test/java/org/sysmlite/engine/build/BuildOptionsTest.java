package org.sysmlite.engine.build;

import org.sysmlite.engine.implicit.ImplicitPolicy;
import org.sysmlite.engine.validation.ValidationChecks;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BuildOptionsTest {

    @Test
    void defaults() {
        BuildOptions options = BuildOptions.defaults();
        assertEquals(ValidationChecks.ALL, options.validationChecks());
        assertEquals(StandardLibrary.STANDARD, options.standardLibrary());
        assertEquals(ImplicitPolicy.EXPLICIT_KIND_SUPPRESSES, options.implicitPolicy());
        assertFalse(options.standalone());
        assertFalse(options.ignoreMetamodelErrors());
        assertNull(options.localLibraryPath());
    }

    @Test
    void withersCopy() {
        BuildOptions options = BuildOptions.defaults();
        BuildOptions standalone = options.withStandalone(true);
        assertTrue(standalone.standalone());
        assertFalse(options.standalone());
        assertNotEquals(options, standalone);
        assertEquals(options, standalone.withStandalone(false));
    }

    @Test
    void localLibraryNeedsAPath() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BuildOptions.defaults().withStandardLibrary(StandardLibrary.LOCAL));
        assertEquals("A local standard library requires a library path", e.getMessage());

        BuildOptions local = BuildOptions.defaults().withLocalLibrary(Path.of("lib"));
        assertEquals(StandardLibrary.LOCAL, local.standardLibrary());
        assertEquals(Path.of("lib"), local.localLibraryPath());
    }

    @Test
    void requiredOptions() {
        assertThrows(NullPointerException.class, () -> BuildOptions.defaults().withValidationChecks(null));
        assertThrows(NullPointerException.class, () -> BuildOptions.defaults().withImplicitPolicy(null));
    }

    @Test
    void parsesLibraryNames() {
        assertEquals(StandardLibrary.NONE, StandardLibrary.fromString(" none "));
        assertEquals(ImplicitPolicy.ALWAYS, ImplicitPolicy.fromString("always"));
        assertThrows(IllegalArgumentException.class, () -> StandardLibrary.fromString("bundled"));
    }
}
