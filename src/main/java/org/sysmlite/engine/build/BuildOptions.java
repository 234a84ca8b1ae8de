package org.sysmlite.engine.build;

import org.sysmlite.engine.implicit.ImplicitPolicy;
import org.sysmlite.engine.validation.ValidationChecks;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for one build of a batch of documents.
 *
 * @param validationChecks      Validation rules to run
 * @param standardLibrary       Library variant used for implicit supertypes
 * @param standalone            Analyze documents on their own, seeing only the library globally
 * @param implicitPolicy        When an implicit supertype is suppressed
 * @param ignoreMetamodelErrors Do not report missing library elements
 * @param localLibraryPath      Directory with library files for {@link StandardLibrary#LOCAL}
 */
public record BuildOptions(
        ValidationChecks validationChecks,
        StandardLibrary standardLibrary,
        boolean standalone,
        ImplicitPolicy implicitPolicy,
        boolean ignoreMetamodelErrors,
        Path localLibraryPath) {

    public BuildOptions {
        Objects.requireNonNull(validationChecks, "Validation checks cannot be null");
        Objects.requireNonNull(standardLibrary, "Standard library cannot be null");
        Objects.requireNonNull(implicitPolicy, "Implicit policy cannot be null");
        if (standardLibrary == StandardLibrary.LOCAL && localLibraryPath == null) {
            throw new IllegalArgumentException("A local standard library requires a library path");
        }
    }

    public static BuildOptions defaults() {
        return new BuildOptions(ValidationChecks.ALL, StandardLibrary.STANDARD, false,
                ImplicitPolicy.EXPLICIT_KIND_SUPPRESSES, false, null);
    }

    public BuildOptions withValidationChecks(ValidationChecks checks) {
        return new BuildOptions(checks, standardLibrary, standalone, implicitPolicy, ignoreMetamodelErrors, localLibraryPath);
    }

    public BuildOptions withStandardLibrary(StandardLibrary library) {
        return new BuildOptions(validationChecks, library, standalone, implicitPolicy, ignoreMetamodelErrors, localLibraryPath);
    }

    public BuildOptions withLocalLibrary(Path path) {
        return new BuildOptions(validationChecks, StandardLibrary.LOCAL, standalone, implicitPolicy, ignoreMetamodelErrors, path);
    }

    public BuildOptions withStandalone(boolean value) {
        return new BuildOptions(validationChecks, standardLibrary, value, implicitPolicy, ignoreMetamodelErrors, localLibraryPath);
    }

    public BuildOptions withImplicitPolicy(ImplicitPolicy policy) {
        return new BuildOptions(validationChecks, standardLibrary, standalone, policy, ignoreMetamodelErrors, localLibraryPath);
    }

    public BuildOptions withIgnoreMetamodelErrors(boolean value) {
        return new BuildOptions(validationChecks, standardLibrary, standalone, implicitPolicy, value, localLibraryPath);
    }
}
