package org.sysmlite.engine.build;

/**
 * Which standard library variant a workspace loads.
 */
public enum StandardLibrary {
    /** No library; implicit generalization is skipped */
    NONE,
    /** The library bundled on the classpath under {@code sysml.library/} */
    STANDARD,
    /** Library files read from {@link BuildOptions#localLibraryPath()} */
    LOCAL;

    public static StandardLibrary fromString(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
