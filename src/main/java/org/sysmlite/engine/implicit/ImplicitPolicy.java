package org.sysmlite.engine.implicit;

/**
 * Decides when an implicit supertype is not added because the element already
 * has explicit supertypes.
 */
public enum ImplicitPolicy {

    /**
     * Any explicit relationship of the element's specialization kind suppresses
     * the implicit one.
     */
    EXPLICIT_KIND_SUPPRESSES,

    /**
     * Like {@link #EXPLICIT_KIND_SUPPRESSES}, and additionally skips a target
     * already reachable through the explicit specialization closure.
     */
    SKIP_IF_REACHABLE,

    /**
     * Adds the implicit supertype unless it is a direct supertype already,
     * even next to explicit specializations.
     */
    ALWAYS;

    public static ImplicitPolicy fromString(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
