package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Visibility;

/**
 * Visibility allowed at the current scope level, for how many levels, and
 * what applies after that.
 *
 * @param visibility Most restrictive member visibility still visible
 * @param depth      Levels this visibility applies to
 * @param next       Options after {@code depth} levels, null for public
 */
public record VisibilityOptions(Visibility visibility, int depth, VisibilityOptions next) {

    public static final VisibilityOptions PUBLIC = new VisibilityOptions(Visibility.PUBLIC, Integer.MAX_VALUE, null);

    /** Everything visible at every level, for {@code import all} */
    public static final VisibilityOptions ALL = new VisibilityOptions(Visibility.PRIVATE, Integer.MAX_VALUE, null);

    /** Protected members of supertypes */
    public static final VisibilityOptions PROTECTED = new VisibilityOptions(Visibility.PROTECTED, Integer.MAX_VALUE, null);

    /** From inside a namespace: private members at its own level, protected ones inherited */
    public static final VisibilityOptions LINKING = new VisibilityOptions(Visibility.PRIVATE, 1, PROTECTED);

    public VisibilityOptions {
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be positive");
        }
    }

    /**
     * @return options for the next level down the specialization hierarchy
     */
    public VisibilityOptions decrement() {
        if (depth == Integer.MAX_VALUE) {
            return this;
        }
        if (depth > 1) {
            return new VisibilityOptions(visibility, depth - 1, next);
        }
        return next != null ? next : PUBLIC;
    }

    public boolean allows(Visibility memberVisibility) {
        return visibility.allows(memberVisibility);
    }
}
