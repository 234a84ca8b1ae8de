package org.sysmlite.kerml.m3;

/**
 * Kind tag of a relationship. Subkinds answer {@link #isKind} for their
 * parents, so a redefinition is also a subsetting and a specialization.
 */
public enum RelationshipKind {
    SPECIALIZATION(null),
    SUBCLASSIFICATION(SPECIALIZATION),
    FEATURE_TYPING(SPECIALIZATION),
    SUBSETTING(SPECIALIZATION),
    REDEFINITION(SUBSETTING),
    REFERENCE_SUBSETTING(SUBSETTING),
    CONJUGATION(null),
    DISJOINING(null),
    TYPE_FEATURING(null),
    INVERTING(null),
    FEATURE_CHAINING(null),
    MEMBERSHIP(null),
    NAMESPACE_IMPORT(null),
    MEMBERSHIP_IMPORT(null),
    DEPENDENCY(null),
    ANNOTATION(null);

    private final RelationshipKind parent;

    RelationshipKind(RelationshipKind parent) {
        this.parent = parent;
    }

    public boolean isKind(RelationshipKind other) {
        for (RelationshipKind k = this; k != null; k = k.parent) {
            if (k == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Heritage relationships contribute to the specialization closure of
     * their source type. A conjugated type inherits from its original.
     */
    public boolean isHeritage() {
        return isKind(SPECIALIZATION) || this == CONJUGATION;
    }
}
