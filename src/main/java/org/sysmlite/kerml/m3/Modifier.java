package org.sysmlite.kerml.m3;

/**
 * Declaration prefixes of types and features.
 */
public enum Modifier {
    ABSTRACT,
    SUFFICIENT,
    VARIATION,
    INDIVIDUAL,
    COMPOSITE,
    PORTION,
    READONLY,
    DERIVED,
    END,
    REF,
    ORDERED,
    NONUNIQUE,
    NEGATED,
    // portion kinds
    TIMESLICE,
    SNAPSHOT,
    // state subaction kinds
    ENTRY,
    DO,
    EXIT,
    // requirement member kinds
    ASSUME,
    REQUIRE,
    ACTOR,
    STAKEHOLDER;

    /**
     * @return the modifier for a source keyword, or null if it is not a modifier
     */
    public static Modifier fromKeyword(String keyword) {
        return switch (keyword) {
            case "abstract" -> ABSTRACT;
            case "all" -> SUFFICIENT;
            case "variation" -> VARIATION;
            case "individual" -> INDIVIDUAL;
            case "composite" -> COMPOSITE;
            case "portion" -> PORTION;
            case "readonly" -> READONLY;
            case "derived" -> DERIVED;
            case "end" -> END;
            case "ref" -> REF;
            case "ordered" -> ORDERED;
            case "nonunique" -> NONUNIQUE;
            case "negated" -> NEGATED;
            case "timeslice" -> TIMESLICE;
            case "snapshot" -> SNAPSHOT;
            case "entry" -> ENTRY;
            case "do" -> DO;
            case "exit" -> EXIT;
            case "assume" -> ASSUME;
            case "require" -> REQUIRE;
            case "actor" -> ACTOR;
            case "stakeholder" -> STAKEHOLDER;
            default -> null;
        };
    }
}
