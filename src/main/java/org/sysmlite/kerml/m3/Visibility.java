package org.sysmlite.kerml.m3;

/**
 * Member visibility, ordered from least to most restrictive.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public static Visibility fromKeyword(String keyword) {
        return switch (keyword) {
            case "public" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "private" -> PRIVATE;
            default -> throw new IllegalArgumentException("Unknown visibility: " + keyword);
        };
    }

    /**
     * @return the more restrictive of the two visibilities
     */
    public Visibility restrict(Visibility other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    /**
     * @return true if a member with {@code memberVisibility} is visible at this level
     */
    public boolean allows(Visibility memberVisibility) {
        return memberVisibility.ordinal() <= ordinal();
    }
}
