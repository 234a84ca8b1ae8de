package org.sysmlite.kerml.m3;

/**
 * Evaluated bounds of a multiplicity range.
 *
 * @param lower Minimum cardinality
 * @param upper Maximum cardinality (null represents unbounded/*)
 */
public record Bounds(long lower, Long upper) {

    /** Zero or more [*] */
    public static final Bounds MANY = new Bounds(0, null);

    /** Single required value [1] */
    public static final Bounds ONE = new Bounds(1, 1L);

    public Bounds {
        if (lower < 0) {
            throw new IllegalArgumentException("Lower bound cannot be negative");
        }
    }

    public boolean isUnbounded() {
        return upper == null;
    }

    /**
     * @return true if every cardinality allowed here is allowed by {@code other}
     */
    public boolean within(Bounds other) {
        if (lower < other.lower) {
            return false;
        }
        if (other.upper == null) {
            return true;
        }
        return upper != null && upper <= other.upper;
    }

    @Override
    public String toString() {
        if (upper == null) {
            return lower == 0 ? "[*]" : "[" + lower + "..*]";
        }
        if (lower == upper) {
            return "[" + lower + "]";
        }
        return "[" + lower + ".." + upper + "]";
    }
}
