package org.sysmlite.kerml.m3.expression;

/**
 * The value of the literal {@code *}.
 */
public final class Infinity {

    public static final Infinity INSTANCE = new Infinity();

    private Infinity() {
    }

    @Override
    public String toString() {
        return "*";
    }
}
