package org.sysmlite.kerml.m3;

/**
 * Where a free-floating note sits relative to the element it is attached to.
 */
public enum Placement {
    LEADING,
    TRAILING,
    INNER
}
