package org.sysmlite.kerml.m3;

/**
 * Syntactic role under which an element is owned. Children keep their
 * insertion order within a role independently of other roles.
 */
public enum ChildRole {
    /** Memberships of a namespace */
    MEMBERSHIP,
    /** Imports of a namespace */
    IMPORT,
    /** Owned non-membership relationships (specializations, featurings, ...) */
    RELATIONSHIP,
    /** The element owned by a membership */
    MEMBER_ELEMENT,
    MULTIPLICITY,
    /** Operands of an invocation or operator expression */
    ARGUMENT,
    /** Lower and upper bound expressions of a multiplicity range */
    BOUND
}
