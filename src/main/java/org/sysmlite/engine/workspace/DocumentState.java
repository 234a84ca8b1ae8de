package org.sysmlite.engine.workspace;

/**
 * How far a document has been built. Phases run in declaration order.
 */
public enum DocumentState {
    CHANGED,
    PARSED,
    CONSTRUCTED,
    INDEXED,
    LINKED,
    GENERALIZED,
    RESOLVED,
    VALIDATED;

    public boolean isAtLeast(DocumentState other) {
        return ordinal() >= other.ordinal();
    }
}
