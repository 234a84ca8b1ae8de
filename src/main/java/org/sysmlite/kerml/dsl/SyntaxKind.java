package org.sysmlite.kerml.dsl;

/**
 * Node type tags of the concrete syntax tree.
 */
public enum SyntaxKind {
    ROOT,
    PACKAGE,
    IMPORT,
    ALIAS,
    COMMENT,
    DOCUMENTATION,
    DEPENDENCY,
    /** Standalone relationship declared as a namespace member */
    RELATIONSHIP,
    TYPE,
    FEATURE,
    /** A specialization part of a type or feature declaration, e.g. {@code :> A, B} */
    SPECIFIER,
    MULTIPLICITY,
    CONNECTOR_END,
    FEATURE_VALUE,
    RESULT_EXPRESSION,

    // expressions
    LITERAL_BOOLEAN,
    LITERAL_INTEGER,
    LITERAL_REAL,
    LITERAL_STRING,
    LITERAL_INFINITY,
    NULL_EXPRESSION,
    OPERATOR_EXPRESSION,
    INVOCATION_EXPRESSION,
    FEATURE_REFERENCE,
    FEATURE_CHAIN,
    METADATA_ACCESS;

    public boolean isExpression() {
        return ordinal() >= LITERAL_BOOLEAN.ordinal();
    }
}
