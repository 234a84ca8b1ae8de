package org.sysmlite.kerml.m3;

/**
 * Namespace import ({@code import A::*}) or membership import
 * ({@code import A::B}), optionally recursive ({@code ::**}) and importing
 * all members regardless of visibility ({@code import all}).
 *
 * Imports are private unless declared otherwise.
 */
public class Import extends Relationship {

    private final boolean recursive;
    private final boolean importsAll;

    public Import(RelationshipKind kind, ModelDocument document, boolean recursive, boolean importsAll) {
        super(ElementKind.IMPORT, kind, document, false);
        if (kind != RelationshipKind.NAMESPACE_IMPORT && kind != RelationshipKind.MEMBERSHIP_IMPORT) {
            throw new IllegalArgumentException("Not an import kind: " + kind);
        }
        this.recursive = recursive;
        this.importsAll = importsAll;
    }

    public boolean isNamespaceImport() {
        return relationshipKind() == RelationshipKind.NAMESPACE_IMPORT;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public boolean importsAll() {
        return importsAll;
    }

    @Override
    public Visibility visibility() {
        return declaredVisibility() != null ? declaredVisibility() : Visibility.PRIVATE;
    }

    @Override
    public String effectiveName() {
        return null;
    }
}
