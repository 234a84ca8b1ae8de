package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the scopes references are resolved in.
 */
public class ScopeProvider {

    private final GlobalScope globalScope;

    public ScopeProvider(GlobalScope globalScope) {
        this.globalScope = globalScope;
    }

    /**
     * Scope of an unqualified name written in {@code start}: each enclosing
     * namespace from the innermost outwards, then the global scope.
     *
     * @param libraryOnly restrict the global scope to standard library documents
     */
    public Scope lexicalScope(Namespace start, boolean libraryOnly) {
        List<Scope> scopes = new ArrayList<>();
        for (Namespace namespace = start; namespace != null; namespace = enclosing(namespace)) {
            scopes.add(namespace instanceof Type type
                    ? new TypeScope(type, VisibilityOptions.LINKING)
                    : new NamespaceScope(namespace, VisibilityOptions.LINKING));
        }
        scopes.add(libraryOnly ? globalScope.libraryOnly() : globalScope);
        return new ScopeChain(scopes);
    }

    /**
     * Scope of the segment following {@code element} in a qualified name.
     * Non-public members are visible when {@code context} is nested in it.
     *
     * @return null if the element has no members
     */
    public Scope memberScope(Element element, Element context) {
        if (!(element instanceof Namespace namespace)) {
            return null;
        }
        VisibilityOptions options = context != null && context.isOwnedBy(namespace)
                ? VisibilityOptions.LINKING
                : VisibilityOptions.PUBLIC;
        return namespace instanceof Type type ? new TypeScope(type, options) : new NamespaceScope(namespace, options);
    }

    /**
     * Scope of the segment following {@code element} in a feature chain: the
     * features of its types.
     *
     * @return null if the element is not a type
     */
    public Scope featureScope(Element element) {
        return element instanceof Type type ? new TypeScope(type, VisibilityOptions.PUBLIC) : null;
    }

    private static Namespace enclosing(Namespace namespace) {
        Element parent = namespace.parent();
        return parent == null ? null : parent.nearestNamespace();
    }
}
