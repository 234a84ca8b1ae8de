package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Import;
import org.sysmlite.kerml.m3.Namespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Owned members of a namespace, then its imported members.
 */
public class NamespaceScope extends ElementScope {

    public NamespaceScope(Namespace namespace, VisibilityOptions options) {
        super(namespace, options);
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        LookupResult local = lookupLocal(name, context);
        if (local.isDecided()) {
            return local;
        }
        LookupResult imported = lookupImports(name, context);
        if (imported.isDecided()) {
            return imported;
        }
        return undecided(local, imported);
    }

    protected LookupResult lookupImports(String name, LookupContext context) {
        if (namespace.imports().isEmpty() || !context.enter(List.of("imports", namespace, name))) {
            return LookupResult.NOT_FOUND;
        }
        List<LookupResult> results = new ArrayList<>();
        for (Import imp : namespace.imports()) {
            if (!options.allows(imp.visibility())) {
                continue;
            }
            Scope scope = imp.isNamespaceImport() ? new NamespaceImportScope(imp) : new MembershipImportScope(imp);
            results.add(scope.lookup(name, context));
        }
        return LookupResult.merge(results);
    }

    static LookupResult undecided(LookupResult... results) {
        for (LookupResult result : results) {
            if (result.status() == LookupResult.Status.PRUNED) {
                return LookupResult.PRUNED;
            }
        }
        return LookupResult.NOT_FOUND;
    }
}
