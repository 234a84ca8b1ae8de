package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Import;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Members made visible by {@code import A::*} or {@code import A::**}.
 *
 * Only public members are imported unless the import is {@code import all}.
 * A recursive import also searches nested namespaces, nearest level first.
 */
public class NamespaceImportScope implements Scope {

    private final Import imp;

    public NamespaceImportScope(Import imp) {
        this.imp = imp;
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        if (!(imp.resolveTarget() instanceof Namespace target)) {
            return LookupResult.NOT_FOUND;
        }
        VisibilityOptions options = imp.importsAll() ? VisibilityOptions.ALL : VisibilityOptions.PUBLIC;
        if (imp.isRecursive()) {
            return lookupRecursive(List.of(target), options, name, context);
        }
        return scopeOf(target, options).lookup(name, context);
    }

    static Scope scopeOf(Namespace namespace, VisibilityOptions options) {
        return namespace instanceof Type type ? new TypeScope(type, options) : new NamespaceScope(namespace, options);
    }

    /**
     * Searches {@code level} and then the namespaces nested in it, one level at
     * a time. The first level with a decided result wins.
     */
    static LookupResult lookupRecursive(List<Namespace> level, VisibilityOptions options, String name, LookupContext context) {
        List<Namespace> current = level;
        boolean pruned = false;
        while (!current.isEmpty()) {
            List<LookupResult> results = new ArrayList<>();
            List<Namespace> next = new ArrayList<>();
            for (Namespace namespace : current) {
                if (!context.enter(List.of("recursive", namespace, name))) {
                    continue;
                }
                results.add(scopeOf(namespace, options).lookup(name, context));
                for (Membership membership : namespace.memberships()) {
                    if (options.allows(membership.visibility()) && membership.ownedMemberElement() instanceof Namespace nested) {
                        next.add(nested);
                    }
                }
            }
            LookupResult merged = LookupResult.merge(results);
            if (merged.isDecided()) {
                return merged;
            }
            pruned |= merged.status() == LookupResult.Status.PRUNED;
            current = next;
        }
        return pruned ? LookupResult.PRUNED : LookupResult.NOT_FOUND;
    }
}
