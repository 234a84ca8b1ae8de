package org.sysmlite.engine.scope;

import java.util.List;

/**
 * Scopes consulted in order; the first one that finds the name, or finds it
 * ambiguous, decides the lookup.
 */
public class ScopeChain implements Scope {

    private final List<Scope> scopes;

    public ScopeChain(List<Scope> scopes) {
        this.scopes = List.copyOf(scopes);
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        boolean pruned = false;
        for (Scope scope : scopes) {
            LookupResult result = scope.lookup(name, context);
            if (result.isDecided()) {
                return result;
            }
            pruned |= result.status() == LookupResult.Status.PRUNED;
        }
        return pruned ? LookupResult.PRUNED : LookupResult.NOT_FOUND;
    }

    public List<Scope> scopes() {
        return scopes;
    }
}
