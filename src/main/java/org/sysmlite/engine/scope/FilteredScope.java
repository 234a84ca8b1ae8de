package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Membership;

import java.util.List;
import java.util.function.Predicate;

/**
 * Restricts another scope to the memberships accepted by a filter.
 */
public class FilteredScope implements Scope {

    private final Scope delegate;
    private final Predicate<Membership> filter;

    public FilteredScope(Scope delegate, Predicate<Membership> filter) {
        this.delegate = delegate;
        this.filter = filter;
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        LookupResult result = delegate.lookup(name, context);
        if (!result.isDecided()) {
            return result;
        }
        List<Membership> kept = result.candidates().stream().filter(filter).toList();
        if (kept.isEmpty()) {
            return LookupResult.NOT_FOUND;
        }
        return kept.size() == 1 ? LookupResult.found(kept.get(0)) : LookupResult.ambiguous(kept);
    }
}
