package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Namespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Members owned directly by a namespace, filtered by visibility.
 *
 * A feature redefining an inherited feature hides it: looking up the
 * inherited name finds the redefining member. The redefining feature itself
 * is never found that way while its own redefinition is being resolved.
 */
public class ElementScope implements Scope {

    protected final Namespace namespace;
    protected final VisibilityOptions options;

    public ElementScope(Namespace namespace, VisibilityOptions options) {
        this.namespace = namespace;
        this.options = options;
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        return lookupLocal(name, context);
    }

    protected LookupResult lookupLocal(String name, LookupContext context) {
        List<Membership> candidates = new ArrayList<>();
        for (Membership membership : namespace.namedMembers().getOrDefault(name, List.of())) {
            if (options.allows(membership.visibility())) {
                candidates.add(membership);
            }
        }
        Membership shadow = namespace.redefinitionShadows().get(name);
        if (shadow != null && !candidates.contains(shadow) && options.allows(shadow.visibility())
                && shadow.memberElement() != context.skip()) {
            candidates.add(shadow);
        }
        return LookupResult.fromCandidates(candidates, context);
    }

    public Namespace namespace() {
        return namespace;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + namespace + "]";
    }
}
