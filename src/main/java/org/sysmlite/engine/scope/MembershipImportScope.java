package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Import;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Namespace;

import java.util.List;

/**
 * The single member made visible by {@code import A::B}. With
 * {@code import A::B::**} the members nested in {@code B} are visible too.
 */
public class MembershipImportScope implements Scope {

    private final Import imp;

    public MembershipImportScope(Import imp) {
        this.imp = imp;
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        Element target = imp.resolveTarget();
        if (target == null) {
            return LookupResult.NOT_FOUND;
        }
        Membership membership = target instanceof Membership alias ? alias : target.owningMembership();
        if (membership != null && (name.equals(membership.memberName()) || name.equals(membership.memberShortName()))) {
            LookupResult own = LookupResult.fromCandidates(List.of(membership), context);
            if (own.isDecided()) {
                return own;
            }
        }
        if (imp.isRecursive() && target instanceof Namespace namespace) {
            VisibilityOptions options = imp.importsAll() ? VisibilityOptions.ALL : VisibilityOptions.PUBLIC;
            return NamespaceImportScope.lookupRecursive(List.of(namespace), options, name, context);
        }
        return LookupResult.NOT_FOUND;
    }
}
