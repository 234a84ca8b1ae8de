package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Owned members of a type, then members inherited from its direct
 * supertypes, then imported members.
 *
 * Inherited members are looked up with {@link VisibilityOptions#decrement()}
 * options. Each supertype path contributes its nearest match; distinct matches
 * from different paths are ambiguous.
 */
public class TypeScope extends NamespaceScope {

    private final Type type;

    public TypeScope(Type type, VisibilityOptions options) {
        super(type, options);
        this.type = type;
    }

    @Override
    public LookupResult lookup(String name, LookupContext context) {
        LookupResult local = lookupLocal(name, context);
        if (local.isDecided()) {
            return local;
        }
        LookupResult inherited = lookupInherited(name, context);
        if (inherited.isDecided()) {
            return inherited;
        }
        LookupResult imported = lookupImports(name, context);
        if (imported.isDecided()) {
            return imported;
        }
        return undecided(local, inherited, imported);
    }

    protected LookupResult lookupInherited(String name, LookupContext context) {
        if (!context.enter(List.of("inherited", type, name))) {
            return LookupResult.NOT_FOUND;
        }
        VisibilityOptions inheritedOptions = options.decrement();
        List<LookupResult> results = new ArrayList<>();
        for (Type supertype : type.directSupertypes()) {
            if (supertype != type) {
                results.add(new TypeScope(supertype, inheritedOptions).lookup(name, context));
            }
        }
        return LookupResult.merge(results);
    }
}
