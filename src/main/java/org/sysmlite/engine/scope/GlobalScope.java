package org.sysmlite.engine.scope;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.multimap.list.MutableListMultimap;
import org.eclipse.collections.impl.multimap.list.FastListMultimap;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Visibility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Index of the names exported by the root namespaces of all documents.
 *
 * Named public root members are indexed by name and short name. Roots with
 * public imports export names that are only known after linking, so they are
 * searched directly at lookup time.
 */
public class GlobalScope implements Scope {

    private final MutableListMultimap<String, Membership> exports = FastListMultimap.newMultimap();
    private final MutableMap<String, Namespace> dynamicRoots = Maps.mutable.empty();

    /**
     * Replaces the exports of the document {@code uri}.
     */
    public synchronized void collectDocument(String uri, Namespace root) {
        invalidateDocument(uri);
        for (Membership membership : root.memberships()) {
            if (membership.visibility() != Visibility.PUBLIC) {
                continue;
            }
            String name = membership.memberName();
            if (name != null) {
                exports.put(name, membership);
            }
            String shortName = membership.memberShortName();
            if (shortName != null && !shortName.equals(name)) {
                exports.put(shortName, membership);
            }
        }
        if (root.imports().stream().anyMatch(imp -> imp.visibility() == Visibility.PUBLIC)) {
            dynamicRoots.put(uri, root);
        }
    }

    public synchronized void invalidateDocument(String uri) {
        invalidateDocuments(List.of(uri));
    }

    public synchronized void invalidateDocuments(Collection<String> uris) {
        List<String> names = new ArrayList<>(exports.keysView().toList());
        for (String name : names) {
            MutableList<Membership> memberships = exports.get(name);
            List<Membership> stale = memberships.select(m -> uris.contains(m.document().uri()));
            stale.forEach(m -> exports.remove(name, m));
        }
        uris.forEach(dynamicRoots::remove);
    }

    public synchronized boolean contains(String name) {
        return exports.containsKey(name);
    }

    public synchronized int size() {
        return exports.size();
    }

    @Override
    public synchronized LookupResult lookup(String name, LookupContext context) {
        List<LookupResult> results = new ArrayList<>();
        results.add(LookupResult.fromCandidates(exports.get(name), context));
        for (Namespace root : dynamicRoots.valuesView()) {
            results.add(new NamespaceScope(root, VisibilityOptions.PUBLIC).lookupImports(name, context));
        }
        return LookupResult.merge(results);
    }

    /**
     * @return a view that only finds elements of standard library documents
     */
    public Scope libraryOnly() {
        return new FilteredScope(this, Membership::isStandardLibrary);
    }
}
