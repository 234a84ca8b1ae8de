package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Membership;

import java.util.HashSet;
import java.util.Set;

/**
 * State of one name lookup: the accepted element kind, the element that must
 * not be found and the scope levels already searched.
 */
public final class LookupContext {

    private final ElementKind expectedKind;
    private final Element skip;
    private final Set<Object> visited = new HashSet<>();

    public LookupContext(ElementKind expectedKind, Element skip) {
        this.expectedKind = expectedKind;
        this.skip = skip;
    }

    public static LookupContext any() {
        return new LookupContext(ElementKind.ELEMENT, null);
    }

    public ElementKind expectedKind() {
        return expectedKind;
    }

    public Element skip() {
        return skip;
    }

    /**
     * @return false if the level identified by {@code key} was searched already
     */
    boolean enter(Object key) {
        return visited.add(key);
    }

    boolean isSkipped(Membership membership, Element element) {
        return skip != null && (element == skip || membership == skip);
    }

    boolean accepts(Element element) {
        return expectedKind == null || element.isKind(expectedKind);
    }
}
