package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;

/**
 * Finds standard library elements by qualified name, as seen from a context
 * element's document.
 */
@FunctionalInterface
public interface LibraryLookup {

    LibraryLookup NONE = (qualifiedName, context) -> null;

    /**
     * @return the element, or null if the library does not define it
     */
    Element find(String qualifiedName, Element context);
}
