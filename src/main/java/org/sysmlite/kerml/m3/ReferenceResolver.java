package org.sysmlite.kerml.m3;

/**
 * Resolves a pending {@link ElementReference} by calling
 * {@link ElementReference#markResolved} or {@link ElementReference#markFailed}.
 */
@FunctionalInterface
public interface ReferenceResolver {

    void resolve(ElementReference reference);
}
