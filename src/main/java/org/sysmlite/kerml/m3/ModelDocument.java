package org.sysmlite.kerml.m3;

/**
 * The document an element was built from, as seen by the metamodel. Gives
 * elements access to workspace services without depending on the engine.
 */
public interface ModelDocument {

    String uri();

    IdAllocator idAllocator();

    ModelVersion modelVersion();

    ReferenceResolver referenceResolver();

    ValueEvaluator valueEvaluator();

    boolean isStandardLibrary();
}
