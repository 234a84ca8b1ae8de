package org.sysmlite.engine.scope;

/**
 * A set of named memberships visible from some context.
 */
@FunctionalInterface
public interface Scope {

    LookupResult lookup(String name, LookupContext context);
}
