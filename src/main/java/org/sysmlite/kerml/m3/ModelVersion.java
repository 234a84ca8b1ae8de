package org.sysmlite.kerml.m3;

/**
 * Generation counter of a workspace model. Any change that can affect a
 * derived property (a new relationship, a resolved reference, a rebuild)
 * bumps the version, which lazily invalidates every {@link Memo}.
 */
public final class ModelVersion {

    private long current;

    public long current() {
        return current;
    }

    public void bump() {
        current++;
    }
}
