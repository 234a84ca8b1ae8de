package org.sysmlite.kerml.m3;

import java.util.function.Supplier;

/**
 * Memoization cell stamped with a {@link ModelVersion}. The value is
 * recomputed on access when the model changed since it was stored.
 */
public final class Memo<T> {

    private T value;
    private long stamp = -1;
    private boolean computing;

    public T get(ModelVersion version, Supplier<T> compute) {
        if (stamp == version.current() || computing) {
            // re-entrant access sees the previous value
            return value;
        }
        computing = true;
        try {
            T computed = compute.get();
            value = computed;
            stamp = version.current();
            return computed;
        } finally {
            computing = false;
        }
    }

    public void clear() {
        value = null;
        stamp = -1;
    }
}
