package org.sysmlite.engine.build;

/**
 * Cooperative cancellation signal passed through the build pipeline and
 * checked after each document and each phase.
 */
public class CancellationToken {

    /** A token that is never cancelled */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws OperationCancelledException if cancellation was requested
     */
    public void checkCancelled() {
        if (cancelled) {
            throw new OperationCancelledException();
        }
    }
}
