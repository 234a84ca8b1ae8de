package org.sysmlite.engine.build;

/**
 * Thrown at a cancellation check once cancellation was requested.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException() {
        super("Operation cancelled");
    }
}
