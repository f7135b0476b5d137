package io.marketsync.core;

/**
 * Root of the scheduler's unchecked exception hierarchy.
 */
public class SyncException extends RuntimeException {
    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
