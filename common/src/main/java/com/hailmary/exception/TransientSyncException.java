package com.hailmary.exception;

/**
 * Source or destination temporarily unreachable, timed out or overloaded.
 */
public class TransientSyncException extends SyncException {

    public TransientSyncException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
