package com.hailmary.exception;

/**
 * Base class for failures raised while syncing a source into its index.
 */
public abstract class SyncException extends RuntimeException {

    private final String sourceName;

    protected SyncException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** @return {@code true} if waiting and retrying can succeed without operator action. */
    public abstract boolean isTransient();
}
