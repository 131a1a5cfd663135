package com.hailmary.exception;

/**
 * The configuration does not match the store: missing relation, tracking column with
 * the wrong casing, type mismatch, or a destination mapping that rejects documents.
 * The pipeline keeps retrying but makes no progress until an operator fixes it.
 */
public class SyncConfigurationException extends SyncException {

    public SyncConfigurationException(String sourceName, String message) {
        super(sourceName, message, null);
    }

    public SyncConfigurationException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
