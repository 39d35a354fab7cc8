package com.clinicsync.core.error;

/**
 * Base type for failures raised by the synchronization layer.
 */
public class SyncException extends RuntimeException {
    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
