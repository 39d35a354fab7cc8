package com.clinicsync.core.error;

/**
 * Execution or connection failed for connectivity reasons; consumes one retry attempt.
 */
public class TransientNetworkException extends SyncException {
    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
