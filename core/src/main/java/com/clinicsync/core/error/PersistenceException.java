package com.clinicsync.core.error;

/**
 * A durable store read or write failed.
 */
public class PersistenceException extends SyncException {
    private final String key;

    public PersistenceException(String key, String message, Throwable cause) {
        super(message + " [key=" + key + "]", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
