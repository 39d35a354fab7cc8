package com.clinicsync.core.error;

/**
 * The bearer credential was rejected during the connection handshake.
 * <p>
 * Aborts the current connect attempt without consuming a reconnect slot.
 * </p>
 */
public class AuthException extends SyncException {
    private final int status;

    public AuthException(String message, int status) {
        super(message);
        this.status = status;
    }

    public AuthException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return HTTP status of the rejected handshake, or 0 when not HTTP based
     */
    public int getStatus() {
        return status;
    }
}
