package com.clinicsync.core.error;

/**
 * An inbound event handler threw. Isolated from sibling handlers and from the connection.
 */
public class HandlerException extends SyncException {
    private final String event;

    public HandlerException(String event, Throwable cause) {
        super("Handler for '" + event + "' failed: " + cause.getMessage(), cause);
        this.event = event;
    }

    public String getEvent() {
        return event;
    }
}
