package com.clinicsync.client.realtime;

/**
 * Lifecycle of the realtime channel.
 */
public enum ChannelState {
    DISCONNECTED,
    /**
     * Explicit connect in progress (handshake, room re-join, buffer flush).
     */
    CONNECTING,
    /**
     * Connection established and outbound buffer drained; emits go straight to the transport.
     */
    CONNECTED,
    /**
     * Waiting for, or running, an automatic reconnect attempt.
     */
    RECONNECTING
}
