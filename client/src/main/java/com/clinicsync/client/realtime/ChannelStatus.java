package com.clinicsync.client.realtime;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Point-in-time view of the realtime channel.
 */
@Value
@Builder
public class ChannelStatus {
    ChannelState state;

    /**
     * Automatic reconnect attempts since the last successful connect or explicit connect.
     */
    int reconnectAttempts;

    /**
     * True once automatic reconnects stopped at the attempt cap.
     */
    boolean reconnectExhausted;

    int bufferedCount;

    @Nullable
    String connectionId;

    public boolean isConnected() {
        return state == ChannelState.CONNECTED;
    }
}
