package com.clinicsync.core.model;

import lombok.Value;

import java.time.Instant;

/**
 * Process-wide reachability snapshot. Replaced as a whole on every observed transition.
 */
@Value
public class ConnectivityState {
    boolean online;
    Instant lastTransitionAt;

    public static ConnectivityState initial(boolean online) {
        return new ConnectivityState(online, Instant.EPOCH);
    }

    public ConnectivityState transitionTo(boolean online, Instant at) {
        return new ConnectivityState(online, at);
    }
}
