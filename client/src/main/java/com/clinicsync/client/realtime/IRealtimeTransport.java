package com.clinicsync.client.realtime;

import reactor.core.publisher.Mono;

/**
 * Interface for opening realtime connections (Dependency Inversion Principle).
 */
public interface IRealtimeTransport {
    /**
     * Opens a connection authenticated with {@code authToken}.
     *
     * @return Mono of the open connection; errors with
     * {@link com.clinicsync.core.error.AuthException} when the credential is rejected and with
     * {@link com.clinicsync.core.error.TransientNetworkException} for anything retryable
     */
    Mono<TransportConnection> open(String authToken);
}
