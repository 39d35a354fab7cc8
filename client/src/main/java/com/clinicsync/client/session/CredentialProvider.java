package com.clinicsync.client.session;

import reactor.core.publisher.Mono;

/**
 * Source of the bearer token used by the realtime channel and the HTTP executor.
 */
public interface CredentialProvider {
    /**
     * @return current token, empty when signed out
     */
    Mono<String> currentToken();

    /**
     * Obtains a fresh token after the current one was rejected.
     *
     * @return refreshed token, or an error if the session cannot be renewed
     */
    Mono<String> refreshToken();
}
