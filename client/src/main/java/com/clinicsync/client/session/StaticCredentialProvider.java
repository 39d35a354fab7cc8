package com.clinicsync.client.session;

import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Credential provider holding a single token set by the host application.
 * Refresh hands back the same token, which the next handshake then accepts or rejects.
 */
public class StaticCredentialProvider implements CredentialProvider {
    @Nullable
    private volatile String token;

    public StaticCredentialProvider(@Nullable String token) {
        this.token = token;
    }

    public void setToken(@Nullable String token) {
        this.token = token;
    }

    @Override
    public Mono<String> currentToken() {
        return Mono.justOrEmpty(token);
    }

    @Override
    public Mono<String> refreshToken() {
        return Mono.justOrEmpty(token);
    }
}
