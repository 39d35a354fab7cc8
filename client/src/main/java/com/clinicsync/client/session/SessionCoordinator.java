package com.clinicsync.client.session;

import com.clinicsync.client.connectivity.IConnectivityMonitor;
import com.clinicsync.client.realtime.IRealtimeChannel;
import com.clinicsync.core.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the realtime channel from session and app lifecycle signals.
 * <ul>
 *   <li>sign-in and foreground: connect (an explicit connect, so the reconnect counter resets)</li>
 *   <li>sign-out and background: disconnect, keeping buffered events</li>
 *   <li>connectivity restored: connect again if signed in and not connected</li>
 *   <li>rejected credential: one token refresh and reconnect per sign-in or foreground</li>
 * </ul>
 */
public class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final IRealtimeChannel channel;
    private final CredentialProvider credentials;
    private final Disposable authSubscription;

    private final AtomicBoolean refreshUsed = new AtomicBoolean(false);
    private volatile boolean signedIn;

    public SessionCoordinator(IRealtimeChannel channel, CredentialProvider credentials) {
        this.channel = channel;
        this.credentials = credentials;
        this.authSubscription = channel.onAuthFailure(this::onAuthFailure);
    }

    /**
     * @param token token for the new session, or null to ask the credential provider
     */
    public Mono<Void> onSignedIn(@Nullable String token) {
        signedIn = true;
        refreshUsed.set(false);
        Mono<String> resolved = token != null ? Mono.just(token) : credentials.currentToken();
        return resolved
            .switchIfEmpty(Mono.error(new IllegalStateException("Signed in without a credential")))
            .flatMap(channel::connect)
            .doOnSuccess(v -> log.info("Session started, realtime channel connected"))
            .doOnError(err -> log.warn("Realtime connect after sign-in failed: {}", err.toString()));
    }

    public void onSignedOut() {
        signedIn = false;
        log.info("Session ended, closing realtime channel");
        channel.disconnect();
    }

    public Mono<Void> onForeground() {
        if (!signedIn) {
            return Mono.empty();
        }
        refreshUsed.set(false);
        return credentials.currentToken()
            .flatMap(channel::connect)
            .doOnError(err -> log.warn("Realtime connect on foreground failed: {}", err.toString()));
    }

    public void onBackground() {
        if (signedIn) {
            log.debug("App backgrounded, closing realtime channel");
            channel.disconnect();
        }
    }

    /**
     * Reconnects the channel whenever {@code monitor} reports the device back online.
     *
     * @return handle that stops following the monitor
     */
    public Disposable followConnectivity(IConnectivityMonitor monitor) {
        return monitor.subscribe(state -> {
            if (state.isOnline() && signedIn && !channel.getStatus().isConnected()) {
                log.info("Back online, reconnecting realtime channel");
                credentials.currentToken()
                    .flatMap(channel::connect)
                    .subscribe(null, err -> log.warn("Reconnect after connectivity change failed: {}", err.toString()));
            }
        });
    }

    public boolean isSignedIn() {
        return signedIn;
    }

    private void onAuthFailure(AuthException error) {
        if (!signedIn) {
            return;
        }
        if (!refreshUsed.compareAndSet(false, true)) {
            log.warn("Credential rejected again after refresh (status {}), staying disconnected", error.getStatus());
            return;
        }
        log.info("Credential rejected (status {}), refreshing token", error.getStatus());
        credentials.refreshToken()
            .flatMap(channel::connect)
            .subscribe(
                null,
                err -> log.warn("Reconnect with refreshed token failed: {}", err.toString()),
                () -> log.info("Reconnected with refreshed token")
            );
    }

    public void dispose() {
        authSubscription.dispose();
    }
}
