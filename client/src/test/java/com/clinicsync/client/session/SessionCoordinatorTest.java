package com.clinicsync.client.session;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.connectivity.ConnectivityMonitor;
import com.clinicsync.client.connectivity.ManualReachabilitySource;
import com.clinicsync.client.handler.HandlerRegistry;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.client.realtime.ChannelState;
import com.clinicsync.client.realtime.OutboundBuffer;
import com.clinicsync.client.realtime.RealtimeChannel;
import com.clinicsync.client.store.InMemoryDurableStore;
import com.clinicsync.client.support.FakeTransport;
import com.clinicsync.core.error.AuthException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionCoordinatorTest {

    private VirtualTimeScheduler virtualTime;
    private FakeTransport transport;
    private RealtimeChannel channel;
    private RefreshingCredentials credentials;
    private SessionCoordinator session;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        SyncConfig config = SyncConfig.defaults();
        virtualTime = VirtualTimeScheduler.create();
        transport = new FakeTransport();
        metrics = SyncMetrics.inMemory(config);
        channel = new RealtimeChannel(transport, new HandlerRegistry(metrics),
            new OutboundBuffer(new InMemoryDurableStore(), config.getClientId(), 100, metrics),
            config, metrics, Schedulers.immediate(), virtualTime);
        credentials = new RefreshingCredentials("stale", "fresh");
        session = new SessionCoordinator(channel, credentials);
    }

    @AfterEach
    void tearDown() {
        session.dispose();
        channel.dispose();
        virtualTime.dispose();
    }

    @Test
    void testSignInConnectsWithGivenToken() {
        transport.acceptByDefault();

        StepVerifier.create(session.onSignedIn("login-token")).verifyComplete();

        assertEquals(List.of("login-token"), transport.getTokens());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
    }

    @Test
    void testRejectedTokenIsRefreshedOnce() {
        transport.thenRejectCredential().thenAccept();

        StepVerifier.create(session.onSignedIn(null))
            .expectError(AuthException.class)
            .verify();

        assertEquals(List.of("stale", "fresh"), transport.getTokens());
        assertEquals(1, credentials.refreshes.get());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
    }

    @Test
    void testSecondRejectionAfterRefreshStaysDisconnected() {
        transport.thenRejectCredential().thenRejectCredential().thenAccept();

        session.onSignedIn(null).onErrorResume(err -> Mono.empty()).block();
        virtualTime.advanceTimeBy(Duration.ofMinutes(5));

        assertEquals(List.of("stale", "fresh"), transport.getTokens());
        assertEquals(1, credentials.refreshes.get());
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());
    }

    @Test
    void testForegroundAfterBackgroundReconnectsAndAllowsNewRefresh() {
        transport.acceptByDefault();
        session.onSignedIn("t1").block();

        session.onBackground();
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());

        transport.thenRejectCredential();
        session.onForeground().onErrorResume(err -> Mono.empty()).block();

        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals(1, credentials.refreshes.get());
    }

    @Test
    void testSignedOutIgnoresForegroundAndAuthFailures() {
        transport.acceptByDefault();
        session.onSignedIn("t1").block();

        session.onSignedOut();
        session.onForeground().block();

        assertFalse(session.isSignedIn());
        assertEquals(1, transport.getOpenCount());
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());
    }

    @Test
    void testComingBackOnlineReconnectsSignedInSession() {
        ManualReachabilitySource reachability = new ManualReachabilitySource();
        ConnectivityMonitor monitor = new ConnectivityMonitor(reachability, true, Schedulers.immediate(),
            Clock.systemUTC(), metrics);
        monitor.initialize();
        session.followConnectivity(monitor);

        transport.acceptByDefault();
        session.onSignedIn("t1").block();
        channel.disconnect();

        reachability.report(false);
        reachability.report(true);

        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals(2, transport.getOpenCount());
        monitor.dispose();
    }

    /**
     * Hands out {@code current} until refreshed, then {@code refreshed}.
     */
    private static class RefreshingCredentials implements CredentialProvider {
        private final String refreshed;
        private volatile String current;
        final AtomicInteger refreshes = new AtomicInteger();

        RefreshingCredentials(String current, String refreshed) {
            this.current = current;
            this.refreshed = refreshed;
        }

        @Override
        public Mono<String> currentToken() {
            return Mono.just(current);
        }

        @Override
        public Mono<String> refreshToken() {
            return Mono.fromSupplier(() -> {
                refreshes.incrementAndGet();
                current = refreshed;
                return refreshed;
            });
        }
    }
}
