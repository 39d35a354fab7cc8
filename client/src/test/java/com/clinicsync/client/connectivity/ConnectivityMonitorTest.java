package com.clinicsync.client.connectivity;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.core.model.ConnectivityState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    private ManualReachabilitySource source;
    private ConnectivityMonitor monitor;

    @BeforeEach
    void setUp() {
        source = new ManualReachabilitySource();
        monitor = new ConnectivityMonitor(source, false, Schedulers.immediate(),
            Clock.fixed(NOW, ZoneOffset.UTC), SyncMetrics.inMemory(SyncConfig.defaults()));
        monitor.initialize();
    }

    @AfterEach
    void tearDown() {
        monitor.dispose();
    }

    @Test
    void testStartsWithInitialSnapshot() {
        assertFalse(monitor.getIsOnline());
        assertEquals(Instant.EPOCH, monitor.getState().getLastTransitionAt());
    }

    @Test
    void testListenerNotifiedOnlyOnRealChanges() {
        List<Boolean> seen = new CopyOnWriteArrayList<>();
        monitor.subscribe(state -> seen.add(state.isOnline()));

        source.report(false);
        source.report(true);
        source.report(true);
        source.report(false);
        source.report(false);
        source.report(true);

        assertEquals(List.of(true, false, true), seen);
        assertTrue(monitor.getIsOnline());
        assertEquals(NOW, monitor.getState().getLastTransitionAt());
    }

    @Test
    void testUnsubscribeStopsNotifications() {
        AtomicInteger calls = new AtomicInteger();
        Disposable handle = monitor.subscribe(state -> calls.incrementAndGet());

        source.report(true);
        handle.dispose();
        source.report(false);

        assertEquals(1, calls.get());
    }

    @Test
    void testThrowingListenerDoesNotBlockOthers() {
        AtomicInteger healthy = new AtomicInteger();
        monitor.subscribe(state -> {
            throw new IllegalStateException("boom");
        });
        monitor.subscribe(state -> healthy.incrementAndGet());

        source.report(true);

        assertEquals(1, healthy.get());
        assertTrue(monitor.getIsOnline());
    }

    @Test
    void testOnlineHooksRunOnEachReconnect() {
        AtomicInteger refreshes = new AtomicInteger();
        monitor.addOnlineHook(refreshes::incrementAndGet);
        monitor.addOnlineHook(() -> {
            throw new IllegalStateException("stale cache refresh failed");
        });

        source.report(true);
        source.report(false);
        source.report(true);

        assertEquals(2, refreshes.get());
    }

    @Test
    void testChangesStreamEmitsTransitions() {
        StepVerifier.create(monitor.changes().map(ConnectivityState::isOnline).take(2))
            .then(() -> {
                source.report(true);
                source.report(true);
                source.report(false);
            })
            .expectNext(true, false)
            .verifyComplete();
    }

    @Test
    void testInitializeIsIdempotent() {
        AtomicInteger calls = new AtomicInteger();
        monitor.subscribe(state -> calls.incrementAndGet());

        monitor.initialize();
        source.report(true);

        assertEquals(1, calls.get());
    }

    @Test
    void testConcurrentSignalsPublishEveryTransition() throws InterruptedException {
        AtomicInteger notified = new AtomicInteger();
        AtomicInteger published = new AtomicInteger();
        monitor.subscribe(state -> notified.incrementAndGet());
        Disposable stream = monitor.changes().subscribe(state -> published.incrementAndGet());

        Thread up = new Thread(() -> {
            for (int i = 0; i < 20_000; i++) {
                monitor.onSignal(true);
            }
        });
        Thread down = new Thread(() -> {
            for (int i = 0; i < 20_000; i++) {
                monitor.onSignal(false);
            }
        });
        up.start();
        down.start();
        up.join();
        down.join();
        stream.dispose();

        assertTrue(notified.get() > 0);
        assertEquals(notified.get(), published.get());
    }
}
