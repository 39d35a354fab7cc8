package com.clinicsync.client.realtime;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.handler.HandlerRegistry;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.client.store.InMemoryDurableStore;
import com.clinicsync.client.support.FakeConnection;
import com.clinicsync.client.support.FakeTransport;
import com.clinicsync.core.error.AuthException;
import com.clinicsync.core.error.TransientNetworkException;
import com.clinicsync.core.msg.EventFrame;
import com.clinicsync.core.msg.RealtimeEvents;
import com.clinicsync.core.store.Keys;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Channel tests against a scripted transport; reconnect delays run on virtual time.
 */
class RealtimeChannelTest {

    private static final String TOKEN = "token-1";

    private SyncConfig config;
    private VirtualTimeScheduler virtualTime;
    private FakeTransport transport;
    private InMemoryDurableStore store;
    private SyncMetrics metrics;
    private HandlerRegistry handlers;
    private OutboundBuffer buffer;
    private RealtimeChannel channel;

    @BeforeEach
    void setUp() {
        config = SyncConfig.defaults().toBuilder().clientId("tablet-3").build();
        virtualTime = VirtualTimeScheduler.create();
        transport = new FakeTransport(() -> virtualTime.now(TimeUnit.MILLISECONDS));
        store = new InMemoryDurableStore();
        metrics = SyncMetrics.inMemory(config);
        handlers = new HandlerRegistry(metrics);
        buffer = new OutboundBuffer(store, config.getClientId(), config.getOutboundBufferMax(), metrics);
        channel = new RealtimeChannel(transport, handlers, buffer, config, metrics, Schedulers.immediate(), virtualTime);
    }

    @AfterEach
    void tearDown() {
        channel.dispose();
        virtualTime.dispose();
    }

    // ========== Buffering and flush ==========

    @Test
    @DisplayName("Three events emitted while disconnected arrive in order after connect")
    void testBufferedEventsFlushInOrder() {
        channel.emit("chat:typing", Map.of("n", 1)).block();
        channel.emit("chat:typing", Map.of("n", 2)).block();
        channel.emit("chat:typing", Map.of("n", 3)).block();
        assertEquals(3, channel.getStatus().getBufferedCount());

        transport.acceptByDefault();
        channel.connect(TOKEN).block();

        FakeConnection connection = transport.lastConnection();
        assertEquals(List.of(1, 2, 3),
            connection.getSent().stream().map(f -> f.getData().get("n").asInt()).toList());
        assertEquals(0, channel.getStatus().getBufferedCount());
        assertEquals(0, buffer.size());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals("conn-1", channel.getStatus().getConnectionId());
    }

    @Test
    void testEmitWhileConnectedSendsDirectly() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();

        channel.emit(RealtimeEvents.MESSAGE_NEW, Map.of("text", "hello")).block();

        assertEquals(List.of(RealtimeEvents.MESSAGE_NEW), transport.lastConnection().sentEvents());
        assertEquals(0, buffer.size());
    }

    @Test
    void testSendFailureWhileConnectedBuffersEvent() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();
        transport.lastConnection().setFailSends(true);

        StepVerifier.create(channel.emit("vitals:update", Map.of("bpm", 72)))
            .verifyComplete();

        assertEquals(1, buffer.size());
        assertEquals("vitals:update", buffer.snapshot().get(0).getEvent());
    }

    @Test
    @DisplayName("An event whose send failed reaches the server before events emitted after it")
    void testFailedSendKeepsSubmissionOrder() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();
        FakeConnection first = transport.lastConnection();

        first.setFailSends(true);
        channel.emit("a", Map.of()).block();
        first.setFailSends(false);
        channel.emit("b", Map.of()).block();
        channel.emit("c", Map.of()).block();

        assertTrue(first.sentEvents().isEmpty());
        assertTrue(first.isClosedByClient());
        assertEquals(ChannelState.RECONNECTING, channel.getStatus().getState());
        assertEquals(3, buffer.size());

        virtualTime.advanceTimeBy(Duration.ofSeconds(1));

        FakeConnection second = transport.lastConnection();
        assertNotSame(first, second);
        assertEquals(List.of("a", "b", "c"), second.sentEvents());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals(0, buffer.size());
    }

    @Test
    void testBufferSnapshotsAreWrittenOnWorkScheduler() {
        List<String> writers = new CopyOnWriteArrayList<>();
        InMemoryDurableStore recordingStore = new InMemoryDurableStore() {
            @Override
            public void write(String key, String value) {
                writers.add(Thread.currentThread().getName());
                super.write(key, value);
            }

            @Override
            public void delete(String key) {
                writers.add(Thread.currentThread().getName());
                super.delete(key);
            }
        };
        Scheduler io = Schedulers.newSingle("buffer-io");
        try {
            OutboundBuffer persisted = new OutboundBuffer(recordingStore, "io-client", 10, metrics);
            RealtimeChannel ioChannel = new RealtimeChannel(transport, handlers, persisted, config, metrics, io, virtualTime);

            ioChannel.emit("chart:opened", Map.of("chartId", 5)).block(Duration.ofSeconds(5));
            assertEquals(1, writers.size());

            transport.acceptByDefault();
            ioChannel.connect(TOKEN).block(Duration.ofSeconds(5));

            assertEquals(List.of("chart:opened"), transport.lastConnection().sentEvents());
            assertEquals(2, writers.size());
            assertTrue(writers.stream().allMatch(name -> name.startsWith("buffer-io")), writers.toString());
            assertTrue(recordingStore.read(Keys.outboundBuffer("io-client")).isEmpty());
            ioChannel.dispose();
        } finally {
            io.dispose();
        }
    }

    @Test
    void testBufferSurvivesRestart() {
        channel.emit("a", Map.of()).block();
        channel.emit("b", Map.of()).block();

        OutboundBuffer reloaded = new OutboundBuffer(store, config.getClientId(), 500, metrics);

        assertEquals(List.of("a", "b"), reloaded.snapshot().stream().map(e -> e.getEvent()).toList());
    }

    @Test
    void testBufferDropsOldestWhenFull() {
        OutboundBuffer small = new OutboundBuffer(new InMemoryDurableStore(), "small", 2, metrics);
        RealtimeChannel bounded = new RealtimeChannel(transport, handlers, small, config, metrics, Schedulers.immediate(), virtualTime);

        bounded.emit("e1", Map.of()).block();
        bounded.emit("e2", Map.of()).block();
        bounded.emit("e3", Map.of()).block();

        assertEquals(List.of("e2", "e3"), small.snapshot().stream().map(e -> e.getEvent()).toList());
        bounded.dispose();
    }

    // ========== Reconnect driver ==========

    @Test
    @DisplayName("Ten automatic failures stop the driver; a manual connect succeeds and resets the counter")
    void testReconnectStopsAtCapUntilManualConnect() {
        StepVerifier.create(channel.connect(TOKEN))
            .expectError(TransientNetworkException.class)
            .verify();

        virtualTime.advanceTimeBy(Duration.ofMinutes(10));

        assertEquals(11, transport.getOpenCount());
        ChannelStatus exhausted = channel.getStatus();
        assertEquals(ChannelState.DISCONNECTED, exhausted.getState());
        assertTrue(exhausted.isReconnectExhausted());
        assertEquals(10, exhausted.getReconnectAttempts());

        virtualTime.advanceTimeBy(Duration.ofHours(1));
        assertEquals(11, transport.getOpenCount());

        transport.acceptByDefault();
        StepVerifier.create(channel.connect(TOKEN)).verifyComplete();

        ChannelStatus connected = channel.getStatus();
        assertEquals(ChannelState.CONNECTED, connected.getState());
        assertEquals(0, connected.getReconnectAttempts());
        assertFalse(connected.isReconnectExhausted());
        assertEquals(12, transport.getOpenCount());
    }

    @Test
    void testReconnectDelaysAreNonDecreasingAndCapped() {
        channel.connect(TOKEN).onErrorResume(err -> Mono.empty()).block();
        virtualTime.advanceTimeBy(Duration.ofMinutes(10));

        List<Long> times = transport.getOpenTimes();
        List<Long> gaps = new ArrayList<>();
        for (int i = 1; i < times.size(); i++) {
            gaps.add(times.get(i) - times.get(i - 1));
        }

        assertEquals(List.of(1000L, 2000L, 4000L, 5000L, 5000L, 5000L, 5000L, 5000L, 5000L, 5000L), gaps);
    }

    @Test
    void testLostConnectionReconnectsAndFlushesEventsEmittedMeanwhile() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();
        FakeConnection first = transport.lastConnection();

        first.drop();
        assertEquals(ChannelState.RECONNECTING, channel.getStatus().getState());
        assertEquals(1, channel.getStatus().getReconnectAttempts());

        channel.emit("note:draft", Map.of("v", 1)).block();
        assertTrue(first.getSent().isEmpty());

        virtualTime.advanceTimeBy(Duration.ofSeconds(1));

        FakeConnection second = transport.lastConnection();
        assertNotSame(first, second);
        assertEquals(List.of("note:draft"), second.sentEvents());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals(0, channel.getStatus().getReconnectAttempts());
    }

    @Test
    void testConnectTimeoutIsRetried() {
        Sinks.One<TransportConnection> hanging = transport.thenHang();
        transport.acceptByDefault();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        channel.connect(TOKEN).subscribe(null, failure::set);

        virtualTime.advanceTimeBy(config.getConnectTimeout());
        assertInstanceOf(TransientNetworkException.class, failure.get());
        assertEquals(ChannelState.RECONNECTING, channel.getStatus().getState());

        virtualTime.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
        assertEquals(0, hanging.currentSubscriberCount());
    }

    @Test
    void testDisconnectCancelsPendingReconnectAndKeepsBuffer() {
        channel.emit("kept", Map.of()).block();
        channel.connect(TOKEN).onErrorResume(err -> Mono.empty()).block();
        assertEquals(ChannelState.RECONNECTING, channel.getStatus().getState());

        channel.disconnect();
        virtualTime.advanceTimeBy(Duration.ofHours(1));

        assertEquals(1, transport.getOpenCount());
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());
        assertEquals(1, buffer.size());
    }

    @Test
    void testDisconnectClosesLiveConnectionWithoutReconnecting() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();
        FakeConnection connection = transport.lastConnection();

        channel.disconnect();
        virtualTime.advanceTimeBy(Duration.ofMinutes(1));

        assertTrue(connection.isClosedByClient());
        assertEquals(1, transport.getOpenCount());
        assertNull(channel.getStatus().getConnectionId());
    }

    // ========== Connect semantics ==========

    @Test
    void testConcurrentConnectsShareOneAttempt() {
        Sinks.One<TransportConnection> pending = transport.thenHang();
        AtomicInteger completed = new AtomicInteger();

        channel.connect(TOKEN).subscribe(null, null, completed::incrementAndGet);
        channel.connect(TOKEN).subscribe(null, null, completed::incrementAndGet);
        assertEquals(1, transport.getOpenCount());
        assertEquals(ChannelState.CONNECTING, channel.getStatus().getState());

        pending.tryEmitValue(transport.newConnection());

        assertEquals(2, completed.get());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
    }

    @Test
    void testConnectWhenConnectedIsNoOp() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();

        StepVerifier.create(channel.connect(TOKEN)).verifyComplete();

        assertEquals(1, transport.getOpenCount());
    }

    @Test
    void testRejectedCredentialStopsWithoutRetrying() {
        transport.thenRejectCredential();
        List<AuthException> rejected = new CopyOnWriteArrayList<>();
        channel.onAuthFailure(rejected::add);

        StepVerifier.create(channel.connect("expired"))
            .expectError(AuthException.class)
            .verify();
        virtualTime.advanceTimeBy(Duration.ofMinutes(10));

        assertEquals(1, transport.getOpenCount());
        assertEquals(1, rejected.size());
        assertEquals(401, rejected.get(0).getStatus());
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());
        assertEquals(0, channel.getStatus().getReconnectAttempts());
    }

    @Test
    void testRejectedCredentialDuringReconnectGivesBackTheAttempt() {
        transport.thenRefuse().thenRejectCredential();

        channel.connect(TOKEN).onErrorResume(err -> Mono.empty()).block();
        assertEquals(1, channel.getStatus().getReconnectAttempts());

        virtualTime.advanceTimeBy(Duration.ofMinutes(10));

        assertEquals(2, transport.getOpenCount());
        assertEquals(0, channel.getStatus().getReconnectAttempts());
        assertEquals(ChannelState.DISCONNECTED, channel.getStatus().getState());
    }

    @Test
    void testStatusChangesFollowLifecycle() {
        transport.acceptByDefault();

        StepVerifier.create(channel.statusChanges().map(ChannelStatus::getState))
            .expectNext(ChannelState.DISCONNECTED)
            .then(() -> channel.connect(TOKEN).subscribe())
            .expectNext(ChannelState.CONNECTING, ChannelState.CONNECTED)
            .then(channel::disconnect)
            .expectNext(ChannelState.DISCONNECTED)
            .thenCancel()
            .verify();
    }

    // ========== Inbound and rooms ==========

    @Test
    void testInboundEventsReachEveryHandler() {
        List<JsonNode> first = new CopyOnWriteArrayList<>();
        List<JsonNode> second = new CopyOnWriteArrayList<>();
        handlers.register(RealtimeEvents.LAB_RESULT_READY, first::add);
        handlers.register(RealtimeEvents.LAB_RESULT_READY, payload -> {
            throw new IllegalStateException("render failed");
        });
        handlers.register(RealtimeEvents.LAB_RESULT_READY, second::add);
        transport.acceptByDefault();
        channel.connect(TOKEN).block();

        FakeConnection connection = transport.lastConnection();
        connection.receive(RealtimeEvents.LAB_RESULT_READY, Map.of("labId", "L-9"));
        connection.receive("unknown:event", Map.of());

        assertEquals(1, first.size());
        assertEquals("L-9", first.get(0).get("labId").asText());
        assertEquals(1, second.size());
        assertEquals(ChannelState.CONNECTED, channel.getStatus().getState());
    }

    @Test
    void testRoomsAreJoinedOnConnectAndRejoinedAfterReconnect() {
        channel.joinRoom("ward-4").block();
        channel.emit("presence", Map.of("state", "on-shift")).block();
        transport.acceptByDefault();

        channel.connect(TOKEN).block();
        FakeConnection first = transport.lastConnection();
        assertEquals(List.of(RealtimeEvents.ROOM_JOIN, "presence"), first.sentEvents());
        assertEquals("ward-4", first.getSent().get(0).getData().get("room").asText());

        first.drop();
        virtualTime.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals(List.of(RealtimeEvents.ROOM_JOIN), transport.lastConnection().sentEvents());
    }

    @Test
    void testLeaveRoomWhileConnected() {
        transport.acceptByDefault();
        channel.connect(TOKEN).block();

        channel.joinRoom("patient-12").block();
        channel.joinRoom("patient-12").block();
        channel.leaveRoom("patient-12").block();

        List<EventFrame> sent = transport.lastConnection().getSent();
        assertEquals(List.of(RealtimeEvents.ROOM_JOIN, RealtimeEvents.ROOM_LEAVE),
            sent.stream().map(EventFrame::getEvent).toList());
        assertTrue(channel.getRooms().isEmpty());
    }
}
