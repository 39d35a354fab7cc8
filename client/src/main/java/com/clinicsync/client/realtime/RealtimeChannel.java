package com.clinicsync.client.realtime;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.handler.HandlerRegistry;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.core.error.AuthException;
import com.clinicsync.core.error.TransientNetworkException;
import com.clinicsync.core.msg.BufferedEvent;
import com.clinicsync.core.msg.EventFrame;
import com.clinicsync.core.msg.RealtimeEvents;
import com.clinicsync.core.util.BytesUtils;
import com.clinicsync.core.util.JitterBackoff;
import com.clinicsync.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Persistent realtime connection with bounded automatic reconnect and an outbound buffer.
 * <p>
 * <b>Connect:</b> one attempt at a time. Each attempt owns a {@link Sinks.One} that every
 * {@link #connect(String)} caller awaits; it completes once the connection is open, rooms are
 * re-joined and the outbound buffer is flushed, and errors if the attempt fails.
 * </p>
 * <p>
 * <b>Reconnect:</b> after a failed attempt or a lost connection the channel waits
 * {@code base * 2^(n-1)} capped at {@code max} (plus optional jitter) before automatic attempt
 * {@code n}. Once {@code reconnectMaxAttempts} automatic attempts failed, the channel stays
 * {@link ChannelState#DISCONNECTED} until the next explicit connect, which resets the count.
 * A rejected credential stops the driver without using up an attempt and is reported to
 * {@link #onAuthFailure(Consumer) auth listeners}.
 * </p>
 * <p>
 * <b>Ordering:</b> while not {@link ChannelState#CONNECTED}, emits append to the
 * {@link OutboundBuffer}. The flush repeats until a check under {@code lock} finds the buffer
 * empty, and only that check switches the channel to CONNECTED, so events emitted during a
 * flush are sent after it. A failed send buffers the event and drops the connection, so the
 * event goes out ahead of everything emitted after it.
 * </p>
 * <p>
 * Buffer snapshots are written on {@code workScheduler}, never under {@code lock}.
 * </p>
 * <p>
 * Every attempt bumps {@code generation}; callbacks from an older generation are ignored.
 * </p>
 */
public class RealtimeChannel implements IRealtimeChannel {
    private static final Logger log = LoggerFactory.getLogger(RealtimeChannel.class);

    private final IRealtimeTransport transport;
    private final HandlerRegistry handlers;
    private final OutboundBuffer buffer;
    private final SyncConfig config;
    private final SyncMetrics metrics;
    private final Scheduler workScheduler;
    private final Scheduler timerScheduler;

    private final Object lock = new Object();
    private ChannelState state = ChannelState.DISCONNECTED;
    @Nullable
    private String token;
    @Nullable
    private TransportConnection connection;
    private long generation;
    private int reconnectAttempts;
    private boolean reconnectExhausted;
    @Nullable
    private Sinks.One<Void> inflight;
    @Nullable
    private Disposable attempt;
    @Nullable
    private Disposable reconnectTimer;
    @Nullable
    private Disposable connectionWatch;
    private final Set<String> rooms = new LinkedHashSet<>();

    private final Sinks.Many<ChannelStatus> statusSink = Sinks.many().replay().latest();
    private final List<Consumer<AuthException>> authListeners = new CopyOnWriteArrayList<>();

    /**
     * @param workScheduler  scheduler for buffer snapshot writes
     * @param timerScheduler scheduler for connect timeouts and reconnect delays
     */
    public RealtimeChannel(IRealtimeTransport transport,
                           HandlerRegistry handlers,
                           OutboundBuffer buffer,
                           SyncConfig config,
                           SyncMetrics metrics,
                           Scheduler workScheduler,
                           Scheduler timerScheduler) {
        this.transport = transport;
        this.handlers = handlers;
        this.buffer = buffer;
        this.config = config;
        this.metrics = metrics;
        this.workScheduler = workScheduler;
        this.timerScheduler = timerScheduler;

        metrics.bindBufferDepth(buffer::size);
        publishStatus();
    }

    @Override
    public Mono<Void> connect(String authToken) {
        return Mono.defer(() -> {
            Sinks.One<Void> pending;
            boolean start = false;
            synchronized (lock) {
                token = authToken;
                reconnectAttempts = 0;
                reconnectExhausted = false;
                if (state == ChannelState.CONNECTED) {
                    return Mono.empty();
                }
                cancelReconnectTimerLocked();
                if (inflight == null) {
                    start = true;
                    inflight = Sinks.one();
                }
                pending = inflight;
            }
            if (start) {
                log.info("Connecting realtime channel");
                startAttempt(false);
            } else {
                log.debug("Connect already in flight, joining it");
            }
            return pending.asMono();
        });
    }

    private void startAttempt(boolean automatic) {
        long gen;
        String authToken;
        synchronized (lock) {
            if (inflight == null) {
                inflight = Sinks.one();
            }
            gen = ++generation;
            authToken = token;
            state = automatic ? ChannelState.RECONNECTING : ChannelState.CONNECTING;
        }
        publishStatus();

        Disposable subscription = transport.open(authToken)
            .timeout(config.getConnectTimeout(), timerScheduler)
            .subscribe(
                conn -> onOpened(conn, automatic, gen),
                err -> onAttemptFailed(err, automatic, gen)
            );

        synchronized (lock) {
            if (gen == generation && connection == null && !subscription.isDisposed()) {
                attempt = subscription;
            }
        }
    }

    private void onOpened(TransportConnection conn, boolean automatic, long gen) {
        synchronized (lock) {
            if (gen != generation) {
                log.debug("Discarding stale connection {}", conn.id());
                conn.close();
                return;
            }
            connection = conn;
            attempt = null;
            reconnectAttempts = 0;
            reconnectExhausted = false;
        }
        metrics.recordConnectAttempt(automatic, "success");
        log.info("Realtime connection {} open, re-joining rooms and flushing {} buffered events",
            conn.id(), buffer.size());

        Disposable inbound = conn.inbound().subscribe(
            this::dispatch,
            err -> log.warn("Inbound stream of {} failed: {}", conn.id(), err.toString())
        );
        Disposable closed = conn.onClose().subscribe(
            null,
            err -> onConnectionLost(gen, err),
            () -> onConnectionLost(gen, null)
        );
        synchronized (lock) {
            if (gen == generation) {
                connectionWatch = Disposables.composite(inbound, closed);
            } else {
                inbound.dispose();
                closed.dispose();
                return;
            }
        }

        rejoinRooms(conn)
            .then(flush(conn, gen))
            .subscribe(
                null,
                err -> {
                    log.warn("Flush on {} failed, treating connection as lost: {}", conn.id(), err.toString());
                    conn.close();
                    onConnectionLost(gen, err);
                }
            );
    }

    private Mono<Void> flush(TransportConnection conn, long gen) {
        return Mono.defer(() -> {
            List<BufferedEvent> pending;
            Sinks.One<Void> done = null;
            synchronized (lock) {
                if (gen != generation) {
                    return Mono.empty();
                }
                pending = buffer.snapshot();
                if (pending.isEmpty()) {
                    state = ChannelState.CONNECTED;
                    done = inflight;
                    inflight = null;
                }
            }
            if (pending.isEmpty()) {
                log.info("Realtime channel connected ({})", conn.id());
                publishStatus();
                if (done != null) {
                    done.tryEmitEmpty();
                }
                return Mono.empty();
            }
            return Flux.fromIterable(pending)
                .concatMap(event -> send(conn, event.toFrame()))
                .publishOn(workScheduler)
                .then(Mono.fromRunnable(() -> {
                    int removed = buffer.removeDelivered(pending);
                    buffer.persist();
                    log.debug("Flushed {} buffered events on {}", removed, conn.id());
                }))
                .then(flush(conn, gen));
        });
    }

    private Mono<Void> rejoinRooms(TransportConnection conn) {
        List<String> joined;
        synchronized (lock) {
            joined = new ArrayList<>(rooms);
        }
        return Flux.fromIterable(joined)
            .concatMap(room -> send(conn, roomFrame(RealtimeEvents.ROOM_JOIN, room)))
            .then();
    }

    private void onAttemptFailed(Throwable err, boolean automatic, long gen) {
        AuthException authFailure = err instanceof AuthException ? (AuthException) err : null;
        Sinks.One<Void> failed;
        Duration delay = null;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            attempt = null;
            failed = inflight;
            inflight = null;
            if (authFailure != null) {
                if (automatic && reconnectAttempts > 0) {
                    reconnectAttempts--;
                }
                state = ChannelState.DISCONNECTED;
            } else {
                delay = nextReconnectDelayLocked();
            }
        }
        metrics.recordConnectAttempt(automatic, authFailure != null ? "auth" : "failure");

        if (authFailure != null) {
            log.warn("Realtime credential rejected (status {}), not retrying", authFailure.getStatus());
            notifyAuthFailure(authFailure);
        } else {
            log.warn("Realtime connect attempt failed: {}", err.toString());
        }
        if (delay != null) {
            scheduleReconnect(delay, gen);
        }
        publishStatus();
        if (failed != null) {
            failed.tryEmitError(authFailure != null ? authFailure : toTransient(err));
        }
    }

    private void onConnectionLost(long gen, @Nullable Throwable err) {
        Sinks.One<Void> interrupted;
        Duration delay;
        synchronized (lock) {
            if (gen != generation || connection == null) {
                return;
            }
            log.warn("Realtime connection {} lost{}", connection.id(), err == null ? "" : ": " + err);
            connection = null;
            generation++;
            disposeWatchLocked();
            interrupted = inflight;
            inflight = null;
            delay = nextReconnectDelayLocked();
        }
        if (delay != null) {
            scheduleReconnect(delay, gen + 1);
        }
        publishStatus();
        if (interrupted != null) {
            interrupted.tryEmitError(new TransientNetworkException("Connection lost before it was ready", err));
        }
    }

    /**
     * Advances the reconnect counter.
     *
     * @return delay before the next automatic attempt, or null when the cap was reached
     */
    @Nullable
    private Duration nextReconnectDelayLocked() {
        if (reconnectAttempts >= config.getReconnectMaxAttempts()) {
            reconnectExhausted = true;
            state = ChannelState.DISCONNECTED;
            log.warn("Giving up after {} reconnect attempts; waiting for an explicit connect", reconnectAttempts);
            return null;
        }
        reconnectAttempts++;
        state = ChannelState.RECONNECTING;
        return JitterBackoff.next(reconnectAttempts - 1,
            config.getReconnectBaseDelay(), config.getReconnectMaxDelay(), config.getReconnectJitter());
    }

    private void scheduleReconnect(Duration delay, long gen) {
        log.info("Reconnecting in {} (attempt {}/{})", delay, reconnectAttemptsSnapshot(), config.getReconnectMaxAttempts());
        Disposable timer = Mono.delay(delay, timerScheduler)
            .subscribe(tick -> {
                synchronized (lock) {
                    if (gen != generation) {
                        return;
                    }
                    reconnectTimer = null;
                }
                startAttempt(true);
            });
        synchronized (lock) {
            if (gen == generation && !timer.isDisposed()) {
                reconnectTimer = timer;
                return;
            }
        }
        // Superseded by a newer attempt or disconnect
        timer.dispose();
    }

    @Override
    public void disconnect() {
        TransportConnection open;
        Sinks.One<Void> pending;
        synchronized (lock) {
            generation++;
            cancelReconnectTimerLocked();
            if (attempt != null) {
                attempt.dispose();
                attempt = null;
            }
            disposeWatchLocked();
            open = connection;
            connection = null;
            pending = inflight;
            inflight = null;
            state = ChannelState.DISCONNECTED;
        }
        if (open != null) {
            log.info("Closing realtime connection {}", open.id());
            open.close();
        }
        publishStatus();
        if (pending != null) {
            pending.tryEmitError(new TransientNetworkException("Disconnected before the connection was ready"));
        }
    }

    @Override
    public Mono<Void> emit(String event, Object payload) {
        return Mono.defer(() -> {
            BufferedEvent buffered = new BufferedEvent(event, JsonUtils.toTree(payload), System.currentTimeMillis());
            TransportConnection live;
            synchronized (lock) {
                live = state == ChannelState.CONNECTED ? connection : null;
                if (live == null) {
                    buffer.append(buffered);
                }
            }
            if (live == null) {
                log.debug("Buffered '{}' while {}", event, getStatus().getState());
                return persistBuffer();
            }
            return send(live, buffered.toFrame())
                .onErrorResume(err -> {
                    log.warn("Send of '{}' failed, buffering and dropping connection {}: {}",
                        event, live.id(), err.toString());
                    onSendFailed(live, buffered, err);
                    return persistBuffer();
                });
        });
    }

    private void onSendFailed(TransportConnection conn, BufferedEvent buffered, Throwable err) {
        long gen;
        synchronized (lock) {
            buffer.append(buffered);
            gen = connection == conn ? generation : -1;
        }
        conn.close();
        if (gen >= 0) {
            onConnectionLost(gen, err);
        }
    }

    private Mono<Void> persistBuffer() {
        return Mono.fromRunnable(() -> {
                buffer.persist();
                publishStatus();
            })
            .subscribeOn(workScheduler)
            .then();
    }

    @Override
    public Mono<Void> joinRoom(String room) {
        return Mono.defer(() -> {
            TransportConnection live;
            synchronized (lock) {
                if (!rooms.add(room)) {
                    return Mono.empty();
                }
                live = state == ChannelState.CONNECTED ? connection : null;
            }
            log.debug("Joined room {}", room);
            return live == null ? Mono.empty() : send(live, roomFrame(RealtimeEvents.ROOM_JOIN, room));
        });
    }

    @Override
    public Mono<Void> leaveRoom(String room) {
        return Mono.defer(() -> {
            TransportConnection live;
            synchronized (lock) {
                if (!rooms.remove(room)) {
                    return Mono.empty();
                }
                live = state == ChannelState.CONNECTED ? connection : null;
            }
            log.debug("Left room {}", room);
            return live == null ? Mono.empty() : send(live, roomFrame(RealtimeEvents.ROOM_LEAVE, room));
        });
    }

    public Set<String> getRooms() {
        synchronized (lock) {
            return Set.copyOf(rooms);
        }
    }

    @Override
    public ChannelStatus getStatus() {
        synchronized (lock) {
            return ChannelStatus.builder()
                .state(state)
                .reconnectAttempts(reconnectAttempts)
                .reconnectExhausted(reconnectExhausted)
                .bufferedCount(buffer.size())
                .connectionId(connection != null ? connection.id() : null)
                .build();
        }
    }

    @Override
    public Flux<ChannelStatus> statusChanges() {
        return statusSink.asFlux().distinctUntilChanged();
    }

    @Override
    public Disposable onAuthFailure(Consumer<AuthException> listener) {
        authListeners.add(listener);
        return () -> authListeners.remove(listener);
    }

    @Override
    public void dispose() {
        disconnect();
        synchronized (statusSink) {
            statusSink.tryEmitComplete();
        }
    }

    private Mono<Void> send(TransportConnection conn, EventFrame frame) {
        return conn.send(frame)
            .doOnSuccess(v -> metrics.recordOutboundBytes(
                BytesUtils.getBytesLength(frame.getData() == null ? "null" : frame.getData().toString())));
    }

    private void dispatch(EventFrame frame) {
        metrics.recordInbound();
        int invoked = handlers.dispatch(frame.getEvent(), frame.getData());
        log.trace("Dispatched '{}' to {} handlers", frame.getEvent(), invoked);
    }

    private void notifyAuthFailure(AuthException error) {
        for (Consumer<AuthException> listener : authListeners) {
            try {
                listener.accept(error);
            } catch (Exception e) {
                log.warn("Auth failure listener threw: {}", e.getMessage(), e);
            }
        }
    }

    private void publishStatus() {
        ChannelStatus status = getStatus();
        synchronized (statusSink) {
            statusSink.tryEmitNext(status);
        }
    }

    private static EventFrame roomFrame(String event, String room) {
        return new EventFrame(event, JsonUtils.toTree(Map.of("room", room)));
    }

    private static Throwable toTransient(Throwable err) {
        return err instanceof TransientNetworkException ? err
            : new TransientNetworkException("Realtime connect failed: " + err, err);
    }

    private int reconnectAttemptsSnapshot() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    // Caller holds lock
    private void cancelReconnectTimerLocked() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }

    // Caller holds lock
    private void disposeWatchLocked() {
        if (connectionWatch != null) {
            connectionWatch.dispose();
            connectionWatch = null;
        }
    }
}
