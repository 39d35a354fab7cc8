package com.clinicsync.client.realtime;

import com.clinicsync.core.error.AuthException;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Interface for the realtime channel (Dependency Inversion Principle).
 */
public interface IRealtimeChannel {
    /**
     * Connects with {@code authToken}. No-op when already connected; concurrent callers share
     * the attempt in flight. Resets the automatic reconnect counter.
     *
     * @return Mono completing once connected and the outbound buffer is flushed
     */
    Mono<Void> connect(String authToken);

    /**
     * Closes the connection and stops automatic reconnects. Buffered events are kept.
     */
    void disconnect();

    /**
     * Sends an event, or buffers it while not connected. Never fails for lack of a connection.
     */
    Mono<Void> emit(String event, Object payload);

    Mono<Void> joinRoom(String room);

    Mono<Void> leaveRoom(String room);

    ChannelStatus getStatus();

    Flux<ChannelStatus> statusChanges();

    /**
     * Registers a listener for rejected credentials.
     *
     * @return handle that unregisters the listener
     */
    Disposable onAuthFailure(Consumer<AuthException> listener);

    void dispose();
}
