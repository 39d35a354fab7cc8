package com.clinicsync.client.realtime;

import com.clinicsync.core.msg.EventFrame;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One open bidirectional connection.
 */
public interface TransportConnection {
    String id();

    /**
     * Hands a frame to the transport.
     *
     * @return Mono completing once the frame was accepted, erroring if the connection is unusable
     */
    Mono<Void> send(EventFrame frame);

    /**
     * @return frames received from the server; completes when the connection closes
     */
    Flux<EventFrame> inbound();

    /**
     * @return Mono completing (or erroring) when the connection is gone, whoever closed it
     */
    Mono<Void> onClose();

    void close();
}
