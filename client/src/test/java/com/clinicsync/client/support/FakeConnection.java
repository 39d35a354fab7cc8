package com.clinicsync.client.support;

import com.clinicsync.client.realtime.TransportConnection;
import com.clinicsync.core.error.TransientNetworkException;
import com.clinicsync.core.msg.EventFrame;
import com.clinicsync.core.util.JsonUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connection recording everything sent through it.
 */
public class FakeConnection implements TransportConnection {
    private final String id;
    private final List<EventFrame> sent = new CopyOnWriteArrayList<>();
    private final Sinks.Many<EventFrame> inbound = Sinks.many().multicast().directBestEffort();
    private final Sinks.Empty<Void> closed = Sinks.empty();

    private volatile boolean failSends;
    private volatile boolean closedByClient;

    public FakeConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Mono<Void> send(EventFrame frame) {
        if (failSends) {
            return Mono.error(new TransientNetworkException("socket write failed"));
        }
        sent.add(frame);
        return Mono.empty();
    }

    @Override
    public Flux<EventFrame> inbound() {
        return inbound.asFlux();
    }

    @Override
    public Mono<Void> onClose() {
        return closed.asMono();
    }

    @Override
    public void close() {
        closedByClient = true;
        closed.tryEmitEmpty();
    }

    /**
     * Simulates the server delivering a frame.
     */
    public void receive(String event, Object payload) {
        inbound.tryEmitNext(new EventFrame(event, JsonUtils.toTree(payload)));
    }

    /**
     * Simulates the server or network dropping the connection.
     */
    public void drop() {
        closed.tryEmitError(new TransientNetworkException("connection reset"));
    }

    public void setFailSends(boolean failSends) {
        this.failSends = failSends;
    }

    public List<EventFrame> getSent() {
        return sent;
    }

    public List<String> sentEvents() {
        return sent.stream().map(EventFrame::getEvent).toList();
    }

    public boolean isClosedByClient() {
        return closedByClient;
    }
}
