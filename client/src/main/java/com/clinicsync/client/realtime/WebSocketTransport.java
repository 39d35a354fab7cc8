package com.clinicsync.client.realtime;

import com.clinicsync.core.error.AuthException;
import com.clinicsync.core.error.TransientNetworkException;
import com.clinicsync.core.msg.EventFrame;
import com.clinicsync.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Realtime transport over a Reactor Netty WebSocket client.
 * <p>
 * Protocol (both directions): text frames carrying {@code {"event": name, "data": payload}}.
 * The bearer token travels in the handshake {@code Authorization} header; a 401 or 403
 * handshake response is reported as {@link AuthException}.
 * </p>
 */
public class WebSocketTransport implements IRealtimeTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final HttpClient httpClient;
    private final String url;

    public WebSocketTransport(HttpClient httpClient, String url) {
        this.httpClient = httpClient;
        this.url = url;
    }

    @Override
    public Mono<TransportConnection> open(String authToken) {
        return Mono.create(sink -> {
            String id = UUID.randomUUID().toString();
            AtomicBoolean opened = new AtomicBoolean(false);
            Sinks.Many<EventFrame> inbound = Sinks.many().multicast().directBestEffort();
            Sinks.Empty<Void> closed = Sinks.empty();

            Disposable session = httpClient
                .headers(headers -> headers.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + authToken))
                .websocket()
                .uri(url)
                .handle((in, out) -> {
                    WebSocketConnection connection = new WebSocketConnection(id, out, inbound, closed);
                    opened.set(true);
                    log.debug("WebSocket {} opened to {}", id, url);
                    sink.success(connection);
                    return Mono.when(
                        out.sendString(connection.outboundFlux()),
                        receive(id, in, inbound).doFinally(signal -> connection.completeOutbound())
                    );
                })
                .subscribe(
                    ignored -> {
                    },
                    err -> {
                        if (opened.get()) {
                            if (!(err instanceof AbortedException)) {
                                log.warn("WebSocket {} failed: {}", id, err.toString());
                            }
                            inbound.tryEmitComplete();
                            closed.tryEmitError(new TransientNetworkException("Connection lost", err));
                        } else {
                            sink.error(mapHandshakeError(err));
                        }
                    },
                    () -> {
                        log.debug("WebSocket {} closed", id);
                        inbound.tryEmitComplete();
                        closed.tryEmitEmpty();
                        if (!opened.get()) {
                            sink.error(new TransientNetworkException("Connection closed during handshake"));
                        }
                    }
                );

            sink.onCancel(() -> {
                if (!opened.get()) {
                    session.dispose();
                }
            });
            closed.asMono().subscribe(null, err -> session.dispose(), session::dispose);
        });
    }

    private Mono<Void> receive(String id, WebsocketInbound in, Sinks.Many<EventFrame> inbound) {
        return in.aggregateFrames()
            .receive()
            .asString()
            .concatMap(text -> {
                try {
                    EventFrame frame = JsonUtils.readValue(text, EventFrame.class);
                    if (frame.getEvent() == null) {
                        log.warn("Frame without event name on {}: {}", id, text);
                        return Mono.empty();
                    }
                    inbound.tryEmitNext(frame);
                } catch (IllegalArgumentException e) {
                    log.warn("Undecodable frame on {}: {}", id, e.getMessage());
                }
                return Mono.empty();
            })
            .then();
    }

    static Throwable mapHandshakeError(Throwable err) {
        for (Throwable cause = err; cause != null; cause = cause.getCause()) {
            if (cause instanceof WebSocketClientHandshakeException handshake && handshake.response() != null) {
                int status = handshake.response().status().code();
                if (status == 401 || status == 403) {
                    return new AuthException("Realtime handshake rejected with " + status, status, err);
                }
                return new TransientNetworkException("Realtime handshake failed with " + status, err);
            }
        }
        if (err instanceof AuthException || err instanceof TransientNetworkException) {
            return err;
        }
        return new TransientNetworkException("Realtime connect failed: " + err.getMessage(), err);
    }

    private static final class WebSocketConnection implements TransportConnection {
        private final String id;
        private final WebsocketOutbound out;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Sinks.Many<EventFrame> inbound;
        private final Sinks.Empty<Void> closed;

        WebSocketConnection(String id, WebsocketOutbound out, Sinks.Many<EventFrame> inbound, Sinks.Empty<Void> closed) {
            this.id = id;
            this.out = out;
            this.inbound = inbound;
            this.closed = closed;
        }

        Flux<String> outboundFlux() {
            return outbound.asFlux();
        }

        void completeOutbound() {
            synchronized (outbound) {
                outbound.tryEmitComplete();
            }
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Mono<Void> send(EventFrame frame) {
            return Mono.defer(() -> {
                String json = JsonUtils.writeValueAsString(frame);
                Sinks.EmitResult result;
                synchronized (outbound) {
                    result = outbound.tryEmitNext(json);
                }
                if (result.isFailure()) {
                    return Mono.error(new TransientNetworkException("Send on " + id + " rejected: " + result));
                }
                return Mono.empty();
            });
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
            completeOutbound();
            out.sendClose()
                .subscribe(null, err -> log.debug("Close frame on {} not sent: {}", id, err.toString()));
        }
    }
}
