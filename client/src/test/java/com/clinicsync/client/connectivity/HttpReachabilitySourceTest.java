package com.clinicsync.client.connectivity;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpReachabilitySourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final AtomicInteger status = new AtomicInteger(200);
    private DisposableServer server;
    private HttpReachabilitySource source;

    @BeforeEach
    void setUp() {
        server = HttpServer.create()
            .host("localhost")
            .port(0)
            .route(routes -> routes.get("/health",
                (req, res) -> res.status(status.get()).sendString(Mono.just("ok")).then()))
            .bindNow();
        source = new HttpReachabilitySource(HttpClient.create(), "http://localhost:" + server.port() + "/health",
            Duration.ofMillis(200), Duration.ofSeconds(2), Schedulers.parallel());
    }

    @AfterEach
    void tearDown() {
        server.disposeNow();
    }

    @Test
    void testHealthyEndpointIsOnline() {
        assertEquals(Boolean.TRUE, source.probe().block(TIMEOUT));
    }

    @Test
    void testErrorStatusIsOffline() {
        status.set(503);

        assertEquals(Boolean.FALSE, source.probe().block(TIMEOUT));
    }

    @Test
    void testUnreachableEndpointIsOffline() {
        server.disposeNow();

        assertEquals(Boolean.FALSE, source.probe().block(TIMEOUT));
    }

    @Test
    void testObserveFollowsEndpoint() {
        StepVerifier.create(source.observe().distinctUntilChanged().take(2))
            .expectNext(true)
            .then(() -> status.set(500))
            .expectNext(false)
            .expectComplete()
            .verify(TIMEOUT);
    }
}
