package com.clinicsync.client.connectivity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Reachability derived from periodic health probes against the backend.
 * <p>
 * A probe counts as online when the health endpoint answers 2xx within {@code timeout};
 * any other status, connection error or timeout counts as offline.
 * </p>
 */
public class HttpReachabilitySource implements IReachabilitySource {
    private static final Logger log = LoggerFactory.getLogger(HttpReachabilitySource.class);

    private final HttpClient httpClient;
    private final String healthUrl;
    private final Duration pollInterval;
    private final Duration timeout;
    private final Scheduler scheduler;

    public HttpReachabilitySource(HttpClient httpClient, String healthUrl, Duration pollInterval,
                                  Duration timeout, Scheduler scheduler) {
        this.httpClient = httpClient;
        this.healthUrl = healthUrl;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    @Override
    public Flux<Boolean> observe() {
        return Flux.interval(Duration.ZERO, pollInterval, scheduler)
            .onBackpressureDrop()
            .concatMap(tick -> probe());
    }

    Mono<Boolean> probe() {
        return httpClient.get()
            .uri(healthUrl)
            .responseSingle((response, body) -> body.asString().then(Mono.just(response.status().code())))
            .map(code -> code >= 200 && code < 300)
            .timeout(timeout, scheduler)
            .doOnNext(ok -> log.debug("Health probe {} -> {}", healthUrl, ok ? "up" : "down"))
            .onErrorResume(err -> {
                log.debug("Health probe {} failed: {}", healthUrl, err.toString());
                return Mono.just(false);
            });
    }
}
