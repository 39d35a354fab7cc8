package com.clinicsync.client.connectivity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Reachability pushed by the host platform (OS network callbacks) through {@link #report}.
 * <p>
 * Late subscribers receive the most recent report.
 * </p>
 */
public class ManualReachabilitySource implements IReachabilitySource {
    private static final Logger log = LoggerFactory.getLogger(ManualReachabilitySource.class);

    private final Sinks.Many<Boolean> sink = Sinks.many().replay().latest();

    @Override
    public Flux<Boolean> observe() {
        return sink.asFlux();
    }

    /**
     * Reports the current platform reachability.
     */
    public synchronized void report(boolean online) {
        Sinks.EmitResult result = sink.tryEmitNext(online);
        if (result.isFailure()) {
            log.warn("Failed to publish reachability {}: {}", online, result);
        }
    }
}
