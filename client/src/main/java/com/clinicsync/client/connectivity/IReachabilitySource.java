package com.clinicsync.client.connectivity;

import reactor.core.publisher.Flux;

/**
 * Platform reachability signal.
 * <p>
 * Emits the observed reachability whenever it is sampled or reported; repeats of the same value
 * are allowed, the monitor filters them.
 * </p>
 */
public interface IReachabilitySource {
    Flux<Boolean> observe();
}
