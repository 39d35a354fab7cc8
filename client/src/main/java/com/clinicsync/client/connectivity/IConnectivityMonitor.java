package com.clinicsync.client.connectivity;

import com.clinicsync.core.model.ConnectivityState;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Interface for connectivity observation (Dependency Inversion Principle).
 */
public interface IConnectivityMonitor {
    /**
     * Starts observing the reachability source. Subsequent calls are no-ops.
     */
    void initialize();

    /**
     * @return last known reachability; never blocks
     */
    boolean getIsOnline();

    ConnectivityState getState();

    /**
     * Registers a listener notified once per real transition.
     *
     * @return handle that unregisters the listener
     */
    Disposable subscribe(ConnectivityListener listener);

    /**
     * Registers a hook run fire-and-forget on every transition to online
     * (stale-cache refresh for feature consumers).
     *
     * @return handle that unregisters the hook
     */
    Disposable addOnlineHook(Runnable hook);

    Flux<ConnectivityState> changes();

    void dispose();
}
