package com.clinicsync.client.connectivity;

import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.core.model.ConnectivityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks platform reachability and fans out transitions.
 * <p>
 * The snapshot is swapped with compare-and-set, so concurrent or repeated signals produce
 * at most one notification per real change. Listeners run on the signalling thread and are
 * expected to hand work off (the queue and the channel both subscribe asynchronously);
 * online hooks are scheduled on {@code hookScheduler} and never awaited.
 * </p>
 */
public class ConnectivityMonitor implements IConnectivityMonitor {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    private final IReachabilitySource source;
    private final Scheduler hookScheduler;
    private final Clock clock;
    private final SyncMetrics metrics;

    private final AtomicReference<ConnectivityState> state;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> onlineHooks = new CopyOnWriteArrayList<>();
    private final Sinks.Many<ConnectivityState> changes = Sinks.many().multicast().directBestEffort();

    private volatile Disposable subscription;

    public ConnectivityMonitor(IReachabilitySource source, boolean initialOnline, Scheduler hookScheduler,
                               Clock clock, SyncMetrics metrics) {
        this.source = source;
        this.hookScheduler = hookScheduler;
        this.clock = clock;
        this.metrics = metrics;
        this.state = new AtomicReference<>(ConnectivityState.initial(initialOnline));

        metrics.bindConnectivity(() -> getIsOnline() ? 1 : 0);
    }

    @Override
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.debug("Connectivity monitor already initialized");
            return;
        }
        subscription = source.observe()
            .subscribe(
                this::onSignal,
                err -> log.error("Reachability source failed, keeping last known state (online={})",
                    getIsOnline(), err)
            );
        log.info("Connectivity monitor started (online={})", getIsOnline());
    }

    @Override
    public boolean getIsOnline() {
        return state.get().isOnline();
    }

    @Override
    public ConnectivityState getState() {
        return state.get();
    }

    @Override
    public Disposable subscribe(ConnectivityListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public Disposable addOnlineHook(Runnable hook) {
        onlineHooks.add(hook);
        return () -> onlineHooks.remove(hook);
    }

    @Override
    public Flux<ConnectivityState> changes() {
        return changes.asFlux();
    }

    @Override
    public void dispose() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
        synchronized (changes) {
            changes.tryEmitComplete();
        }
        log.info("Connectivity monitor stopped");
    }

    void onSignal(boolean online) {
        ConnectivityState previous;
        ConnectivityState next;
        do {
            previous = state.get();
            if (previous.isOnline() == online) {
                return;
            }
            next = previous.transitionTo(online, clock.instant());
        } while (!state.compareAndSet(previous, next));

        log.info("Connectivity changed: {} -> {}",
            previous.isOnline() ? "online" : "offline", online ? "online" : "offline");
        metrics.recordConnectivityTransition(online);
        notifyListeners(next);
        emitChange(next);

        if (online) {
            for (Runnable hook : onlineHooks) {
                hookScheduler.schedule(() -> runHook(hook));
            }
        }
    }

    // Signals may arrive from several threads; the sink needs serialized emits
    private void emitChange(ConnectivityState next) {
        Sinks.EmitResult result;
        synchronized (changes) {
            result = changes.tryEmitNext(next);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Connectivity change {} not published: {}", next.isOnline() ? "online" : "offline", result);
        }
    }

    private void notifyListeners(ConnectivityState next) {
        for (ConnectivityListener listener : listeners) {
            try {
                listener.onChange(next);
            } catch (Exception e) {
                log.error("Connectivity listener failed", e);
            }
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (Exception e) {
            log.warn("Online hook failed: {}", e.getMessage(), e);
        }
    }
}
