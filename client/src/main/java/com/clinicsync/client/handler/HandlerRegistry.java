package com.clinicsync.client.handler;

import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.core.error.HandlerException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes inbound events to every handler registered for the event name.
 * <p>
 * Handlers for one event run in registration order. A handler that throws is logged and
 * counted; the remaining handlers still run and the connection is unaffected. Events with
 * no handlers are ignored.
 * </p>
 */
public class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final SyncMetrics metrics;

    public HandlerRegistry(SyncMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Merges {@code entries} into the registry. Registering the same handler instance twice
     * for an event has no effect.
     *
     * @return handle removing exactly the registrations this call added
     */
    public Disposable registerHandlers(Map<String, EventHandler> entries) {
        Map<String, EventHandler> ordered = new LinkedHashMap<>(entries);
        List<Disposable> added = new ArrayList<>();
        ordered.forEach((event, handler) -> added.add(register(event, handler)));
        return Disposables.composite(added);
    }

    /**
     * @return handle removing this registration, a no-op if the handler was already present
     */
    public Disposable register(String event, EventHandler handler) {
        boolean[] added = new boolean[1];
        // Add inside the map operation so a concurrent unregister cannot drop the list under us
        handlers.compute(event, (k, list) -> {
            CopyOnWriteArrayList<EventHandler> target = list != null ? list : new CopyOnWriteArrayList<>();
            added[0] = target.addIfAbsent(handler);
            return target;
        });
        if (!added[0]) {
            log.debug("Handler already registered for '{}'", event);
            return Disposables.disposed();
        }
        log.debug("Registered handler for '{}' ({} total)", event, handlerCount(event));
        return () -> unregister(event, handler);
    }

    private void unregister(String event, EventHandler handler) {
        handlers.computeIfPresent(event, (k, list) -> {
            list.remove(handler);
            return list.isEmpty() ? null : list;
        });
    }

    /**
     * Invokes the handlers for {@code event} synchronously, in registration order.
     *
     * @return number of handlers invoked, including those that threw
     */
    public int dispatch(String event, JsonNode payload) {
        List<EventHandler> targets = handlers.get(event);
        if (targets == null || targets.isEmpty()) {
            log.debug("No handlers for '{}', ignoring", event);
            return 0;
        }
        int invoked = 0;
        for (EventHandler handler : targets) {
            invoked++;
            try {
                handler.handle(payload);
            } catch (Exception e) {
                HandlerException failure = new HandlerException(event, e);
                metrics.recordHandlerError(event);
                log.warn("{}", failure.getMessage(), failure);
            }
        }
        return invoked;
    }

    public int handlerCount(String event) {
        List<EventHandler> list = handlers.get(event);
        return list == null ? 0 : list.size();
    }

    public Set<String> registeredEvents() {
        return Set.copyOf(handlers.keySet());
    }
}
