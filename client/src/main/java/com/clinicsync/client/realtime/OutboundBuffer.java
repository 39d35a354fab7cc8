package com.clinicsync.client.realtime;

import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.client.store.IDurableStore;
import com.clinicsync.client.store.JsonSnapshotStore;
import com.clinicsync.core.msg.BufferedEvent;
import com.clinicsync.core.store.Keys;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Ordered, bounded buffer of events emitted while the channel was not connected.
 * <p>
 * Changes are in-memory only; {@link #persist()} writes the current contents and may block on
 * the store, so callers run it on a worker scheduler. Persistence is best-effort: a failing
 * store only marks the buffer degraded. When {@code maxSize} is exceeded the oldest event is
 * dropped.
 * </p>
 */
public class OutboundBuffer {
    private static final Logger log = LoggerFactory.getLogger(OutboundBuffer.class);

    private static final TypeReference<List<BufferedEvent>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final JsonSnapshotStore<BufferedEvent> snapshots;
    private final int maxSize;
    private final SyncMetrics metrics;

    private final Deque<BufferedEvent> events = new ArrayDeque<>();
    private final Object persistLock = new Object();

    public OutboundBuffer(IDurableStore store, String clientId, int maxSize, SyncMetrics metrics) {
        this.snapshots = new JsonSnapshotStore<>(store, Keys.outboundBuffer(clientId), SNAPSHOT_TYPE, metrics);
        this.maxSize = maxSize;
        this.metrics = metrics;

        List<BufferedEvent> loaded = snapshots.load();
        events.addAll(loaded);
        if (!loaded.isEmpty()) {
            log.info("Restored {} buffered outbound events", loaded.size());
        }
        trimLocked();
    }

    public synchronized void append(BufferedEvent event) {
        events.addLast(event);
        trimLocked();
    }

    /**
     * @return buffered events in submission order
     */
    public synchronized List<BufferedEvent> snapshot() {
        return new ArrayList<>(events);
    }

    /**
     * Removes events that were handed to the transport. Events appended after the snapshot
     * was taken stay in place.
     *
     * @param delivered instances previously returned by {@link #snapshot()}
     * @return number of events removed
     */
    public synchronized int removeDelivered(List<BufferedEvent> delivered) {
        if (delivered.isEmpty()) {
            return 0;
        }
        Set<BufferedEvent> sent = Collections.newSetFromMap(new IdentityHashMap<>());
        sent.addAll(delivered);
        int before = events.size();
        events.removeIf(sent::contains);
        return before - events.size();
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized boolean isEmpty() {
        return events.isEmpty();
    }

    public boolean isDegraded() {
        return snapshots.isDegraded();
    }

    private void trimLocked() {
        while (events.size() > maxSize) {
            BufferedEvent dropped = events.removeFirst();
            metrics.recordBufferDrop();
            log.warn("Outbound buffer full ({}), dropping oldest '{}' event", maxSize, dropped.getEvent());
        }
    }

    /**
     * Writes the current contents to the store. Concurrent calls are serialized and each one
     * snapshots under {@code persistLock}, so the last write always carries the newest state.
     */
    public void persist() {
        synchronized (persistLock) {
            snapshots.save(snapshot());
        }
    }
}
