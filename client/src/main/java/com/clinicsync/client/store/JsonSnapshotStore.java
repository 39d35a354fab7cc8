package com.clinicsync.client.store;

import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.core.error.PersistenceException;
import com.clinicsync.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and rewrites one JSON list snapshot under a single store key.
 * <p>
 * Store failures never propagate: they are logged, counted, and flip the
 * {@link #isDegraded() degraded} flag. The caller keeps working from memory for the rest of
 * the process lifetime; the flag clears on the next successful write.
 * </p>
 *
 * @param <T> element type
 */
public class JsonSnapshotStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotStore.class);

    private final IDurableStore store;
    private final String key;
    private final TypeReference<List<T>> type;
    private final SyncMetrics metrics;

    private volatile boolean degraded;

    public JsonSnapshotStore(IDurableStore store, String key, TypeReference<List<T>> type, SyncMetrics metrics) {
        this.store = store;
        this.key = key;
        this.type = type;
        this.metrics = metrics;
    }

    /**
     * Loads the snapshot.
     *
     * @return stored elements in stored order; empty when absent, unreadable or corrupt
     */
    public List<T> load() {
        try {
            return store.read(key)
                .map(json -> JsonUtils.readValue(json, type))
                .map(list -> (List<T>) new ArrayList<>(list))
                .orElseGet(ArrayList::new);
        } catch (PersistenceException e) {
            degraded = true;
            metrics.recordStoreFailure("read");
            log.error("Failed to load snapshot {}, starting empty", key, e);
            return new ArrayList<>();
        } catch (IllegalArgumentException e) {
            metrics.recordStoreFailure("decode");
            log.error("Corrupt snapshot {}, starting empty", key, e);
            return new ArrayList<>();
        }
    }

    /**
     * Rewrites the snapshot.
     *
     * @param elements full current contents
     * @return true if the write reached the store
     */
    public boolean save(List<T> elements) {
        try {
            if (elements.isEmpty()) {
                store.delete(key);
            } else {
                store.write(key, JsonUtils.writeValueAsString(Collections.unmodifiableList(elements)));
            }
            if (degraded) {
                log.info("Snapshot {} persisted again, durability restored", key);
                degraded = false;
            }
            return true;
        } catch (PersistenceException e) {
            degraded = true;
            metrics.recordStoreFailure("write");
            log.warn("Failed to persist snapshot {} ({} entries), continuing in memory", key, elements.size(), e);
            return false;
        }
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getKey() {
        return key;
    }
}
