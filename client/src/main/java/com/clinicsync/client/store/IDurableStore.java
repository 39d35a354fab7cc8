package com.clinicsync.client.store;

import com.clinicsync.core.error.PersistenceException;

import java.util.Optional;

/**
 * Synchronous key-value persistence used for the queue and outbound-buffer snapshots.
 * <p>
 * Implementations must have completed the write when {@link #write} returns and must
 * report failures as {@link PersistenceException}.
 * </p>
 */
public interface IDurableStore {
    /**
     * Reads a value.
     *
     * @param key store key
     * @return the value, or empty if the key was never written or was deleted
     */
    Optional<String> read(String key);

    /**
     * Replaces the value under {@code key}.
     */
    void write(String key, String value);

    /**
     * Removes the value under {@code key}; a missing key is not an error.
     */
    void delete(String key);

    /**
     * Releases underlying resources.
     */
    default void close() {
    }
}
