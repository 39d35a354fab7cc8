package com.clinicsync.client.store;

import com.clinicsync.client.config.SyncConfig;

import java.nio.file.Path;

/**
 * Builds the configured {@link IDurableStore}.
 */
public final class DurableStores {
    private DurableStores() {
    }

    public static IDurableStore create(SyncConfig config) {
        return switch (config.getStoreType()) {
            case MEMORY -> new InMemoryDurableStore();
            case FILE -> new FileDurableStore(Path.of(config.getStorageDir()));
            case REDIS -> new RedisDurableStore(config.getRedisUrl());
        };
    }
}
