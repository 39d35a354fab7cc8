package com.clinicsync.client.store;

import com.clinicsync.core.error.PersistenceException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Redis-backed store for shared edge nodes (front-desk kiosks behind one Redis).
 * <p>
 * Uses the Lettuce synchronous API: the store contract requires the write to be
 * acknowledged before the call returns.
 * </p>
 */
public class RedisDurableStore implements IDurableStore {
    private static final Logger log = LoggerFactory.getLogger(RedisDurableStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;

    public RedisDurableStore(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.sync();
        log.info("Connected to Redis: {}", redisUrl);
    }

    @Override
    public Optional<String> read(String key) {
        try {
            return Optional.ofNullable(commands.get(key));
        } catch (RedisException e) {
            throw new PersistenceException(key, "Redis GET failed", e);
        }
    }

    @Override
    public void write(String key, String value) {
        try {
            commands.set(key, value);
        } catch (RedisException e) {
            throw new PersistenceException(key, "Redis SET failed", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            commands.del(key);
        } catch (RedisException e) {
            throw new PersistenceException(key, "Redis DEL failed", e);
        }
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
