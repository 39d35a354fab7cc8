package com.clinicsync.client.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executor table consulted at drain time, keyed by {@code commandType}.
 * <p>
 * Executors can be registered after the queue was rehydrated; a persisted command whose type
 * has no executor yet fails (and consumes a retry) instead of being lost.
 * </p>
 */
public class CommandExecutorRegistry {
    private static final Logger log = LoggerFactory.getLogger(CommandExecutorRegistry.class);

    private final Map<String, CommandExecutor> executors = new ConcurrentHashMap<>();

    @Nullable
    private volatile CommandExecutor fallback;

    public CommandExecutorRegistry register(String commandType, CommandExecutor executor) {
        CommandExecutor previous = executors.put(commandType, executor);
        if (previous != null) {
            log.warn("Executor for '{}' replaced", commandType);
        }
        return this;
    }

    /**
     * Executor used for command types without a dedicated registration.
     */
    public CommandExecutorRegistry registerFallback(CommandExecutor executor) {
        this.fallback = executor;
        return this;
    }

    public Optional<CommandExecutor> resolve(String commandType) {
        CommandExecutor executor = executors.get(commandType);
        return Optional.ofNullable(executor != null ? executor : fallback);
    }
}
