package com.clinicsync.client.queue;

import com.clinicsync.core.model.MutationCommand;
import reactor.core.publisher.Mono;

/**
 * Performs the write described by a {@link MutationCommand}.
 * <p>
 * Completion means the backend accepted the write; any error (including a timeout imposed
 * by the queue) consumes one retry.
 * </p>
 */
@FunctionalInterface
public interface CommandExecutor {
    Mono<Void> execute(MutationCommand command);
}
