package com.clinicsync.client.queue;

import com.clinicsync.core.model.MutationCommand;
import com.clinicsync.core.model.MutationRecord;
import com.clinicsync.core.model.Priority;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for the offline mutation queue (Dependency Inversion Principle).
 */
public interface IMutationQueue {
    /**
     * Adds a mutation and persists the queue before completing.
     *
     * @param id       caller-chosen identifier; an id already queued is not added twice
     * @param command  work to perform at drain time
     * @param priority drain priority
     * @return Mono of the queued record
     */
    default Mono<MutationRecord> enqueue(String id, MutationCommand command, Priority priority) {
        return enqueue(id, command, priority, EnqueueOptions.defaults());
    }

    Mono<MutationRecord> enqueue(String id, MutationCommand command, Priority priority, EnqueueOptions options);

    /**
     * Executes queued mutations while online. Only one drain runs at a time.
     *
     * @return Mono of the pass outcome
     */
    Mono<DrainReport> drain();

    int getPendingCount();

    /**
     * @return pending records in drain order
     */
    List<MutationRecord> getPending();

    /**
     * Removes every pending mutation, including the persisted copy.
     */
    Mono<Void> clearQueue();

    QueueStats getStats();

    Disposable subscribe(QueueEventListener listener);

    void dispose();
}
