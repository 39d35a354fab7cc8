package com.clinicsync.client.queue;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.connectivity.IConnectivityMonitor;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.client.store.IDurableStore;
import com.clinicsync.client.store.JsonSnapshotStore;
import com.clinicsync.core.error.RetryExhaustedException;
import com.clinicsync.core.model.MutationCommand;
import com.clinicsync.core.model.MutationRecord;
import com.clinicsync.core.model.Priority;
import com.clinicsync.core.store.Keys;
import com.clinicsync.core.util.JitterBackoff;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persisted, priority-ordered queue of deferred writes, drained serially while online.
 * <p>
 * <b>Ordering:</b> records drain by priority, then by arrival. A head that fails with retries
 * left stops the pass instead of letting younger records overtake it; a follow-up pass is
 * scheduled after a backoff delay. A head that exhausts its budget is dropped and the pass
 * continues.
 * </p>
 * <p>
 * <b>Durability:</b> every insert, removal and retry increment rewrites the snapshot before
 * the producing call completes. {@code lock} guards the in-memory list together with the
 * snapshot write; it is never held across an executor call.
 * </p>
 */
public class MutationQueue implements IMutationQueue {
    private static final Logger log = LoggerFactory.getLogger(MutationQueue.class);

    private static final TypeReference<List<MutationRecord>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final JsonSnapshotStore<MutationRecord> snapshots;
    private final CommandExecutorRegistry executors;
    private final IConnectivityMonitor connectivity;
    private final SyncConfig config;
    private final SyncMetrics metrics;
    private final Scheduler workScheduler;
    private final Scheduler timerScheduler;

    private final Object lock = new Object();
    private final List<MutationRecord> records = new ArrayList<>();
    private long nextSequence;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicReference<Disposable> retryTimer = new AtomicReference<>();
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Disposable connectivitySubscription;

    /**
     * Creates the queue and rehydrates it from {@code store} before any drain can start.
     *
     * @param workScheduler  scheduler for snapshot writes and executor subscription
     * @param timerScheduler scheduler for execution timeouts and retry delays
     */
    public MutationQueue(IDurableStore store,
                         CommandExecutorRegistry executors,
                         IConnectivityMonitor connectivity,
                         SyncConfig config,
                         SyncMetrics metrics,
                         Scheduler workScheduler,
                         Scheduler timerScheduler) {
        this.snapshots = new JsonSnapshotStore<>(store, Keys.mutationQueue(config.getClientId()), SNAPSHOT_TYPE, metrics);
        this.executors = executors;
        this.connectivity = connectivity;
        this.config = config;
        this.metrics = metrics;
        this.workScheduler = workScheduler;
        this.timerScheduler = timerScheduler;

        rehydrate();
        metrics.bindQueueDepth(this::getPendingCount);

        this.connectivitySubscription = connectivity.subscribe(state -> {
            if (state.isOnline()) {
                requestDrain();
            } else {
                cancelRetryTimer();
            }
        });
    }

    private void rehydrate() {
        List<MutationRecord> loaded = snapshots.load();
        loaded.sort(MutationRecord.DRAIN_ORDER);
        synchronized (lock) {
            records.clear();
            records.addAll(loaded);
            nextSequence = loaded.stream().mapToLong(MutationRecord::getSequence).max().orElse(-1L) + 1;
        }
        if (!loaded.isEmpty()) {
            log.info("Rehydrated {} pending mutations from {}", loaded.size(), snapshots.getKey());
        }
    }

    @Override
    public Mono<MutationRecord> enqueue(String id, MutationCommand command, Priority priority, EnqueueOptions options) {
        return Mono.fromCallable(() -> insert(id, command, priority, options))
            .subscribeOn(workScheduler)
            .doOnNext(record -> {
                if (!connectivity.getIsOnline()) {
                    return;
                }
                if (retryTimer.get() != null) {
                    // The head is backing off; the pending timer drains the new record too
                    log.debug("Retry pending, {} waits for the next drain", record.getId());
                    return;
                }
                requestDrain();
            });
    }

    private MutationRecord insert(String id, MutationCommand command, Priority priority, EnqueueOptions options) {
        MutationRecord record;
        synchronized (lock) {
            MutationRecord existing = find(id);
            if (existing != null) {
                log.debug("Mutation {} already queued, ignoring duplicate enqueue", id);
                return existing;
            }
            record = MutationRecord.builder()
                .id(id)
                .command(command)
                .priority(priority)
                .enqueuedAt(System.currentTimeMillis())
                .sequence(nextSequence++)
                .retryCount(0)
                .maxRetries(options.getMaxRetries() != null ? options.getMaxRetries() : config.getDefaultMaxRetries())
                .timeoutMs(options.getTimeout() != null ? options.getTimeout().toMillis() : null)
                .build();
            records.add(insertionIndex(record), record);
            persist();
        }
        log.debug("Enqueued mutation {} ({}, {})", id, command.getCommandType(), priority);
        publish(QueueEvent.of(QueueEvent.Type.ENQUEUED, record, null));
        return record;
    }

    private int insertionIndex(MutationRecord record) {
        int index = records.size();
        while (index > 0 && MutationRecord.DRAIN_ORDER.compare(records.get(index - 1), record) > 0) {
            index--;
        }
        return index;
    }

    @Override
    public Mono<DrainReport> drain() {
        return Mono.defer(() -> {
            if (!draining.compareAndSet(false, true)) {
                log.debug("Drain already in progress");
                publish(QueueEvent.of(QueueEvent.Type.DRAIN_COALESCED, null, null));
                return Mono.just(DrainReport.alreadyRunning());
            }
            cancelRetryTimer();
            publish(QueueEvent.of(QueueEvent.Type.DRAIN_STARTED, null, null));

            DrainProgress progress = new DrainProgress();
            return Mono.defer(() -> step(progress))
                .repeat()
                .takeUntil(outcome -> outcome != Step.CONTINUE)
                .last()
                .map(last -> progress.toReport(last.stopReason))
                .doOnNext(this::finishDrain)
                .doOnError(err -> {
                    log.error("Drain aborted unexpectedly", err);
                    draining.set(false);
                })
                .doOnCancel(() -> draining.set(false));
        });
    }

    private Mono<Step> step(DrainProgress progress) {
        if (!connectivity.getIsOnline()) {
            return Mono.just(Step.STOP_OFFLINE);
        }
        MutationRecord head;
        synchronized (lock) {
            head = records.isEmpty() ? null : records.get(0);
        }
        if (head == null) {
            return Mono.just(Step.STOP_EMPTY);
        }

        return execute(head)
            .then(Mono.just(ExecutionOutcome.SUCCESS))
            .onErrorResume(err -> Mono.just(ExecutionOutcome.failure(err)))
            .publishOn(workScheduler)
            .map(outcome -> outcome.error == null
                ? onSuccess(head, progress)
                : onFailure(head, outcome.error, progress));
    }

    private Mono<Void> execute(MutationRecord head) {
        String commandType = head.getCommand().getCommandType();
        CommandExecutor executor = executors.resolve(commandType).orElse(null);
        if (executor == null) {
            return Mono.error(new IllegalStateException("No executor registered for '" + commandType + "'"));
        }
        Duration timeout = head.timeoutOr(config.getMutationTimeout());

        return Mono.defer(() -> {
                long start = System.nanoTime();
                log.debug("Executing mutation {} (attempt {})", head.getId(), head.getRetryCount() + 1);
                return executor.execute(head.getCommand())
                    .timeout(timeout, timerScheduler)
                    .doOnSuccess(v -> metrics.recordExecution(true, start))
                    .doOnError(err -> metrics.recordExecution(false, start));
            })
            .subscribeOn(workScheduler)
            .then();
    }

    private Step onSuccess(MutationRecord head, DrainProgress progress) {
        synchronized (lock) {
            if (records.removeIf(r -> r.getId().equals(head.getId()))) {
                persist();
            }
        }
        progress.executed.incrementAndGet();
        log.debug("Mutation {} executed", head.getId());
        publish(QueueEvent.of(QueueEvent.Type.EXECUTED, head, null));
        return Step.CONTINUE;
    }

    private Step onFailure(MutationRecord head, Throwable error, DrainProgress progress) {
        progress.failed.incrementAndGet();
        MutationRecord updated;
        synchronized (lock) {
            int index = indexOf(head.getId());
            if (index < 0) {
                // Cleared while executing
                return Step.CONTINUE;
            }
            updated = records.get(index).withRetryCount(records.get(index).getRetryCount() + 1);
            if (updated.isExhausted()) {
                records.remove(index);
            } else {
                records.set(index, updated);
            }
            persist();
        }

        if (updated.isExhausted()) {
            progress.dropped.incrementAndGet();
            metrics.recordDropped();
            RetryExhaustedException exhausted =
                new RetryExhaustedException(updated.getId(), updated.getRetryCount(), error);
            log.warn("Dropping mutation {} ({}) after {} attempts: {}", updated.getId(),
                updated.getCommand().getCommandType(), updated.getRetryCount(), error.toString());
            publish(QueueEvent.of(QueueEvent.Type.DROPPED, updated, exhausted));
            return Step.CONTINUE;
        }

        log.info("Mutation {} failed (attempt {} of {}), pausing drain: {}", updated.getId(),
            updated.getRetryCount(), updated.getMaxRetries() + 1, error.toString());
        publish(QueueEvent.of(QueueEvent.Type.RETRY_SCHEDULED, updated, error));
        return Step.STOP_RETRY_PENDING;
    }

    private void finishDrain(DrainReport report) {
        draining.set(false);
        log.debug("Drain finished: executed={}, failed={}, dropped={}, stop={}",
            report.getExecuted(), report.getFailed(), report.getDropped(), report.getStopReason());
        publish(QueueEvent.of(QueueEvent.Type.DRAIN_FINISHED, null, null));

        switch (report.getStopReason()) {
            case RETRY_PENDING -> scheduleRetry();
            case EMPTY -> {
                // An enqueue that lost the race against the final empty check
                if (getPendingCount() > 0 && connectivity.getIsOnline()) {
                    requestDrain();
                }
            }
            default -> {
            }
        }
    }

    private void scheduleRetry() {
        MutationRecord head;
        synchronized (lock) {
            head = records.isEmpty() ? null : records.get(0);
        }
        if (head == null) {
            return;
        }
        Duration delay = JitterBackoff.next(
            Math.max(head.getRetryCount() - 1, 0), config.getRetryBaseDelay(), config.getRetryMaxDelay());
        log.debug("Next drain for {} in {}", head.getId(), delay);

        Disposable timer = Mono.delay(delay, timerScheduler)
            .subscribe(tick -> {
                retryTimer.set(null);
                if (connectivity.getIsOnline()) {
                    requestDrain();
                }
            });
        Disposable previous = retryTimer.getAndSet(timer);
        if (previous != null) {
            previous.dispose();
        }
        if (timer.isDisposed()) {
            // Zero delay already fired
            retryTimer.compareAndSet(timer, null);
        }
    }

    private void cancelRetryTimer() {
        Disposable timer = retryTimer.getAndSet(null);
        if (timer != null) {
            timer.dispose();
        }
    }

    /**
     * Fire-and-forget drain trigger used by enqueue, connectivity and retry timers.
     */
    void requestDrain() {
        drain().subscribe(
            report -> {
            },
            err -> log.error("Background drain failed", err)
        );
    }

    @Override
    public int getPendingCount() {
        synchronized (lock) {
            return records.size();
        }
    }

    @Override
    public List<MutationRecord> getPending() {
        synchronized (lock) {
            return List.copyOf(records);
        }
    }

    @Override
    public Mono<Void> clearQueue() {
        return Mono.fromRunnable(() -> {
                int removed;
                synchronized (lock) {
                    removed = records.size();
                    records.clear();
                    persist();
                }
                cancelRetryTimer();
                log.info("Mutation queue cleared ({} pending discarded)", removed);
                publish(QueueEvent.of(QueueEvent.Type.CLEARED, null, null));
            })
            .subscribeOn(workScheduler)
            .then();
    }

    @Override
    public QueueStats getStats() {
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        int pending;
        synchronized (lock) {
            pending = records.size();
            for (MutationRecord record : records) {
                byPriority.merge(record.getPriority(), 1, Integer::sum);
            }
        }
        return QueueStats.builder()
            .pending(pending)
            .pendingByPriority(byPriority)
            .draining(draining.get())
            .retryScheduled(retryTimer.get() != null)
            .persistenceDegraded(snapshots.isDegraded())
            .build();
    }

    @Override
    public Disposable subscribe(QueueEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void dispose() {
        connectivitySubscription.dispose();
        cancelRetryTimer();
        log.info("Mutation queue stopped with {} pending", getPendingCount());
    }

    // Caller holds lock
    private void persist() {
        snapshots.save(new ArrayList<>(records));
    }

    // Caller holds lock
    @Nullable
    private MutationRecord find(String id) {
        int index = indexOf(id);
        return index < 0 ? null : records.get(index);
    }

    // Caller holds lock
    private int indexOf(String id) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private void publish(QueueEvent event) {
        for (QueueEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Queue listener failed on {}: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    private enum Step {
        CONTINUE(null),
        STOP_EMPTY(DrainReport.StopReason.EMPTY),
        STOP_OFFLINE(DrainReport.StopReason.OFFLINE),
        STOP_RETRY_PENDING(DrainReport.StopReason.RETRY_PENDING);

        private final DrainReport.StopReason stopReason;

        Step(DrainReport.StopReason stopReason) {
            this.stopReason = stopReason;
        }
    }

    private static final class ExecutionOutcome {
        static final ExecutionOutcome SUCCESS = new ExecutionOutcome(null);

        @Nullable
        final Throwable error;

        private ExecutionOutcome(@Nullable Throwable error) {
            this.error = error;
        }

        static ExecutionOutcome failure(Throwable error) {
            return new ExecutionOutcome(error);
        }
    }

    private static final class DrainProgress {
        final AtomicInteger executed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger dropped = new AtomicInteger();

        DrainReport toReport(DrainReport.StopReason reason) {
            return DrainReport.builder()
                .executed(executed.get())
                .failed(failed.get())
                .dropped(dropped.get())
                .stopReason(reason)
                .build();
        }
    }
}
