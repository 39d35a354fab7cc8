package com.clinicsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Comparator;

/**
 * A queued mutation together with its retry bookkeeping.
 * <p>
 * Records are immutable; a failed execution produces a copy with
 * {@code retryCount + 1} that replaces the original in the queue.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class MutationRecord {

    /**
     * Drain order: priority rank first, then arrival sequence.
     */
    public static final Comparator<MutationRecord> DRAIN_ORDER = Comparator
        .comparingInt((MutationRecord r) -> r.getPriority().rank())
        .thenComparingLong(MutationRecord::getSequence);

    @JsonProperty("id")
    String id;

    @JsonProperty("command")
    MutationCommand command;

    @JsonProperty("priority")
    Priority priority;

    /**
     * Wall-clock enqueue time (epoch millis).
     */
    @JsonProperty("enqueuedAt")
    long enqueuedAt;

    /**
     * Monotonic arrival number, the FIFO tiebreaker within a priority tier.
     */
    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("retryCount")
    int retryCount;

    @JsonProperty("maxRetries")
    int maxRetries;

    /**
     * Per-record execution timeout in millis, {@code null} to use the queue default.
     */
    @Nullable
    @JsonProperty("timeoutMs")
    Long timeoutMs;

    @JsonCreator
    public MutationRecord(
        @JsonProperty("id") String id,
        @JsonProperty("command") MutationCommand command,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("enqueuedAt") long enqueuedAt,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("timeoutMs") @Nullable Long timeoutMs
    ) {
        this.id = id;
        this.command = command;
        this.priority = priority == null ? Priority.NORMAL : priority;
        this.enqueuedAt = enqueuedAt;
        this.sequence = sequence;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.timeoutMs = timeoutMs;
    }

    /**
     * @return true once the record has failed more often than its budget allows
     */
    @JsonIgnore
    public boolean isExhausted() {
        return retryCount > maxRetries;
    }

    @JsonIgnore
    public Duration timeoutOr(Duration fallback) {
        return timeoutMs == null ? fallback : Duration.ofMillis(timeoutMs);
    }
}
