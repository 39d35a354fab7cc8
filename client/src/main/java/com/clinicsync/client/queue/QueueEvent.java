package com.clinicsync.client.queue;

import com.clinicsync.core.model.MutationRecord;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Observable queue activity.
 */
@Value
public class QueueEvent {

    public enum Type {
        ENQUEUED,
        EXECUTED,
        RETRY_SCHEDULED,
        /**
         * Retry budget exhausted; {@code error} is a RetryExhaustedException.
         */
        DROPPED,
        CLEARED,
        DRAIN_STARTED,
        /**
         * A drain was requested while one was already running and was folded into it.
         */
        DRAIN_COALESCED,
        DRAIN_FINISHED
    }

    Type type;

    @Nullable
    MutationRecord record;

    @Nullable
    Throwable error;

    long timestamp;

    static QueueEvent of(Type type, @Nullable MutationRecord record, @Nullable Throwable error) {
        return new QueueEvent(type, record, error, System.currentTimeMillis());
    }
}
