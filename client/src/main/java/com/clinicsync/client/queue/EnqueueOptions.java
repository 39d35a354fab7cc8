package com.clinicsync.client.queue;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Per-mutation overrides; {@code null} fields fall back to the queue configuration.
 */
@Value
@Builder
public class EnqueueOptions {
    private static final EnqueueOptions DEFAULTS = EnqueueOptions.builder().build();

    @Nullable
    Integer maxRetries;

    @Nullable
    Duration timeout;

    public static EnqueueOptions defaults() {
        return DEFAULTS;
    }
}
