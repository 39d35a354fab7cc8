package com.clinicsync.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for reconnects and retries.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * <ul>
 *   <li>{@code base}: Initial delay</li>
 *   <li>{@code max}: Maximum delay (cap)</li>
 *   <li>{@code jitterMax}: Maximum jitter to add, {@link Duration#ZERO} for none</li>
 * </ul>
 * </p>
 * <p>
 * Without jitter the sequence is non-decreasing in {@code attempt} and never exceeds {@code max}.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay (base * 2^attempt capped at max, plus jitter)
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterBound = jitterMax.toMillis();
        long jitterMs = jitterBound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterBound + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Deterministic variant without jitter.
     *
     * @param attempt Retry attempt number (0-based)
     * @param base    Base delay
     * @param max     Maximum delay (cap)
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max) {
        return next(attempt, base, max, Duration.ZERO);
    }
}
