package com.clinicsync.core.metrics;

/**
 * Micrometer metric names used by the sync client.
 * <p>
 * <b>Naming convention:</b> {@code sync.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Mutations waiting in the queue.
     */
    public static final String QUEUE_PENDING = "sync.queue.pending";

    /**
     * Counter: Mutation executions by outcome.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String QUEUE_EXECUTIONS_TOTAL = "sync.queue.executions.total";

    /**
     * Counter: Mutations dropped after exhausting their retry budget.
     */
    public static final String QUEUE_DROPPED_TOTAL = "sync.queue.dropped.total";

    /**
     * Timer: Single mutation execution latency.
     */
    public static final String QUEUE_EXECUTION_LATENCY = "sync.queue.execution.latency";

    /**
     * Counter: Durable store failures.
     * <p>
     * Tags: type (read/write)
     * </p>
     */
    public static final String STORE_FAILURES_TOTAL = "sync.store.failures.total";

    /**
     * Gauge: Connectivity snapshot (1 online, 0 offline).
     */
    public static final String CONNECTIVITY_ONLINE = "sync.connectivity.online";

    /**
     * Counter: Observed connectivity transitions.
     * <p>
     * Tags: type (online/offline)
     */
    public static final String CONNECTIVITY_TRANSITIONS_TOTAL = "sync.connectivity.transitions.total";

    /**
     * Counter: Realtime connection attempts.
     * <p>
     * Tags: type (manual/automatic), reason (success/failure/auth)
     * </p>
     */
    public static final String CHANNEL_CONNECT_ATTEMPTS_TOTAL = "sync.channel.connect.attempts.total";

    /**
     * Gauge: Events waiting in the outbound buffer.
     */
    public static final String CHANNEL_BUFFERED = "sync.channel.buffered";

    /**
     * Counter: Outbound events dropped because the buffer was full.
     */
    public static final String CHANNEL_DROPS_TOTAL = "sync.channel.drops.total";

    /**
     * Counter: Outbound bytes handed to the transport.
     */
    public static final String CHANNEL_OUTBOUND_BYTES = "sync.channel.outbound.bytes";

    /**
     * Counter: Inbound events dispatched.
     */
    public static final String CHANNEL_INBOUND_TOTAL = "sync.channel.inbound.total";

    /**
     * Counter: Handler invocations that threw.
     * <p>
     * Tags: type (event name)
     * </p>
     */
    public static final String HANDLER_ERRORS_TOTAL = "sync.handler.errors.total";
}
