package com.clinicsync.client.metrics;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.core.metrics.MetricsNames;
import com.clinicsync.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the sync client.
 */
public class SyncMetrics {

    private final MeterRegistry registry;
    private final String clientId;

    // Counters
    private final Counter executionsSuccess;
    private final Counter executionsFailure;
    private final Counter dropped;
    private final Counter wentOnline;
    private final Counter wentOffline;
    private final Counter bufferDrops;
    private final Counter outboundBytes;
    private final Counter inbound;

    // Timers
    private final Timer executionLatency;

    public SyncMetrics(MeterRegistry registry, SyncConfig config) {
        this.registry = registry;
        this.clientId = config.getClientId();

        executionsSuccess = Counter.builder(MetricsNames.QUEUE_EXECUTIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "success")
            .description("Mutation executions that succeeded")
            .register(registry);

        executionsFailure = Counter.builder(MetricsNames.QUEUE_EXECUTIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "failure")
            .description("Mutation executions that failed or timed out")
            .register(registry);

        dropped = Counter.builder(MetricsNames.QUEUE_DROPPED_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Mutations dropped after exhausting retries")
            .register(registry);

        wentOnline = Counter.builder(MetricsNames.CONNECTIVITY_TRANSITIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.TYPE, "online")
            .register(registry);

        wentOffline = Counter.builder(MetricsNames.CONNECTIVITY_TRANSITIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.TYPE, "offline")
            .register(registry);

        bufferDrops = Counter.builder(MetricsNames.CHANNEL_DROPS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Outbound events dropped due to buffer full")
            .register(registry);

        outboundBytes = Counter.builder(MetricsNames.CHANNEL_OUTBOUND_BYTES)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Total payload bytes handed to the realtime transport")
            .baseUnit("bytes")
            .register(registry);

        inbound = Counter.builder(MetricsNames.CHANNEL_INBOUND_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Inbound realtime events dispatched")
            .register(registry);

        executionLatency = Timer.builder(MetricsNames.QUEUE_EXECUTION_LATENCY)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Mutation execution latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30)
            )
            .register(registry);
    }

    /**
     * Metrics backed by a private {@link SimpleMeterRegistry}.
     */
    public static SyncMetrics inMemory(SyncConfig config) {
        return new SyncMetrics(new SimpleMeterRegistry(), config);
    }

    public void bindQueueDepth(Supplier<Number> pending) {
        Gauge.builder(MetricsNames.QUEUE_PENDING, pending)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Mutations waiting in the queue")
            .register(registry);
    }

    public void bindBufferDepth(Supplier<Number> buffered) {
        Gauge.builder(MetricsNames.CHANNEL_BUFFERED, buffered)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Outbound events waiting for a connection")
            .register(registry);
    }

    public void bindConnectivity(Supplier<Number> online) {
        Gauge.builder(MetricsNames.CONNECTIVITY_ONLINE, online)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .register(registry);
    }

    /**
     * Records one mutation execution.
     *
     * @param success    whether the executor completed without error
     * @param startNanos {@link System#nanoTime()} at execution start
     */
    public void recordExecution(boolean success, long startNanos) {
        executionLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
        if (success) {
            executionsSuccess.increment();
        } else {
            executionsFailure.increment();
        }
    }

    public void recordDropped() {
        dropped.increment();
    }

    public void recordStoreFailure(String type) {
        registry.counter(MetricsNames.STORE_FAILURES_TOTAL, MetricsTags.CLIENT_ID, clientId, MetricsTags.TYPE, type)
            .increment();
    }

    public void recordConnectivityTransition(boolean online) {
        if (online) {
            wentOnline.increment();
        } else {
            wentOffline.increment();
        }
    }

    /**
     * Records a realtime connection attempt.
     *
     * @param automatic true for reconnect-driver attempts, false for explicit connects
     * @param outcome   success / failure / auth
     */
    public void recordConnectAttempt(boolean automatic, String outcome) {
        registry.counter(MetricsNames.CHANNEL_CONNECT_ATTEMPTS_TOTAL,
                MetricsTags.CLIENT_ID, clientId,
                MetricsTags.TYPE, automatic ? "automatic" : "manual",
                MetricsTags.REASON, outcome)
            .increment();
    }

    public void recordBufferDrop() {
        bufferDrops.increment();
    }

    public void recordOutboundBytes(long bytes) {
        outboundBytes.increment(bytes);
    }

    public void recordInbound() {
        inbound.increment();
    }

    public void recordHandlerError(String event) {
        registry.counter(MetricsNames.HANDLER_ERRORS_TOTAL, MetricsTags.CLIENT_ID, clientId, MetricsTags.TYPE, event)
            .increment();
    }

    public double getDroppedCount() {
        return dropped.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
