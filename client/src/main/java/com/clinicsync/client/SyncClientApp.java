package com.clinicsync.client;

import com.clinicsync.client.config.SyncConfig;
import com.clinicsync.client.connectivity.ConnectivityMonitor;
import com.clinicsync.client.connectivity.HttpReachabilitySource;
import com.clinicsync.client.handler.HandlerRegistry;
import com.clinicsync.client.http.HttpCommandExecutor;
import com.clinicsync.client.metrics.SyncMetrics;
import com.clinicsync.client.queue.CommandExecutorRegistry;
import com.clinicsync.client.queue.MutationQueue;
import com.clinicsync.client.realtime.OutboundBuffer;
import com.clinicsync.client.realtime.RealtimeChannel;
import com.clinicsync.client.realtime.WebSocketTransport;
import com.clinicsync.client.session.SessionCoordinator;
import com.clinicsync.client.session.StaticCredentialProvider;
import com.clinicsync.client.store.DurableStores;
import com.clinicsync.client.store.IDurableStore;
import com.clinicsync.core.msg.RealtimeEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.List;

/**
 * Main entry point for a headless sync client (kiosk or edge installation).
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Poll backend health and track connectivity</li>
 *   <li>Drain the persisted mutation queue whenever online</li>
 *   <li>Keep the realtime channel connected and route inbound events</li>
 *   <li>Close everything down on shutdown, leaving pending work persisted</li>
 * </ul>
 * </p>
 */
public class SyncClientApp {
    private static final Logger log = LoggerFactory.getLogger(SyncClientApp.class);

    private static final List<String> LOGGED_EVENTS = List.of(
        RealtimeEvents.MESSAGE_NEW,
        RealtimeEvents.APPOINTMENT_REMINDER,
        RealtimeEvents.APPOINTMENT_UPDATED,
        RealtimeEvents.MEDICATION_REMINDER,
        RealtimeEvents.LAB_RESULT_READY,
        RealtimeEvents.ENTITY_UPDATED
    );

    public static void main(String[] args) {
        SyncConfig config = SyncConfig.fromEnv();
        MDC.put("clientId", config.getClientId());

        log.info("Starting sync client: {}", config.getClientId());
        log.info("  API: {}", config.getApiBaseUrl());
        log.info("  Realtime: {}", config.getRealtimeUrl());
        log.info("  Store: {} ({})", config.getStoreType(),
            config.getStoreType() == SyncConfig.StoreType.REDIS ? config.getRedisUrl() : config.getStorageDir());

        Scheduler workScheduler = Schedulers.boundedElastic();
        Scheduler timerScheduler = Schedulers.parallel();

        SyncMetrics metrics = new SyncMetrics(new SimpleMeterRegistry(), config);
        IDurableStore store = DurableStores.create(config);
        HttpClient httpClient = HttpClient.create();
        StaticCredentialProvider credentials = new StaticCredentialProvider(System.getenv("AUTH_TOKEN"));

        ConnectivityMonitor connectivity = new ConnectivityMonitor(
            new HttpReachabilitySource(httpClient, config.getHealthUrl(),
                config.getReachabilityPollInterval(), config.getReachabilityTimeout(), timerScheduler),
            config.isInitialOnline(), workScheduler, Clock.systemUTC(), metrics);

        CommandExecutorRegistry executors = new CommandExecutorRegistry()
            .registerFallback(new HttpCommandExecutor(httpClient, config.getApiBaseUrl(), credentials));
        MutationQueue queue = new MutationQueue(store, executors, connectivity, config, metrics,
            workScheduler, timerScheduler);
        Disposable queueEvents = queue.subscribe(event -> {
            if (event.getError() != null) {
                log.info("Queue {}: {} ({})", event.getType(),
                    event.getRecord() != null ? event.getRecord().getId() : "-", event.getError().getMessage());
            }
        });

        HandlerRegistry handlers = new HandlerRegistry(metrics);
        for (String event : LOGGED_EVENTS) {
            handlers.register(event, payload -> log.info("Received {}: {}", event, payload));
        }

        RealtimeChannel channel = new RealtimeChannel(
            new WebSocketTransport(httpClient, config.getRealtimeUrl()),
            handlers,
            new OutboundBuffer(store, config.getClientId(), config.getOutboundBufferMax(), metrics),
            config, metrics, workScheduler, timerScheduler);

        SessionCoordinator session = new SessionCoordinator(channel, credentials);
        Disposable connectivityFollow = session.followConnectivity(connectivity);

        connectivity.initialize();

        credentials.currentToken()
            .flatMap(session::onSignedIn)
            .subscribe(null, err -> log.warn("Initial connect failed, reconnect driver continues: {}", err.getMessage()));

        log.info("Sync client {} is ready ({} pending mutations)", config.getClientId(), queue.getPendingCount());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, stopping sync client...");
            MDC.put("clientId", config.getClientId());

            connectivityFollow.dispose();
            session.dispose();
            channel.dispose();
            queueEvents.dispose();
            queue.dispose();
            connectivity.dispose();
            store.close();

            log.info("Shutdown complete");
        }));

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }
}
