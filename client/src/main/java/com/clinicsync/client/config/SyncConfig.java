package com.clinicsync.client.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the sync client, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SyncConfig {

    /**
     * Installation identifier; namespaces the persisted snapshots and tags metrics.
     */
    String clientId;

    // Endpoints
    String apiBaseUrl;
    String realtimeUrl;
    String healthUrl;

    // Connectivity
    Duration reachabilityPollInterval;
    Duration reachabilityTimeout;
    boolean initialOnline;

    // Durable store
    StoreType storeType;
    String storageDir;
    String redisUrl;

    // Mutation queue
    int defaultMaxRetries;
    Duration mutationTimeout;
    Duration retryBaseDelay;
    Duration retryMaxDelay;

    // Realtime channel
    Duration connectTimeout;
    Duration reconnectBaseDelay;
    Duration reconnectMaxDelay;
    Duration reconnectJitter;
    int reconnectMaxAttempts;
    int outboundBufferMax;

    public enum StoreType {
        MEMORY,
        FILE,
        REDIS
    }

    public static SyncConfig fromEnv() {
        return SyncConfig.builder()
                .clientId(getEnv("CLIENT_ID", "clinic-client-1"))
                .apiBaseUrl(getEnv("API_BASE_URL", "http://localhost:8080/api"))
                .realtimeUrl(getEnv("REALTIME_URL", "ws://localhost:8080/ws"))
                .healthUrl(getEnv("HEALTH_URL", "http://localhost:8080/healthz"))
                .reachabilityPollInterval(Duration.ofSeconds(Long.parseLong(getEnv("REACHABILITY_POLL_SEC", "10"))))
                .reachabilityTimeout(Duration.ofMillis(Long.parseLong(getEnv("REACHABILITY_TIMEOUT_MS", "3000"))))
                .initialOnline(Boolean.parseBoolean(getEnv("INITIAL_ONLINE", "false")))
                .storeType(StoreType.valueOf(getEnv("STORE_TYPE", "FILE").toUpperCase()))
                .storageDir(getEnv("STORAGE_DIR", "./sync-data"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .defaultMaxRetries(Integer.parseInt(getEnv("MAX_RETRIES", "3")))
                .mutationTimeout(Duration.ofSeconds(Long.parseLong(getEnv("MUTATION_TIMEOUT_SEC", "30"))))
                .retryBaseDelay(Duration.ofMillis(Long.parseLong(getEnv("RETRY_BASE_DELAY_MS", "2000"))))
                .retryMaxDelay(Duration.ofSeconds(Long.parseLong(getEnv("RETRY_MAX_DELAY_SEC", "60"))))
                .connectTimeout(Duration.ofSeconds(Long.parseLong(getEnv("CONNECT_TIMEOUT_SEC", "10"))))
                .reconnectBaseDelay(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_BASE_DELAY_MS", "1000"))))
                .reconnectMaxDelay(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_MAX_DELAY_MS", "5000"))))
                .reconnectJitter(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_JITTER_MS", "0"))))
                .reconnectMaxAttempts(Integer.parseInt(getEnv("RECONNECT_MAX_ATTEMPTS", "10")))
                .outboundBufferMax(Integer.parseInt(getEnv("OUTBOUND_BUFFER_MAX", "500")))
                .build();
    }

    /**
     * Defaults without touching the environment; tests derive from this via {@code toBuilder()}.
     */
    public static SyncConfig defaults() {
        return SyncConfig.builder()
                .clientId("clinic-client-1")
                .apiBaseUrl("http://localhost:8080/api")
                .realtimeUrl("ws://localhost:8080/ws")
                .healthUrl("http://localhost:8080/healthz")
                .reachabilityPollInterval(Duration.ofSeconds(10))
                .reachabilityTimeout(Duration.ofSeconds(3))
                .initialOnline(false)
                .storeType(StoreType.MEMORY)
                .storageDir("./sync-data")
                .redisUrl("redis://localhost:6379")
                .defaultMaxRetries(3)
                .mutationTimeout(Duration.ofSeconds(30))
                .retryBaseDelay(Duration.ofSeconds(2))
                .retryMaxDelay(Duration.ofSeconds(60))
                .connectTimeout(Duration.ofSeconds(10))
                .reconnectBaseDelay(Duration.ofSeconds(1))
                .reconnectMaxDelay(Duration.ofSeconds(5))
                .reconnectJitter(Duration.ZERO)
                .reconnectMaxAttempts(10)
                .outboundBufferMax(500)
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
