package com.qqsuccubus.livehub.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a hub node, loaded from environment variables.
 * <p>
 * Connection capacity, heartbeat interval and queue flush interval have no built-in
 * default and must be provided.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    int maxConnections;
    Duration heartbeatInterval;
    Duration queueFlushInterval;
    int maxDeliveryAttempts;   // 0 = retry forever
    int perConnBufferSize;
    Duration idleTimeout;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "live-hub-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .maxConnections(Integer.parseInt(requireEnv("MAX_CONNECTIONS")))
                .heartbeatInterval(Duration.ofMillis(Long.parseLong(requireEnv("HEARTBEAT_INTERVAL_MS"))))
                .queueFlushInterval(Duration.ofMillis(Long.parseLong(requireEnv("QUEUE_FLUSH_INTERVAL_MS"))))
                .maxDeliveryAttempts(Integer.parseInt(getEnv("MAX_DELIVERY_ATTEMPTS", "0")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .idleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("IDLE_TIMEOUT_SEC", "60"))))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    private static String requireEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable " + key);
        }
        return value;
    }
}
