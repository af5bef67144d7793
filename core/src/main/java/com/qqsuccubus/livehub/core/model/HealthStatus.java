package com.qqsuccubus.livehub.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Health report of a hub node.
 * <p>
 * The node is {@code healthy} only if every service it reports on is healthy.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class HealthStatus {

    public enum Status {
        HEALTHY,
        UNHEALTHY;

        public static Status of(boolean healthy) {
            return healthy ? HEALTHY : UNHEALTHY;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Value
    public static class Services {
        Status websocket;
        Status notifications;
    }

    Status status;
    Services services;
    Instant timestamp;

    public static HealthStatus of(boolean websocketHealthy, boolean notificationsHealthy) {
        Services services = new Services(Status.of(websocketHealthy), Status.of(notificationsHealthy));
        return HealthStatus.builder()
            .status(Status.of(websocketHealthy && notificationsHealthy))
            .services(services)
            .timestamp(Instant.now())
            .build();
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
