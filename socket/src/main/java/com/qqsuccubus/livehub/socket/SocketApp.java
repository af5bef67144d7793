package com.qqsuccubus.livehub.socket;

import com.qqsuccubus.livehub.socket.config.SocketConfig;
import com.qqsuccubus.livehub.socket.http.HttpServer;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.notification.InMemoryNotificationStore;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Schedulers;
import reactor.netty.Metrics;

import java.time.Clock;

/**
 * Main entry point for a hub node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws/connect (query: userId, optional eventId, sessionId)</li>
 *   <li>Run the heartbeat and queue flush timers</li>
 *   <li>Expose /healthz, /stats and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting live hub node: {}", config.getNodeId());
        log.info("  Max connections: {}", config.getMaxConnections());
        log.info("  Heartbeat interval: {}", config.getHeartbeatInterval());
        log.info("  Queue flush interval: {}", config.getQueueFlushInterval());

        // Hub meters and Reactor Netty's HTTP meters share the global registry; /metrics scrapes both
        PrometheusMeterRegistry prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags("application", "live-hub");
        ((CompositeMeterRegistry) Metrics.REGISTRY).add(prometheusRegistry);
        MetricsService metricsService = new MetricsService(Metrics.REGISTRY, config);
        LiveHub hub = new LiveHub(
            config,
            new InMemoryNotificationStore(),
            metricsService,
            Schedulers.newSingle("live-hub-timers", true),
            Clock.systemUTC()
        );
        hub.start();

        HttpServer httpServer = new HttpServer(config, hub, prometheusRegistry);
        try {
            httpServer.start();
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP server", e);
            hub.stop();
            throw e;
        }

        log.info("Live hub node {} is ready", config.getNodeId());

        handleShutdown(config, hub, httpServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config, LiveHub hub, HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, stopping...");

            // Close client sockets before the server goes away
            hub.stop();
            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
