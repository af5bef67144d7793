package com.qqsuccubus.livehub.socket.http;

import com.qqsuccubus.livehub.core.model.HealthStatus;
import com.qqsuccubus.livehub.core.util.JsonUtils;
import com.qqsuccubus.livehub.socket.LiveHub;
import com.qqsuccubus.livehub.socket.config.SocketConfig;
import com.qqsuccubus.livehub.socket.ws.WebSocketUpgradeHandler;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health, stats, metrics and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);
    private static final String JSON = "application/json";

    private final SocketConfig config;
    private final LiveHub hub;
    private final PrometheusMeterRegistry prometheusRegistry;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(config, hub);

        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Health check endpoint - 503 when any service is unhealthy
                .get("/healthz", (req, res) -> {
                    HealthStatus health = hub.healthStatus();
                    return res.status(health.isHealthy() ? 200 : 503)
                        .header("Content-Type", JSON)
                        .sendString(Mono.just(JsonUtils.writeValueAsString(health)));
                })
                .get("/stats", (req, res) ->
                    res.status(200)
                        .header("Content-Type", JSON)
                        .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(hub.stats())))
                )
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(prometheusRegistry.scrape()))
                )
                // WebSocket upgrade endpoint with param extraction
                .get("/ws/connect", upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
            server = null;
        }
    }
}
