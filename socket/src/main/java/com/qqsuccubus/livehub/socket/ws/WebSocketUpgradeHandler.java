package com.qqsuccubus.livehub.socket.ws;

import com.qqsuccubus.livehub.socket.LiveHub;
import com.qqsuccubus.livehub.socket.config.SocketConfig;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Handles WebSocket upgrade with query parameter extraction.
 * <p>
 * {@code userId} is required and trusted as-is: it is set by the authenticating proxy in
 * front of this node. {@code eventId} and {@code sessionId} are optional.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final LiveHub hub;

    public WebSocketUpgradeHandler(SocketConfig config, LiveHub hub) {
        this.wsHandler = new WebSocketHandler(config, hub);
        this.hub = hub;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!hub.isRunning()) {
            return res.status(503).sendString(Mono.just("Service unavailable - hub not running")).then();
        }

        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String userId = param(params, "userId");
        if (userId == null) {
            log.warn("Rejecting WebSocket upgrade without userId");
            return res.status(400).sendString(Mono.just("Missing userId")).then();
        }

        // Cheap pre-check so a full node answers with 503 instead of upgrading and closing
        if (hub.getRegistry().size() >= hub.getRegistry().getMaxConnections()) {
            hub.getMetricsService().recordConnectionRejected();
            return res.status(503).sendString(Mono.just("Service unavailable - at capacity")).then();
        }

        String eventId = param(params, "eventId");
        String sessionId = param(params, "sessionId");
        return res.sendWebsocket((inbound, outbound) ->
            wsHandler.handle(inbound, outbound, userId, eventId, sessionId)
        );
    }

    private static String param(Map<String, List<String>> params, String name) {
        return Stream.ofNullable(params.get(name))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst()
            .orElse(null);
    }
}
