package com.qqsuccubus.livehub.socket.ws;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.core.util.JsonUtils;
import com.qqsuccubus.livehub.socket.LiveHub;
import com.qqsuccubus.livehub.socket.config.SocketConfig;
import com.qqsuccubus.livehub.socket.connection.CapacityExceededException;
import com.qqsuccubus.livehub.socket.transport.NettyWebSocketTransport;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * WebSocket handler for client connections.
 * <p>
 * Protocol (server → client): {@link BroadcastMessage} JSON text frames, ping frames.
 * </p>
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>pong frames: answer to the heartbeat probe</li>
 *   <li>{@code chat_message}: relayed to the sender's event/session, sender excluded</li>
 * </ul>
 * Any other inbound message is ignored.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final LiveHub hub;

	public WebSocketHandler(SocketConfig config, LiveHub hub) {
		this.config = config;
		this.hub = hub;
	}

	/**
	 * Registers the socket with the hub and runs it until either side closes.
	 *
	 * @param inbound   WebSocket inbound
	 * @param outbound  WebSocket outbound
	 * @param userId    verified user id
	 * @param eventId   optional event id
	 * @param sessionId optional session id
	 * @return Publisher for the connection
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
								  String userId, String eventId, String sessionId) {
		String connectionId = UUID.randomUUID().toString();
		MDC.put("connectionId", connectionId);
		log.debug("WebSocket opened for user {} (eventId={}, sessionId={})", userId, eventId, sessionId);

		AtomicReference<NettyWebSocketTransport> transportRef = new AtomicReference<>();
		inbound.withConnection(connection -> {
			NettyWebSocketTransport transport =
					new NettyWebSocketTransport(connection, outbound, config.getPerConnBufferSize());
			transportRef.set(transport);

			connection.onReadIdle(config.getIdleTimeout().toMillis(), transport::close)
					.onDispose(() -> {
						log.debug("WebSocket connection {} disposed, removing", connectionId);
						hub.getRegistry().remove(connectionId);
					});
		});
		NettyWebSocketTransport transport = transportRef.get();

		try {
			hub.getRegistry().add(connectionId, userId, transport, eventId, sessionId);
		} catch (CapacityExceededException e) {
			hub.getMetricsService().recordConnectionRejected();
			log.warn("Rejecting connection of user {}: {}", userId, e.getMessage());
			return outbound.sendClose(1013, "Server at capacity");
		} finally {
			MDC.remove("connectionId");
		}

		return Mono.when(
						outbound.sendObject(transport.outboundFrames()).then(),
						handleInboundFrames(inbound, connectionId, userId, eventId, sessionId)
				)
				.onErrorResume(err -> {
					log.error("WebSocket error for connection {}", connectionId, err);
					hub.getRegistry().remove(connectionId);
					return Mono.empty();
				});
	}

	private Mono<Void> handleInboundFrames(WebsocketInbound inbound, String connectionId,
										   String userId, String eventId, String sessionId) {
		return inbound.aggregateFrames()
				.receiveFrames()
				.doOnNext(frame -> handleFrame(frame, connectionId, userId, eventId, sessionId))
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", connectionId, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}

	private void handleFrame(WebSocketFrame frame, String connectionId,
							 String userId, String eventId, String sessionId) {
		if (frame instanceof PongWebSocketFrame) {
			hub.getRegistry().recordPong(connectionId);
			return;
		}
		if (frame instanceof TextWebSocketFrame textFrame) {
			String text = textFrame.text();
			hub.getMetricsService().recordNetworkInboundWs(text.getBytes(StandardCharsets.UTF_8).length);
			handleInboundMessage(userId, eventId, sessionId, text);
		}
	}

	void handleInboundMessage(String userId, String eventId, String sessionId, String messageJson) {
		BroadcastMessage inboundMessage;
		try {
			inboundMessage = JsonUtils.readValue(messageJson, BroadcastMessage.class);
		} catch (IllegalArgumentException e) {
			log.warn("Ignoring malformed message from {}: {}", userId, e.getMessage());
			return;
		}
		if (inboundMessage == null) {
			log.warn("Ignoring empty message from {}", userId);
			return;
		}

		if (inboundMessage.getType() != MessageType.CHAT_MESSAGE) {
			log.debug("Ignoring inbound {} message from {}", inboundMessage.getType(), userId);
			return;
		}
		if (eventId == null && sessionId == null) {
			log.warn("Ignoring chat message from {}: connection has no event or session", userId);
			return;
		}

		Map<String, Object> data = new HashMap<>();
		data.put("from", userId);
		data.put("content", inboundMessage.getData());
		Target room = Target.builder()
				.eventId(eventId)
				.sessionId(sessionId)
				.excludeUserIds(List.of(userId))
				.build();

		int delivered = hub.broadcastEvent(MessageType.CHAT_MESSAGE, data, room);
		log.debug("Chat message from {} relayed to {} connections", userId, delivered);
	}
}
