package com.qqsuccubus.livehub.socket.broadcast;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.core.util.JsonUtils;
import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.connection.ConnectionCriteria;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.connection.RemovalReason;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Default {@link IBroadcastRouter} over a {@link ConnectionRegistry}.
 * <p>
 * Writes to one connection are serialized on that connection, so messages sent to a
 * connection keep the caller's order. The registry lock is never held during a write.
 * A connection whose write fails, or whose transport turns out to be closed, is removed
 * from the registry here; this is the only place connections are evicted for failed
 * delivery.
 * </p>
 */
public class BroadcastRouter implements IBroadcastRouter {
	private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

	private final ConnectionRegistry registry;
	private final MetricsService metricsService;

	public BroadcastRouter(ConnectionRegistry registry, MetricsService metricsService) {
		this.registry = Objects.requireNonNull(registry, "registry");
		this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
	}

	@Override
	public List<Connection> resolve(Target target) {
		Target effective = target != null ? target : Target.all();
		List<String> userIds = effective.getUserIds();
		if (userIds != null && userIds.isEmpty()) {
			return List.of();
		}

		ConnectionCriteria criteria = ConnectionCriteria.builder()
				.eventId(effective.getEventId())
				.sessionId(effective.getSessionId())
				// A single allowed user can be served straight from the user index
				.userId(userIds != null && userIds.size() == 1 ? userIds.get(0) : null)
				.activeOnly(true)
				.build();

		return registry.find(criteria).stream()
				.filter(connection -> effective.admitsUser(connection.getUserId()))
				.collect(Collectors.toList());
	}

	@Override
	public boolean send(String connectionId, BroadcastMessage message) {
		Optional<Connection> connection = registry.get(connectionId);
		if (connection.isEmpty() || !connection.get().isAlive()) {
			return false;
		}
		return deliver(connection.get(), message, JsonUtils.writeValueAsString(message));
	}

	@Override
	public int broadcast(BroadcastMessage message, Target target) {
		List<Connection> connections = resolve(target);
		metricsService.recordBroadcast(message.getType());
		if (connections.isEmpty()) {
			log.debug("Broadcast {} ({}) resolved to no connections", message.getId(), message.getType());
			return 0;
		}

		String payload = JsonUtils.writeValueAsString(message);
		int sent = 0;
		for (Connection connection : connections) {
			if (deliver(connection, message, payload)) {
				sent++;
			}
		}

		log.debug("Broadcast {} ({}) delivered to {}/{} connections",
				message.getId(), message.getType(), sent, connections.size());
		return sent;
	}

	private boolean deliver(Connection connection, BroadcastMessage message, String payload) {
		RemovalReason failure;
		synchronized (connection) {
			if (!connection.isAlive()) {
				return false;
			}
			Transport transport = connection.transport();
			if (transport.isOpen()) {
				try {
					transport.send(payload);
					metricsService.recordDelivered(message.getType());
					return true;
				} catch (RuntimeException e) {
					log.debug("Send of {} to connection {} failed: {}",
							message.getId(), connection.getId(), e.getMessage());
					failure = RemovalReason.SEND_FAILED;
				}
			} else {
				failure = RemovalReason.TRANSPORT_CLOSED;
			}
		}

		if (failure == RemovalReason.SEND_FAILED) {
			metricsService.recordSendFailure();
		}
		registry.remove(connection.getId(), failure);
		return false;
	}
}
