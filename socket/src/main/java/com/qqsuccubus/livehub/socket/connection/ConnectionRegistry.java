package com.qqsuccubus.livehub.socket.connection;

import com.qqsuccubus.livehub.socket.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the set of live connections of this node.
 * <p>
 * Connections are kept in a primary map keyed by connection id, with secondary indices by
 * user, event and session. All structural changes and heartbeat state changes are
 * serialized by a single lock; transports are closed and listeners notified after the
 * lock is released, so a slow socket never stalls the registry.
 * </p>
 * <p>
 * At most one connection per user is kept: registering a second connection for a user
 * evicts the first one.
 * </p>
 */
public class ConnectionRegistry {
	private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

	private final int maxConnections;
	private final Clock clock;
	private final ReentrantLock lock = new ReentrantLock();

	// Guarded by lock
	private final Map<String, Connection> connections = new HashMap<>();
	private final Map<String, String> userIndex = new HashMap<>();
	private final Map<String, Set<String>> eventIndex = new HashMap<>();
	private final Map<String, Set<String>> sessionIndex = new HashMap<>();

	private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

	public ConnectionRegistry(int maxConnections) {
		this(maxConnections, Clock.systemUTC());
	}

	public ConnectionRegistry(int maxConnections, Clock clock) {
		if (maxConnections <= 0) {
			throw new IllegalArgumentException("maxConnections must be positive, got " + maxConnections);
		}
		this.maxConnections = maxConnections;
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	public void addListener(ConnectionListener listener) {
		listeners.add(Objects.requireNonNull(listener, "listener"));
	}

	public int getMaxConnections() {
		return maxConnections;
	}

	/**
	 * Registers a connection and takes ownership of its transport.
	 * <p>
	 * If the user already has a connection, that connection is removed (transport closed)
	 * before the new one is inserted. If the registry is full the call fails and the
	 * transport stays with the caller.
	 * </p>
	 *
	 * @param id        unique connection id
	 * @param userId    verified user id
	 * @param transport open transport
	 * @param eventId   optional event id
	 * @param sessionId optional session id
	 * @return the connection id
	 * @throws CapacityExceededException if the registry holds {@code maxConnections} entries
	 */
	public String add(String id, String userId, Transport transport, String eventId, String sessionId) {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(userId, "userId");
		Objects.requireNonNull(transport, "transport");

		Connection connection;
		Connection evicted;
		lock.lock();
		try {
			if (connections.containsKey(id)) {
				throw new IllegalArgumentException("Connection id already registered: " + id);
			}
			if (connections.size() >= maxConnections) {
				throw new CapacityExceededException(maxConnections);
			}
			String existingId = userIndex.get(userId);
			evicted = existingId != null ? detach(existingId) : null;

			connection = new Connection(id, userId, eventId, sessionId, transport, clock.instant());
			attach(connection);
		} finally {
			lock.unlock();
		}

		if (evicted != null) {
			log.info("Evicted connection {} of user {} in favour of {}", evicted.getId(), userId, id);
			closeQuietly(evicted);
			notifyRemoved(evicted, RemovalReason.EVICTED);
		}

		log.debug("Connection {} added (userId={}, eventId={}, sessionId={})", id, userId, eventId, sessionId);
		notifyAdded(connection);
		return id;
	}

	/**
	 * Removes a connection and closes its transport. Unknown ids are ignored.
	 *
	 * @return false if the id was not registered
	 */
	public boolean remove(String id) {
		return remove(id, RemovalReason.REQUESTED);
	}

	public boolean remove(String id, RemovalReason reason) {
		Connection connection;
		lock.lock();
		try {
			connection = detach(id);
		} finally {
			lock.unlock();
		}
		if (connection == null) {
			return false;
		}

		closeQuietly(connection);
		log.debug("Connection {} removed ({})", id, reason);
		notifyRemoved(connection, reason);
		return true;
	}

	/**
	 * Removes every connection, closing all transports.
	 *
	 * @return number of connections removed
	 */
	public int closeAll(RemovalReason reason) {
		List<Connection> removed;
		lock.lock();
		try {
			removed = new ArrayList<>(connections.values());
			connections.clear();
			userIndex.clear();
			eventIndex.clear();
			sessionIndex.clear();
		} finally {
			lock.unlock();
		}

		for (Connection connection : removed) {
			closeQuietly(connection);
			notifyRemoved(connection, reason);
		}
		if (!removed.isEmpty()) {
			log.info("Closed {} connections ({})", removed.size(), reason);
		}
		return removed.size();
	}

	/**
	 * Returns the connections matching the criteria, as of a single point in time.
	 * <p>
	 * The narrowest secondary index is used to pick candidates. No ordering is guaranteed.
	 * </p>
	 */
	public List<Connection> find(ConnectionCriteria criteria) {
		lock.lock();
		try {
			List<Connection> result = new ArrayList<>();
			for (String id : candidateIds(criteria)) {
				Connection connection = connections.get(id);
				if (connection != null && criteria.matches(connection)) {
					result.add(connection);
				}
			}
			return result;
		} finally {
			lock.unlock();
		}
	}

	public Optional<Connection> findByUser(String userId) {
		lock.lock();
		try {
			String id = userIndex.get(userId);
			return id == null ? Optional.empty() : Optional.ofNullable(connections.get(id));
		} finally {
			lock.unlock();
		}
	}

	public Optional<Connection> get(String id) {
		lock.lock();
		try {
			return Optional.ofNullable(connections.get(id));
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return copy of all registered connections
	 */
	public List<Connection> snapshot() {
		lock.lock();
		try {
			return new ArrayList<>(connections.values());
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return connections.size();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Records that a liveness probe was sent. A connection whose previous probe is still
	 * unanswered becomes {@link HeartbeatState#STALE}.
	 *
	 * @return the heartbeat state after the update, empty if the id is unknown
	 */
	public Optional<HeartbeatState> recordProbe(String id) {
		lock.lock();
		try {
			Connection connection = connections.get(id);
			if (connection == null) {
				return Optional.empty();
			}
			if (connection.isProbePending()) {
				connection.setHeartbeatState(HeartbeatState.STALE);
			}
			connection.setProbePending(true);
			return Optional.of(connection.getHeartbeatState());
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Records a pong: the connection is alive and {@link HeartbeatState#ACTIVE} again.
	 *
	 * @return false if the id is unknown
	 */
	public boolean recordPong(String id) {
		lock.lock();
		try {
			Connection connection = connections.get(id);
			if (connection == null) {
				return false;
			}
			connection.setProbePending(false);
			connection.setHeartbeatState(HeartbeatState.ACTIVE);
			connection.setLastHeartbeatAt(clock.instant());
			connection.setAlive(true);
			return true;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Marks a connection dead. Dead connections stay registered but are skipped by
	 * broadcasts.
	 *
	 * @return true if the connection was alive before the call
	 */
	public boolean markDead(String id) {
		lock.lock();
		try {
			Connection connection = connections.get(id);
			if (connection == null || !connection.isAlive()) {
				return false;
			}
			connection.setAlive(false);
			return true;
		} finally {
			lock.unlock();
		}
	}

	private Collection<String> candidateIds(ConnectionCriteria criteria) {
		if (criteria.getUserId() != null) {
			String id = userIndex.get(criteria.getUserId());
			return id == null ? List.of() : List.of(id);
		}
		Set<String> byEvent = criteria.getEventId() != null
				? eventIndex.getOrDefault(criteria.getEventId(), Set.of()) : null;
		Set<String> bySession = criteria.getSessionId() != null
				? sessionIndex.getOrDefault(criteria.getSessionId(), Set.of()) : null;

		if (byEvent != null && bySession != null) {
			return byEvent.size() <= bySession.size() ? byEvent : bySession;
		}
		if (byEvent != null) {
			return byEvent;
		}
		if (bySession != null) {
			return bySession;
		}
		return connections.keySet();
	}

	private void attach(Connection connection) {
		connections.put(connection.getId(), connection);
		userIndex.put(connection.getUserId(), connection.getId());
		if (connection.getEventId() != null) {
			eventIndex.computeIfAbsent(connection.getEventId(), k -> new LinkedHashSet<>()).add(connection.getId());
		}
		if (connection.getSessionId() != null) {
			sessionIndex.computeIfAbsent(connection.getSessionId(), k -> new LinkedHashSet<>()).add(connection.getId());
		}
	}

	private Connection detach(String id) {
		Connection connection = connections.remove(id);
		if (connection == null) {
			return null;
		}
		userIndex.remove(connection.getUserId(), id);
		unindex(eventIndex, connection.getEventId(), id);
		unindex(sessionIndex, connection.getSessionId(), id);
		return connection;
	}

	private static void unindex(Map<String, Set<String>> index, String key, String id) {
		if (key == null) {
			return;
		}
		index.computeIfPresent(key, (k, ids) -> {
			ids.remove(id);
			return ids.isEmpty() ? null : ids;
		});
	}

	private static void closeQuietly(Connection connection) {
		try {
			connection.transport().close();
		} catch (RuntimeException e) {
			// Close errors are expected for sockets the peer already dropped
			log.debug("Ignoring close error for connection {}: {}", connection.getId(), e.getMessage());
		}
	}

	private void notifyAdded(Connection connection) {
		for (ConnectionListener listener : listeners) {
			try {
				listener.onConnectionAdded(connection);
			} catch (RuntimeException e) {
				log.warn("Connection listener failed on add of {}", connection.getId(), e);
			}
		}
	}

	private void notifyRemoved(Connection connection, RemovalReason reason) {
		for (ConnectionListener listener : listeners) {
			try {
				listener.onConnectionRemoved(connection, reason);
			} catch (RuntimeException e) {
				log.warn("Connection listener failed on removal of {}", connection.getId(), e);
			}
		}
	}
}
