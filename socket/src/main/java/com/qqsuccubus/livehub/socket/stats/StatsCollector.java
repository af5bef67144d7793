package com.qqsuccubus.livehub.socket.stats;

import com.qqsuccubus.livehub.core.model.ConnectionStats;
import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.connection.HeartbeatState;
import com.qqsuccubus.livehub.socket.queue.MessageQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only aggregation over the registry and the queue.
 */
public class StatsCollector {

    private final ConnectionRegistry registry;
    private final MessageQueue queue;
    private final Clock clock;
    private volatile Instant startedAt;

    public StatsCollector(ConnectionRegistry registry, MessageQueue queue, Clock clock) {
        this.registry = registry;
        this.queue = queue;
        this.clock = clock;
    }

    public void markStarted() {
        startedAt = clock.instant();
    }

    public void markStopped() {
        startedAt = null;
    }

    public ConnectionStats snapshot() {
        List<Connection> connections = registry.snapshot();
        Map<String, Integer> byEvent = new TreeMap<>();
        Map<String, Integer> bySession = new TreeMap<>();
        int active = 0;
        int stale = 0;

        for (Connection connection : connections) {
            if (connection.isAlive()) {
                active++;
                if (connection.getHeartbeatState() == HeartbeatState.STALE) {
                    stale++;
                }
            }
            if (connection.getEventId() != null) {
                byEvent.merge(connection.getEventId(), 1, Integer::sum);
            }
            if (connection.getSessionId() != null) {
                bySession.merge(connection.getSessionId(), 1, Integer::sum);
            }
        }

        Instant started = startedAt;
        return ConnectionStats.builder()
            .totalConnections(connections.size())
            .activeConnections(active)
            .staleConnections(stale)
            .connectionsByEvent(byEvent)
            .connectionsBySession(bySession)
            .queuedMessages(queue.size())
            .uptimeMs(started == null ? 0 : Duration.between(started, clock.instant()).toMillis())
            .build();
    }

    public int activeConnections() {
        return (int) registry.snapshot().stream().filter(Connection::isAlive).count();
    }
}
