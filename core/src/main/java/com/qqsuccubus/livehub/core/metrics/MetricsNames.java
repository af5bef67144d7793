package com.qqsuccubus.livehub.core.metrics;

/**
 * Micrometer metric names used by the hub.
 * <p>
 * <b>Naming convention:</b> {@code livehub.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: registered connections.
     */
    public static final String CONNECTIONS = "livehub.connections";

    /**
     * Gauge: connections currently marked alive.
     */
    public static final String CONNECTIONS_ACTIVE = "livehub.connections.active";

    /**
     * Counter: accepted connections.
     */
    public static final String CONNECTIONS_OPENED_TOTAL = "livehub.connections.opened.total";

    /**
     * Counter: removed connections.
     * <p>
     * Tags: reason (requested/evicted/transport_closed/send_failed/shutdown)
     * </p>
     */
    public static final String CONNECTIONS_CLOSED_TOTAL = "livehub.connections.closed.total";

    /**
     * Counter: connection attempts rejected at capacity.
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "livehub.connections.rejected.total";

    /**
     * Counter: messages written to a connection.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String DELIVERED_TOTAL = "livehub.broadcast.delivered.total";

    /**
     * Counter: failed writes (connection removed afterwards).
     */
    public static final String SEND_FAILURES_TOTAL = "livehub.broadcast.send.failures.total";

    /**
     * Counter: broadcast calls.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String BROADCASTS_TOTAL = "livehub.broadcast.total";

    /**
     * Gauge: messages waiting in the queue.
     */
    public static final String QUEUE_DEPTH = "livehub.queue.depth";

    /**
     * Counter: messages re-queued after a failed flush attempt.
     */
    public static final String QUEUE_REQUEUED_TOTAL = "livehub.queue.requeued.total";

    /**
     * Counter: messages dropped after reaching the delivery attempt cap.
     */
    public static final String QUEUE_DROPPED_TOTAL = "livehub.queue.dropped.total";

    /**
     * Counter: heartbeat probes sent.
     */
    public static final String HEARTBEAT_PROBES_TOTAL = "livehub.heartbeat.probes.total";

    /**
     * Counter: connections marked dead by the heartbeat.
     */
    public static final String HEARTBEAT_DEAD_TOTAL = "livehub.heartbeat.dead.total";

    /**
     * Counter: realtime notifications created.
     */
    public static final String NOTIFICATIONS_SENT_TOTAL = "livehub.notifications.sent.total";

    /**
     * Counter: bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "livehub.network.inbound.ws.bytes";
}
