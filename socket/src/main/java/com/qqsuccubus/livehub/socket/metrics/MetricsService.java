package com.qqsuccubus.livehub.socket.metrics;

import com.qqsuccubus.livehub.core.metrics.MetricsNames;
import com.qqsuccubus.livehub.core.metrics.MetricsTags;
import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.socket.config.SocketConfig;
import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.connection.ConnectionListener;
import com.qqsuccubus.livehub.socket.connection.RemovalReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a hub node.
 * <p>
 * Registered as a {@link ConnectionListener} so connection churn is counted without the
 * registry knowing about metrics.
 * </p>
 */
public class MetricsService implements ConnectionListener {

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter connectionsOpened;
    private final Counter connectionsRejected;
    private final Map<RemovalReason, Counter> connectionsClosed = new EnumMap<>(RemovalReason.class);
    private final Map<MessageType, Counter> delivered = new EnumMap<>(MessageType.class);
    private final Map<MessageType, Counter> broadcasts = new EnumMap<>(MessageType.class);
    private final Counter sendFailures;
    private final Counter queueRequeued;
    private final Counter queueDropped;
    private final Counter heartbeatProbes;
    private final Counter heartbeatDead;
    private final Counter notificationsSent;
    private final Counter networkInboundWs;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsOpened = counter(MetricsNames.CONNECTIONS_OPENED_TOTAL, "Connections accepted");
        connectionsRejected = counter(MetricsNames.CONNECTIONS_REJECTED_TOTAL, "Connections rejected at capacity");

        for (RemovalReason reason : RemovalReason.values()) {
            connectionsClosed.put(reason, Counter.builder(MetricsNames.CONNECTIONS_CLOSED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.tagValue())
                .description("Connections removed from the registry")
                .register(registry));
        }

        for (MessageType type : MessageType.values()) {
            delivered.put(type, Counter.builder(MetricsNames.DELIVERED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.TYPE, type.wireName())
                .description("Messages written to client sockets")
                .register(registry));
            broadcasts.put(type, Counter.builder(MetricsNames.BROADCASTS_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.TYPE, type.wireName())
                .description("Broadcast calls")
                .register(registry));
        }

        sendFailures = counter(MetricsNames.SEND_FAILURES_TOTAL, "Failed writes to client sockets");
        queueRequeued = counter(MetricsNames.QUEUE_REQUEUED_TOTAL, "Messages re-queued after a failed flush");
        queueDropped = counter(MetricsNames.QUEUE_DROPPED_TOTAL, "Messages dropped at the delivery attempt cap");
        heartbeatProbes = counter(MetricsNames.HEARTBEAT_PROBES_TOTAL, "Heartbeat probes sent");
        heartbeatDead = counter(MetricsNames.HEARTBEAT_DEAD_TOTAL, "Connections marked dead by the heartbeat");
        notificationsSent = counter(MetricsNames.NOTIFICATIONS_SENT_TOTAL, "Realtime notifications created");

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description(description)
            .register(registry);
    }

    /**
     * Registers the connection and queue gauges.
     *
     * @param totalConnections  registered connections
     * @param activeConnections alive connections
     * @param queueDepth        queued messages
     */
    public void bindGauges(Supplier<Number> totalConnections,
                           Supplier<Number> activeConnections,
                           Supplier<Number> queueDepth) {
        Gauge.builder(MetricsNames.CONNECTIONS, totalConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Registered connections")
            .register(registry);
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Alive connections")
            .register(registry);
        Gauge.builder(MetricsNames.QUEUE_DEPTH, queueDepth)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Messages waiting for the next flush")
            .register(registry);
    }

    @Override
    public void onConnectionAdded(Connection connection) {
        connectionsOpened.increment();
    }

    @Override
    public void onConnectionRemoved(Connection connection, RemovalReason reason) {
        connectionsClosed.get(reason).increment();
    }

    public void recordConnectionRejected() {
        connectionsRejected.increment();
    }

    public void recordDelivered(MessageType type) {
        if (type != null) {
            delivered.get(type).increment();
        }
    }

    public void recordBroadcast(MessageType type) {
        if (type != null) {
            broadcasts.get(type).increment();
        }
    }

    public void recordSendFailure() {
        sendFailures.increment();
    }

    public void recordRequeued() {
        queueRequeued.increment();
    }

    public void recordDropped() {
        queueDropped.increment();
    }

    public void recordHeartbeatProbe() {
        heartbeatProbes.increment();
    }

    public void recordHeartbeatDead() {
        heartbeatDead.increment();
    }

    public void recordNotificationSent() {
        notificationsSent.increment();
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    public double getDeliveredCount() {
        return delivered.values().stream().mapToDouble(Counter::count).sum();
    }

}
