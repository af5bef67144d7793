package com.qqsuccubus.livehub.socket.metrics;

import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.connection.RemovalReason;
import com.qqsuccubus.livehub.socket.support.TestConfigs;
import com.qqsuccubus.livehub.socket.support.TestTransport;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsServiceTest {

    private PrometheusMeterRegistry prometheusRegistry;
    private CompositeMeterRegistry composite;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        // Same layout as the app: hub meters go to a composite with Prometheus attached
        prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite = new CompositeMeterRegistry();
        composite.add(prometheusRegistry);
        metrics = new MetricsService(composite, TestConfigs.config(10));
    }

    @Test
    @DisplayName("Hub meters show up in the Prometheus scrape")
    void metersAreScraped() {
        metrics.recordDelivered(MessageType.EVENT_UPDATE);
        metrics.recordConnectionRejected();

        String scrape = prometheusRegistry.scrape();

        assertTrue(scrape.contains("livehub_broadcast_delivered"), scrape);
        assertTrue(scrape.contains("type=\"event_update\""), scrape);
        assertTrue(scrape.contains("livehub_connections_rejected"), scrape);
        assertTrue(scrape.contains("node_id=\"test-node\""), scrape);
    }

    @Test
    @DisplayName("Registry churn is counted per removal reason")
    void churnCountedPerReason() {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        registry.addListener(metrics);

        registry.add("c1", "u1", new TestTransport(), null, null);
        registry.add("c2", "u1", new TestTransport(), null, null);
        registry.remove("c2");

        assertEquals(2.0, composite.get("livehub.connections.opened.total").counter().count());
        assertEquals(1.0, composite.get("livehub.connections.closed.total")
            .tag("reason", RemovalReason.EVICTED.tagValue()).counter().count());
        assertEquals(1.0, composite.get("livehub.connections.closed.total")
            .tag("reason", RemovalReason.REQUESTED.tagValue()).counter().count());
    }
}
