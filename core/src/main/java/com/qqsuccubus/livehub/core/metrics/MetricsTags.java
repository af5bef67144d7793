package com.qqsuccubus.livehub.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for message type (event_update, notification, ...).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for removal/drop reason.
     */
    public static final String REASON = "reason";

}
