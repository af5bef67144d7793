package com.qqsuccubus.livehub.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time aggregate of a node's connections and queue.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionStats {
    /**
     * Registered connections, alive or not.
     */
    int totalConnections;

    /**
     * Connections with {@code alive == true}.
     */
    int activeConnections;

    /**
     * Alive connections that missed their last heartbeat probe.
     */
    int staleConnections;

    Map<String, Integer> connectionsByEvent;
    Map<String, Integer> connectionsBySession;

    /**
     * Messages waiting for the next queue flush.
     */
    int queuedMessages;

    /**
     * Milliseconds since the hub was started, 0 while stopped.
     */
    long uptimeMs;
}
