package com.qqsuccubus.livehub.socket.connection;

/**
 * Heartbeat state of a connection.
 * <p>
 * {@code ACTIVE} → (probe sent, no pong before the next tick) → {@code STALE} →
 * (pong received) → {@code ACTIVE}.
 * </p>
 */
public enum HeartbeatState {
    ACTIVE,
    STALE
}
