package com.qqsuccubus.livehub.socket.connection;

import lombok.Getter;

/**
 * Thrown by {@link ConnectionRegistry#add} when the registry holds its configured
 * maximum number of connections. The caller must reject the connection attempt.
 */
@Getter
public class CapacityExceededException extends RuntimeException {
    private final int maxConnections;

    public CapacityExceededException(int maxConnections) {
        super("Maximum connections reached (" + maxConnections + ")");
        this.maxConnections = maxConnections;
    }
}
