package com.qqsuccubus.livehub.socket.transport;

/**
 * An already-open bidirectional client socket.
 * <p>
 * Implementations must not block indefinitely in {@link #send(String)} or {@link #ping()};
 * callers treat both as bounded-latency operations.
 * </p>
 */
public interface Transport {

    /**
     * @return true while the underlying socket accepts writes
     */
    boolean isOpen();

    /**
     * Writes one text frame.
     *
     * @param text serialized message
     * @throws TransportException if the frame cannot be written
     */
    void send(String text);

    /**
     * Sends a liveness probe. The peer answers with a pong reported back through
     * the connection registry.
     *
     * @throws TransportException if the probe cannot be written
     */
    void ping();

    /**
     * Closes the socket. Calling it more than once has no effect.
     */
    void close();
}
