package com.qqsuccubus.livehub.socket.transport;

/**
 * Write or close failure on a client socket.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
