package com.qqsuccubus.livehub.socket.connection;

import java.util.Locale;

/**
 * Why a connection left the registry.
 */
public enum RemovalReason {
    /** Explicit remove call, or the peer closed the socket. */
    REQUESTED,
    /** A newer connection was registered for the same user. */
    EVICTED,
    /** The transport was found closed when a message was sent. */
    TRANSPORT_CLOSED,
    /** Writing a message to the transport failed. */
    SEND_FAILED,
    /** The hub is stopping. */
    SHUTDOWN;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
