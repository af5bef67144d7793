package com.qqsuccubus.livehub.socket.connection;

import com.qqsuccubus.livehub.socket.transport.Transport;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A registered client socket bound to a user and optionally to an event and a session.
 * <p>
 * The connection exclusively owns its {@link Transport}; the transport is closed when the
 * connection leaves the registry. Mutable state changes only through
 * {@link ConnectionRegistry}.
 * </p>
 */
@Getter
public class Connection {
    private final String id;
    private final String userId;
    private final String eventId;
    private final String sessionId;
    @Getter(AccessLevel.NONE)
    private final Transport transport;
    private final Instant connectedAt;

    @Setter(AccessLevel.PACKAGE)
    private volatile boolean alive = true;
    @Setter(AccessLevel.PACKAGE)
    private volatile Instant lastHeartbeatAt;
    @Setter(AccessLevel.PACKAGE)
    private volatile HeartbeatState heartbeatState = HeartbeatState.ACTIVE;
    @Setter(AccessLevel.PACKAGE)
    private volatile boolean probePending;

    Connection(String id, String userId, String eventId, String sessionId, Transport transport, Instant connectedAt) {
        this.id = id;
        this.userId = userId;
        this.eventId = eventId;
        this.sessionId = sessionId;
        this.transport = transport;
        this.connectedAt = connectedAt;
    }

    /**
     * The owned transport. Only the registry may close it.
     */
    public Transport transport() {
        return transport;
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", userId=" + userId + ", eventId=" + eventId
                + ", sessionId=" + sessionId + ", alive=" + alive + ", state=" + heartbeatState + "}";
    }
}
