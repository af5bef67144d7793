package com.qqsuccubus.livehub.socket.connection;

import lombok.Builder;
import lombok.Value;

/**
 * Lookup criteria for {@link ConnectionRegistry#find}. Absent fields match everything.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionCriteria {
    private static final ConnectionCriteria ANY = ConnectionCriteria.builder().build();

    String eventId;
    String sessionId;
    String userId;
    boolean activeOnly;

    public static ConnectionCriteria any() {
        return ANY;
    }

    public boolean matches(Connection connection) {
        if (activeOnly && !connection.isAlive()) {
            return false;
        }
        if (eventId != null && !eventId.equals(connection.getEventId())) {
            return false;
        }
        if (sessionId != null && !sessionId.equals(connection.getSessionId())) {
            return false;
        }
        return userId == null || userId.equals(connection.getUserId());
    }
}
