package com.qqsuccubus.livehub.socket.connection;

/**
 * Observer of registry membership changes.
 * <p>
 * Callbacks run on the thread that changed the registry, after the registry lock is
 * released. Exceptions thrown by a listener are logged and ignored.
 * </p>
 */
public interface ConnectionListener {

    default void onConnectionAdded(Connection connection) {
    }

    default void onConnectionRemoved(Connection connection, RemovalReason reason) {
    }
}
