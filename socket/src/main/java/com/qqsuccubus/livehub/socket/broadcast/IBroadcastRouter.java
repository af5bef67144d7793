package com.qqsuccubus.livehub.socket.broadcast;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.socket.connection.Connection;

import java.util.List;

/**
 * Routes messages to the connections selected by a {@link Target}.
 * <p>
 * Delivery is best-effort and at most once per call: connection failures are absorbed
 * by evicting the connection, callers only ever see a delivered count.
 * </p>
 */
public interface IBroadcastRouter {

    /**
     * Resolves a target into the alive connections it selects.
     *
     * @param target selection criteria, null selects every alive connection
     * @return matching connections, possibly empty
     */
    List<Connection> resolve(Target target);

    /**
     * Sends a message to one connection.
     *
     * @param connectionId connection id
     * @param message      message to write
     * @return true if the message was written; false if the connection is unknown, dead
     *     or failed (in which case it has been removed)
     */
    boolean send(String connectionId, BroadcastMessage message);

    /**
     * Sends a message to every connection the target resolves to.
     *
     * @param message message to write
     * @param target  selection criteria, null selects every alive connection
     * @return number of connections the message was written to
     */
    int broadcast(BroadcastMessage message, Target target);
}
