package com.qqsuccubus.livehub.socket.notification;

import com.qqsuccubus.livehub.core.notification.Notification;
import com.qqsuccubus.livehub.core.notification.NotificationFilter;
import com.qqsuccubus.livehub.core.notification.NotificationPage;

import java.util.Optional;

/**
 * Record store for notifications (Dependency Inversion Principle).
 * <p>
 * The store owns notification state; the hub never reads or writes notifications
 * any other way. Implementations signal failures with {@link NotificationStoreException}.
 * </p>
 */
public interface INotificationStore {

    /**
     * Persists a new notification.
     *
     * @param notification record to store; id and timestamps are assigned if absent
     * @return the stored record
     */
    Notification create(Notification notification);

    Optional<Notification> getById(String id);

    /**
     * Lists a recipient's notifications, newest first.
     *
     * @param userId recipient
     * @param filter read/type/priority filter and page
     * @return requested page
     */
    NotificationPage listByRecipient(String userId, NotificationFilter filter);

    /**
     * @return the updated record
     * @throws NotificationStoreException if the notification does not exist
     */
    Notification markRead(String id);

    /**
     * @return number of notifications that changed to read
     */
    int markAllRead(String userId);

    boolean delete(String id);

    long countUnread(String userId);

    /**
     * @return true if the store can currently serve requests
     */
    default boolean isHealthy() {
        return true;
    }
}
