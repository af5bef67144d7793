package com.qqsuccubus.livehub.socket.notification;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.core.notification.DeliveryMethod;
import com.qqsuccubus.livehub.core.notification.Notification;
import com.qqsuccubus.livehub.core.notification.NotificationFilter;
import com.qqsuccubus.livehub.core.notification.NotificationOptions;
import com.qqsuccubus.livehub.core.notification.NotificationPage;
import com.qqsuccubus.livehub.core.notification.NotificationRequest;
import com.qqsuccubus.livehub.core.notification.NotificationStatus;
import com.qqsuccubus.livehub.socket.broadcast.IBroadcastRouter;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns notifications into live pushes.
 * <p>
 * The record is persisted through the {@link INotificationStore} first, then pushed as a
 * {@code notification} message to the recipient's connection. The persisted record is
 * returned whether or not the push reached anyone.
 * </p>
 */
public class NotificationBridge {
    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    static final int MAX_TITLE_LENGTH = 255;
    static final int MAX_MESSAGE_LENGTH = 1000;

    private final INotificationStore store;
    private final IBroadcastRouter router;
    private final MetricsService metricsService;

    public NotificationBridge(INotificationStore store, IBroadcastRouter router, MetricsService metricsService) {
        this.store = Objects.requireNonNull(store, "store");
        this.router = Objects.requireNonNull(router, "router");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    /**
     * Stores a notification and pushes it to the recipient.
     *
     * @param recipientId recipient user id
     * @param title       title, 1-255 characters
     * @param message     body, 1-1000 characters
     * @param options     sender, type, priority and metadata; null for defaults
     * @return the persisted notification
     * @throws NotificationStoreException if the store rejects the record
     */
    public Notification sendRealtimeNotification(String recipientId, String title, String message,
                                                 NotificationOptions options) {
        requireText(recipientId, "recipientId", Integer.MAX_VALUE);
        requireText(title, "title", MAX_TITLE_LENGTH);
        requireText(message, "message", MAX_MESSAGE_LENGTH);
        NotificationOptions effective = options != null ? options : NotificationOptions.defaults();

        Notification persisted = store.create(Notification.builder()
            .recipientId(recipientId)
            .senderId(effective.senderOrDefault())
            .type(effective.typeOrDefault())
            .title(title)
            .message(message)
            .priority(effective.priorityOrDefault())
            .deliveryMethod(DeliveryMethod.PUSH)
            .status(NotificationStatus.PENDING)
            .metadata(effective.resolvedMetadata())
            .build());
        metricsService.recordNotificationSent();

        push(persisted);
        return persisted;
    }

    /**
     * Sends each request in order. A request the store rejects fails the whole call;
     * notifications stored before it stay stored.
     */
    public List<Notification> sendBulk(List<NotificationRequest> requests) {
        List<Notification> sent = new ArrayList<>(requests.size());
        for (NotificationRequest request : requests) {
            sent.add(sendRealtimeNotification(
                request.getRecipientId(), request.getTitle(), request.getMessage(), request.getOptions()));
        }
        return sent;
    }

    public Optional<Notification> getNotification(String id) {
        return store.getById(id);
    }

    public NotificationPage listNotifications(String userId, NotificationFilter filter) {
        return store.listByRecipient(userId, filter != null ? filter : NotificationFilter.firstPage());
    }

    public Notification markRead(String id) {
        return store.markRead(id);
    }

    public int markAllRead(String userId) {
        return store.markAllRead(userId);
    }

    public boolean deleteNotification(String id) {
        return store.delete(id);
    }

    public long unreadCount(String userId) {
        return store.countUnread(userId);
    }

    public boolean isHealthy() {
        try {
            return store.isHealthy();
        } catch (RuntimeException e) {
            log.warn("Notification store health probe failed", e);
            return false;
        }
    }

    private void push(Notification notification) {
        BroadcastMessage pushMessage = BroadcastMessage.of(
            MessageType.NOTIFICATION, notification, Target.users(notification.getRecipientId()));
        try {
            int delivered = router.broadcast(pushMessage, pushMessage.getTarget());
            log.debug("Notification {} pushed to {} connections of user {}",
                notification.getId(), delivered, notification.getRecipientId());
        } catch (RuntimeException e) {
            log.warn("Live push of notification {} failed, record kept", notification.getId(), e);
        }
    }

    private static void requireText(String value, String name, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(name + " must be at most " + maxLength + " characters");
        }
    }
}
