package com.qqsuccubus.livehub.socket.notification;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.notification.Notification;
import com.qqsuccubus.livehub.core.notification.NotificationFilter;
import com.qqsuccubus.livehub.core.notification.NotificationPage;
import com.qqsuccubus.livehub.core.notification.NotificationStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local {@link INotificationStore}. Contents are lost on restart.
 */
public class InMemoryNotificationStore implements INotificationStore {

    private final Map<String, Notification> notifications = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryNotificationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryNotificationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Notification create(Notification notification) {
        Instant now = clock.instant();
        Notification stored = notification.toBuilder()
            .id(notification.getId() != null ? notification.getId() : BroadcastMessage.generateId("notif"))
            .status(notification.getStatus() != null ? notification.getStatus() : NotificationStatus.PENDING)
            .metadata(notification.getMetadata() != null
                ? Collections.unmodifiableMap(new HashMap<>(notification.getMetadata())) : Map.of())
            .createdAt(notification.getCreatedAt() != null ? notification.getCreatedAt() : now)
            .updatedAt(now)
            .build();
        if (notifications.putIfAbsent(stored.getId(), stored) != null) {
            throw new NotificationStoreException("Notification already exists: " + stored.getId());
        }
        return stored;
    }

    @Override
    public Optional<Notification> getById(String id) {
        return Optional.ofNullable(notifications.get(id));
    }

    @Override
    public NotificationPage listByRecipient(String userId, NotificationFilter filter) {
        int page = Math.max(1, filter.getPage());
        int limit = Math.max(1, filter.getLimit());

        List<Notification> matching = notifications.values().stream()
            .filter(n -> userId.equals(n.getRecipientId()))
            .filter(filter::matches)
            .sorted(Comparator.comparing(Notification::getCreatedAt).reversed()
                .thenComparing(Notification::getId))
            .collect(Collectors.toList());

        List<Notification> data = matching.stream()
            .skip((long) (page - 1) * limit)
            .limit(limit)
            .collect(Collectors.toList());
        return new NotificationPage(data, matching.size(), page, limit);
    }

    @Override
    public Notification markRead(String id) {
        Notification updated = notifications.computeIfPresent(id, (key, existing) -> toRead(existing));
        if (updated == null) {
            throw new NotificationStoreException("Notification not found: " + id);
        }
        return updated;
    }

    @Override
    public int markAllRead(String userId) {
        int changed = 0;
        for (Notification notification : notifications.values()) {
            if (userId.equals(notification.getRecipientId()) && !notification.isRead()) {
                notifications.computeIfPresent(notification.getId(), (key, existing) -> toRead(existing));
                changed++;
            }
        }
        return changed;
    }

    @Override
    public boolean delete(String id) {
        return notifications.remove(id) != null;
    }

    @Override
    public long countUnread(String userId) {
        return notifications.values().stream()
            .filter(n -> userId.equals(n.getRecipientId()) && !n.isRead())
            .count();
    }

    private Notification toRead(Notification existing) {
        if (existing.isRead()) {
            return existing;
        }
        Instant now = clock.instant();
        return existing.toBuilder()
            .read(true)
            .readAt(now)
            .status(NotificationStatus.READ)
            .updatedAt(now)
            .build();
    }
}
