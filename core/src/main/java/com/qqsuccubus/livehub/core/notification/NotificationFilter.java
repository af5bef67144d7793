package com.qqsuccubus.livehub.core.notification;

import lombok.Builder;
import lombok.Value;

/**
 * Query filter for a recipient's notifications. Pages are 1-based.
 */
@Value
@Builder(toBuilder = true)
public class NotificationFilter {
    public static final int DEFAULT_LIMIT = 20;

    Boolean read;
    NotificationType type;
    NotificationPriority priority;
    @Builder.Default
    int page = 1;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public static NotificationFilter firstPage() {
        return NotificationFilter.builder().build();
    }

    public boolean matches(Notification notification) {
        if (read != null && notification.isRead() != read) {
            return false;
        }
        if (type != null && notification.getType() != type) {
            return false;
        }
        return priority == null || notification.getPriority() == priority;
    }
}
