package com.qqsuccubus.livehub.core.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * Notification record as persisted by the notification store.
 * <p>
 * The store is the durable source of truth; the live push of a notification is a
 * best-effort nudge on top of it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Notification {
    String id;
    String recipientId;
    String senderId;
    NotificationType type;
    String title;
    String message;
    NotificationPriority priority;
    DeliveryMethod deliveryMethod;
    NotificationStatus status;
    Map<String, Object> metadata;
    boolean read;
    Instant readAt;
    Instant createdAt;
    Instant updatedAt;
}
