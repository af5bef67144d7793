package com.qqsuccubus.livehub.core.notification;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a bulk notification send.
 */
@Value
@Builder(toBuilder = true)
public class NotificationRequest {
    String recipientId;
    String title;
    String message;
    @Builder.Default
    NotificationOptions options = NotificationOptions.defaults();
}
