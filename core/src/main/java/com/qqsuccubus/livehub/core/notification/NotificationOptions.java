package com.qqsuccubus.livehub.core.notification;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Optional attributes of a real-time notification. Unset values fall back to
 * sender {@code system}, type {@code announcement} and priority {@code normal}.
 */
@Value
@Builder(toBuilder = true)
public class NotificationOptions {
    public static final String SYSTEM_SENDER = "system";

    String senderId;
    NotificationType type;
    NotificationPriority priority;
    Map<String, Object> metadata;

    public static NotificationOptions defaults() {
        return NotificationOptions.builder().build();
    }

    public String senderOrDefault() {
        return senderId != null ? senderId : SYSTEM_SENDER;
    }

    public NotificationType typeOrDefault() {
        return type != null ? type : NotificationType.ANNOUNCEMENT;
    }

    public NotificationPriority priorityOrDefault() {
        return priority != null ? priority : NotificationPriority.NORMAL;
    }

    /**
     * Push metadata: sound and vibration enabled, caller fields copied under
     * {@code customFields} and also merged at top level (caller keys win).
     */
    public Map<String, Object> resolvedMetadata() {
        Map<String, Object> resolved = new HashMap<>();
        resolved.put("soundEnabled", true);
        resolved.put("vibrationEnabled", true);
        // Values are opaque and may be null
        resolved.put("customFields", metadata != null
            ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of());
        if (metadata != null) {
            resolved.putAll(metadata);
        }
        return resolved;
    }
}
