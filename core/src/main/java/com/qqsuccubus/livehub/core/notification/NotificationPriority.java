package com.qqsuccubus.livehub.core.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency of a notification.
 */
public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationPriority fromWireName(String value) {
        return value == null ? null : NotificationPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
