package com.qqsuccubus.livehub.core.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery state of a notification record.
 */
public enum NotificationStatus {
    PENDING,
    SENT,
    DELIVERED,
    FAILED,
    READ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationStatus fromWireName(String value) {
        return value == null ? null : NotificationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
