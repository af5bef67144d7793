package com.qqsuccubus.livehub.core.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a notification record.
 */
public enum NotificationType {
    EVENT_UPDATE,
    SESSION_REMINDER,
    NETWORKING_REQUEST,
    ANNOUNCEMENT,
    SYSTEM,
    REGISTRATION_CONFIRMATION,
    EVENT_STARTING,
    SESSION_STARTING,
    CONNECTION_ACCEPTED,
    MESSAGE_RECEIVED,
    FEEDBACK_REQUEST,
    EVENT_ENDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationType fromWireName(String value) {
        return value == null ? null : NotificationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
