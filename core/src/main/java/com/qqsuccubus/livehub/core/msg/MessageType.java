package com.qqsuccubus.livehub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of real-time messages pushed to connected clients.
 * <p>
 * Serialized using the lower snake case wire names ({@code event_update}, ...).
 * </p>
 */
public enum MessageType {
    EVENT_UPDATE,
    SESSION_START,
    SESSION_END,
    NOTIFICATION,
    CHAT_MESSAGE,
    ATTENDEE_JOIN,
    ATTENDEE_LEAVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
