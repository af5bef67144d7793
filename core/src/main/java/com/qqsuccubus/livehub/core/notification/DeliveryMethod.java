package com.qqsuccubus.livehub.core.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Channel a notification is meant to be delivered through.
 */
public enum DeliveryMethod {
    PUSH,
    EMAIL,
    SMS,
    IN_APP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeliveryMethod fromWireName(String value) {
        return value == null ? null : DeliveryMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
