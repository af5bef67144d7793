package com.qqsuccubus.livehub.core.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationOptionsTest {

    @Test
    @DisplayName("Defaults: system sender, announcement, normal priority")
    void defaults() {
        NotificationOptions options = NotificationOptions.defaults();

        assertEquals("system", options.senderOrDefault());
        assertEquals(NotificationType.ANNOUNCEMENT, options.typeOrDefault());
        assertEquals(NotificationPriority.NORMAL, options.priorityOrDefault());
    }

    @Test
    @DisplayName("Resolved metadata enables sound and vibration and keeps custom fields")
    void resolvedMetadata() {
        NotificationOptions options = NotificationOptions.builder()
            .metadata(Map.of("eventId", "e1", "soundEnabled", false))
            .build();

        Map<String, Object> metadata = options.resolvedMetadata();

        assertEquals(true, metadata.get("vibrationEnabled"));
        // Caller keys override the push defaults
        assertEquals(false, metadata.get("soundEnabled"));
        assertEquals("e1", metadata.get("eventId"));
        assertEquals(Map.of("eventId", "e1", "soundEnabled", false), metadata.get("customFields"));
    }

    @Test
    @DisplayName("Filter matches on read flag, type and priority")
    void filterMatches() {
        Notification unreadUrgent = Notification.builder()
            .type(NotificationType.SYSTEM)
            .priority(NotificationPriority.URGENT)
            .build();
        NotificationFilter unreadOnly = NotificationFilter.builder().read(false).build();
        NotificationFilter lowOnly = NotificationFilter.builder().priority(NotificationPriority.LOW).build();

        assertTrue(NotificationFilter.firstPage().matches(unreadUrgent));
        assertTrue(unreadOnly.matches(unreadUrgent));
        assertFalse(unreadOnly.matches(unreadUrgent.withRead(true)));
        assertFalse(lowOnly.matches(unreadUrgent));
        assertEquals(1, NotificationFilter.firstPage().getPage());
        assertEquals(20, NotificationFilter.firstPage().getLimit());
    }
}
