package com.qqsuccubus.livehub.socket.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.core.notification.DeliveryMethod;
import com.qqsuccubus.livehub.core.notification.Notification;
import com.qqsuccubus.livehub.core.notification.NotificationOptions;
import com.qqsuccubus.livehub.core.notification.NotificationPriority;
import com.qqsuccubus.livehub.core.notification.NotificationRequest;
import com.qqsuccubus.livehub.core.notification.NotificationStatus;
import com.qqsuccubus.livehub.core.notification.NotificationType;
import com.qqsuccubus.livehub.core.util.JsonUtils;
import com.qqsuccubus.livehub.socket.broadcast.BroadcastRouter;
import com.qqsuccubus.livehub.socket.broadcast.IBroadcastRouter;
import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.support.TestConfigs;
import com.qqsuccubus.livehub.socket.support.TestTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationBridgeTest {

    private ConnectionRegistry registry;
    private InMemoryNotificationStore store;
    private MetricsService metrics;
    private NotificationBridge bridge;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(10);
        store = new InMemoryNotificationStore();
        metrics = TestConfigs.metrics();
        bridge = new NotificationBridge(store, new BroadcastRouter(registry, metrics), metrics);
    }

    @Test
    @DisplayName("Offline recipient still gets a persisted record")
    void offlineRecipientGetsRecord() {
        // Given no connection for u1

        // When
        Notification sent = bridge.sendRealtimeNotification("u1", "Welcome", "Hello there", null);

        // Then
        assertTrue(sent.getId().startsWith("notif_"));
        assertEquals(NotificationStatus.PENDING, sent.getStatus());
        assertEquals(DeliveryMethod.PUSH, sent.getDeliveryMethod());
        assertEquals("system", sent.getSenderId());
        assertEquals(NotificationType.ANNOUNCEMENT, sent.getType());
        assertEquals(NotificationPriority.NORMAL, sent.getPriority());
        assertEquals(true, sent.getMetadata().get("soundEnabled"));
        assertFalse(sent.isRead());
        assertEquals(sent, store.getById(sent.getId()).orElseThrow());
        assertEquals(0.0, metrics.getDeliveredCount());
    }

    @Test
    @DisplayName("Connected recipient receives the notification push, others do not")
    void connectedRecipientReceivesPush() {
        TestTransport recipient = new TestTransport();
        TestTransport bystander = new TestTransport();
        registry.add("c1", "u1", recipient, "e1", null);
        registry.add("c2", "u2", bystander, "e1", null);

        NotificationOptions options = NotificationOptions.builder()
            .senderId("organizer")
            .type(NotificationType.SESSION_REMINDER)
            .priority(NotificationPriority.HIGH)
            .build();
        Notification sent = bridge.sendRealtimeNotification("u1", "Reminder", "Starts in 5 minutes", options);

        assertEquals(1, recipient.getSent().size());
        assertTrue(bystander.getSent().isEmpty());

        JsonNode push = JsonUtils.readValue(recipient.getSent().get(0), JsonNode.class);
        assertEquals("notification", push.get("type").asText());
        assertEquals(sent.getId(), push.get("data").get("id").asText());
        assertEquals("session_reminder", push.get("data").get("type").asText());
        assertEquals("high", push.get("data").get("priority").asText());
        assertEquals("organizer", push.get("data").get("senderId").asText());
    }

    @Test
    @DisplayName("Invalid input is rejected before anything is stored")
    void validation() {
        assertThrows(IllegalArgumentException.class,
            () -> bridge.sendRealtimeNotification(" ", "t", "m", null));
        assertThrows(IllegalArgumentException.class,
            () -> bridge.sendRealtimeNotification("u1", "", "m", null));
        assertThrows(IllegalArgumentException.class,
            () -> bridge.sendRealtimeNotification("u1", "x".repeat(256), "m", null));
        assertThrows(IllegalArgumentException.class,
            () -> bridge.sendRealtimeNotification("u1", "t", "x".repeat(1001), null));

        assertEquals(0, bridge.unreadCount("u1"));
    }

    @Test
    @DisplayName("Push failure keeps the record")
    void pushFailureKeepsRecord() {
        NotificationBridge failingBridge = new NotificationBridge(store, new FailingRouter(), metrics);

        Notification sent = failingBridge.sendRealtimeNotification("u1", "t", "m", null);

        assertTrue(store.getById(sent.getId()).isPresent());
    }

    @Test
    @DisplayName("Metadata values may be null")
    void nullMetadataValues() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("link", null);
        metadata.put("eventId", "e1");
        TestTransport recipient = new TestTransport();
        registry.add("c1", "u1", recipient, null, null);

        Notification sent = bridge.sendRealtimeNotification("u1", "t", "m",
            NotificationOptions.builder().metadata(metadata).build());

        assertTrue(sent.getMetadata().containsKey("link"));
        assertNull(sent.getMetadata().get("link"));
        assertEquals("e1", sent.getMetadata().get("eventId"));
        assertTrue(((Map<?, ?>) sent.getMetadata().get("customFields")).containsKey("link"));
        assertEquals(1, recipient.getSent().size());
    }

    @Test
    @DisplayName("Bulk send stores one record per request in order")
    void bulkSend() {
        List<Notification> sent = bridge.sendBulk(List.of(
            NotificationRequest.builder().recipientId("u1").title("a").message("m").build(),
            NotificationRequest.builder().recipientId("u2").title("b").message("m")
                .options(NotificationOptions.builder().metadata(Map.of("k", "v")).build())
                .build()
        ));

        assertEquals(2, sent.size());
        assertEquals("u1", sent.get(0).getRecipientId());
        assertEquals("v", sent.get(1).getMetadata().get("k"));
        assertEquals(1, bridge.unreadCount("u1"));
        assertEquals(1, bridge.unreadCount("u2"));
    }

    @Test
    @DisplayName("Read state operations pass through to the store")
    void readStateOperations() {
        Notification first = bridge.sendRealtimeNotification("u1", "a", "m", null);
        bridge.sendRealtimeNotification("u1", "b", "m", null);

        assertTrue(bridge.markRead(first.getId()).isRead());
        assertEquals(1, bridge.unreadCount("u1"));
        assertEquals(1, bridge.markAllRead("u1"));
        assertEquals(2, bridge.listNotifications("u1", null).getTotal());
        assertTrue(bridge.deleteNotification(first.getId()));
        assertTrue(bridge.getNotification(first.getId()).isEmpty());
    }

    @Test
    @DisplayName("Store health failures make the bridge unhealthy")
    void health() {
        assertTrue(bridge.isHealthy());

        NotificationBridge broken = new NotificationBridge(new InMemoryNotificationStore() {
            @Override
            public boolean isHealthy() {
                throw new NotificationStoreException("store down");
            }
        }, new FailingRouter(), metrics);

        assertFalse(broken.isHealthy());
    }

    private static class FailingRouter implements IBroadcastRouter {
        @Override
        public List<Connection> resolve(Target target) {
            return List.of();
        }

        @Override
        public boolean send(String connectionId, BroadcastMessage message) {
            throw new IllegalStateException("router down");
        }

        @Override
        public int broadcast(BroadcastMessage message, Target target) {
            throw new IllegalStateException("router down");
        }
    }
}
