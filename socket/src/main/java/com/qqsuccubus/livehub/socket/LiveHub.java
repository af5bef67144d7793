package com.qqsuccubus.livehub.socket;

import com.qqsuccubus.livehub.core.model.ConnectionStats;
import com.qqsuccubus.livehub.core.model.HealthStatus;
import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.core.notification.Notification;
import com.qqsuccubus.livehub.core.notification.NotificationOptions;
import com.qqsuccubus.livehub.socket.broadcast.BroadcastRouter;
import com.qqsuccubus.livehub.socket.config.SocketConfig;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.connection.RemovalReason;
import com.qqsuccubus.livehub.socket.heartbeat.HeartbeatMonitor;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.notification.INotificationStore;
import com.qqsuccubus.livehub.socket.notification.NotificationBridge;
import com.qqsuccubus.livehub.socket.queue.MessageQueue;
import com.qqsuccubus.livehub.socket.stats.StatsCollector;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The real-time hub of one node: wires the connection registry, heartbeat monitor,
 * broadcast router, message queue, notification bridge and stats collector, and owns
 * their lifecycle.
 * <p>
 * Instances are constructed explicitly; nothing here is a process-wide singleton, so
 * tests can run any number of isolated hubs.
 * </p>
 */
public class LiveHub {
    private static final Logger log = LoggerFactory.getLogger(LiveHub.class);

    @Getter
    private final ConnectionRegistry registry;
    @Getter
    private final BroadcastRouter router;
    @Getter
    private final HeartbeatMonitor heartbeatMonitor;
    @Getter
    private final MessageQueue messageQueue;
    @Getter
    private final NotificationBridge notifications;
    @Getter
    private final StatsCollector statsCollector;
    @Getter
    private final MetricsService metricsService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public LiveHub(SocketConfig config, INotificationStore notificationStore, MetricsService metricsService,
                   Scheduler scheduler, Clock clock) {
        this.metricsService = metricsService;
        this.registry = new ConnectionRegistry(config.getMaxConnections(), clock);
        this.router = new BroadcastRouter(registry, metricsService);
        this.heartbeatMonitor = new HeartbeatMonitor(registry, config.getHeartbeatInterval(), scheduler, metricsService);
        this.messageQueue = new MessageQueue(router, config.getQueueFlushInterval(), config.getMaxDeliveryAttempts(),
                scheduler, metricsService);
        this.notifications = new NotificationBridge(notificationStore, router, metricsService);
        this.statsCollector = new StatsCollector(registry, messageQueue, clock);

        registry.addListener(metricsService);
        metricsService.bindGauges(registry::size, statsCollector::activeConnections, messageQueue::size);
    }

    /**
     * Starts the heartbeat and queue flush timers. Calling it again has no effect.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        statsCollector.markStarted();
        heartbeatMonitor.start();
        messageQueue.start();
        log.info("Live hub started (maxConnections={})", registry.getMaxConnections());
    }

    /**
     * Stops both timers, closes every connection and clears the queue.
     * Safe to call in any state, including before {@link #start()}.
     */
    public void stop() {
        boolean wasRunning = running.getAndSet(false);
        heartbeatMonitor.stop();
        messageQueue.stop();
        int closed = registry.closeAll(RemovalReason.SHUTDOWN);
        int discarded = messageQueue.clear();
        statsCollector.markStopped();
        if (wasRunning) {
            log.info("Live hub stopped ({} connections closed, {} queued messages discarded)", closed, discarded);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Broadcasts an event right away. Event ids carry the {@code evt_} prefix.
     *
     * @return number of connections reached
     */
    public int broadcastEvent(MessageType type, Object data, Target target) {
        BroadcastMessage message = BroadcastMessage.builder()
            .id(BroadcastMessage.generateId("evt"))
            .type(type)
            .data(data)
            .target(target)
            .build()
            .withDefaults();
        return router.broadcast(message, target);
    }

    /**
     * Queues an event for the next flush.
     *
     * @return message id
     */
    public String queueEvent(MessageType type, Object data, Target target) {
        return messageQueue.enqueue(BroadcastMessage.of(type, data, target));
    }

    public Notification sendRealtimeNotification(String recipientId, String title, String message,
                                                 NotificationOptions options) {
        return notifications.sendRealtimeNotification(recipientId, title, message, options);
    }

    public HealthStatus healthStatus() {
        return HealthStatus.of(isRunning(), notifications.isHealthy());
    }

    public ConnectionStats stats() {
        return statsCollector.snapshot();
    }
}
