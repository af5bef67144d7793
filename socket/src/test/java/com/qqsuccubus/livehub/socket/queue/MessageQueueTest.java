package com.qqsuccubus.livehub.socket.queue;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.core.msg.MessageType;
import com.qqsuccubus.livehub.core.msg.Target;
import com.qqsuccubus.livehub.socket.broadcast.IBroadcastRouter;
import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageQueueTest {

    private static final Duration FLUSH_INTERVAL = Duration.ofSeconds(1);

    private VirtualTimeScheduler scheduler;
    private TestBroadcastRouter router;
    private MetricsService metrics;
    private MessageQueue queue;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        router = new TestBroadcastRouter();
        metrics = TestConfigs.metrics();
        queue = new MessageQueue(router, FLUSH_INTERVAL, 0, scheduler, metrics);
    }

    @AfterEach
    void tearDown() {
        queue.stop();
        scheduler.dispose();
    }

    @Test
    @DisplayName("Flush broadcasts in enqueue order and empties the queue")
    void flushInOrder() {
        String first = queue.enqueue(message("first"));
        String second = queue.enqueue(message("second"));
        String third = queue.enqueue(message("third"));

        assertEquals(3, queue.flush());

        assertEquals(List.of(first, second, third), router.broadcastIds());
        assertEquals(0, queue.size());
        assertEquals(0, queue.flush());
    }

    @Test
    @DisplayName("Enqueue assigns id and timestamp to bare messages")
    void enqueueAssignsDefaults() {
        String id = queue.enqueue(BroadcastMessage.builder().type(MessageType.SESSION_END).build());

        BroadcastMessage pending = queue.pending().get(0);
        assertEquals(id, pending.getId());
        assertNotNull(pending.getTimestamp());
    }

    @Test
    @DisplayName("Failed broadcasts are re-queued and nothing is lost")
    void failedBroadcastsRequeued() {
        // Given
        queue.enqueue(message("a"));
        queue.enqueue(message("b"));
        router.failing = true;

        // When
        int processed = queue.flush();

        // Then
        assertEquals(0, processed);
        assertEquals(2, queue.size());

        router.failing = false;
        assertEquals(2, queue.flush());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Without a cap a failing message is retried on every flush")
    void unlimitedRetries() {
        queue.enqueue(message("stuck"));
        router.failing = true;

        for (int i = 0; i < 10; i++) {
            queue.flush();
        }

        assertEquals(1, queue.size());
        assertEquals(10, router.attempts);
    }

    @Test
    @DisplayName("Retry cap drops a message after the configured failures")
    void retryCapDrops() {
        MessageQueue capped = new MessageQueue(router, FLUSH_INTERVAL, 3, scheduler, metrics);
        capped.enqueue(message("doomed"));
        router.failing = true;

        capped.flush();
        capped.flush();
        assertEquals(1, capped.size());

        capped.flush();
        assertEquals(0, capped.size());
        assertEquals(3, router.attempts);
    }

    @Test
    @DisplayName("Messages enqueued during a flush wait for the next flush")
    void enqueueDuringFlush() {
        queue.enqueue(message("outer"));
        router.onBroadcast = () -> queue.enqueue(message("inner"));

        assertEquals(1, queue.flush());
        assertEquals(1, queue.size());
        assertEquals("inner", ((Map<?, ?>) queue.pending().get(0).getData()).get("name"));
    }

    @Test
    @DisplayName("Concurrent enqueues are all kept")
    void concurrentEnqueue() throws InterruptedException {
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        queue.enqueue(message("m"));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, queue.size());
        assertEquals(threads * perThread, queue.flush());
    }

    @Test
    @DisplayName("Timer flushes once per interval")
    void timerFlushes() {
        queue.start();
        assertTrue(queue.isRunning());
        queue.enqueue(message("a"));

        scheduler.advanceTimeBy(FLUSH_INTERVAL);
        assertEquals(1, router.broadcastIds().size());

        queue.enqueue(message("b"));
        queue.stop();
        scheduler.advanceTimeBy(FLUSH_INTERVAL.multipliedBy(5));
        assertFalse(queue.isRunning());
        assertEquals(1, queue.size());
    }

    @Test
    @DisplayName("Messages failing in a flush that overlaps clear are not re-queued")
    void clearDuringFlushWins() throws InterruptedException {
        // Given a flush parked inside broadcast
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        router.onBroadcast = () -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("simulated broadcast failure");
        };
        queue.enqueue(message("in-flight"));
        Thread flusher = new Thread(queue::flush);
        flusher.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When the queue is stopped and cleared before the broadcast fails
        queue.stop();
        queue.clear();
        release.countDown();
        flusher.join(5_000);

        // Then
        assertFalse(flusher.isAlive());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Clear discards buffered messages")
    void clearDiscards() {
        queue.enqueue(message("a"));
        queue.enqueue(message("b"));

        assertEquals(2, queue.clear());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void invalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> new MessageQueue(router, Duration.ZERO, 0, scheduler, metrics));
        assertThrows(IllegalArgumentException.class,
            () -> new MessageQueue(router, FLUSH_INTERVAL, -1, scheduler, metrics));
    }

    private static BroadcastMessage message(String name) {
        return BroadcastMessage.of(MessageType.EVENT_UPDATE, Map.of("name", name), Target.all());
    }

    /**
     * Router stub recording broadcasts, optionally failing every call.
     */
    private static class TestBroadcastRouter implements IBroadcastRouter {
        private final List<BroadcastMessage> broadcasts = new CopyOnWriteArrayList<>();
        private volatile boolean failing;
        private volatile Runnable onBroadcast;
        private int attempts;

        @Override
        public List<Connection> resolve(Target target) {
            return List.of();
        }

        @Override
        public boolean send(String connectionId, BroadcastMessage message) {
            return false;
        }

        @Override
        public int broadcast(BroadcastMessage message, Target target) {
            attempts++;
            if (failing) {
                throw new IllegalStateException("simulated broadcast failure");
            }
            Runnable hook = onBroadcast;
            if (hook != null) {
                onBroadcast = null;
                hook.run();
            }
            broadcasts.add(message);
            return 1;
        }

        List<String> broadcastIds() {
            return broadcasts.stream().map(BroadcastMessage::getId).collect(Collectors.toList());
        }
    }
}
