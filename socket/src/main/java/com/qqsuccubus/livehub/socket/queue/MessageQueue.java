package com.qqsuccubus.livehub.socket.queue;

import com.qqsuccubus.livehub.core.msg.BroadcastMessage;
import com.qqsuccubus.livehub.socket.broadcast.IBroadcastRouter;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Buffers messages for deferred broadcast and delivers them on flush.
 * <p>
 * {@link #flush()} swaps the buffer out in one step, so enqueues arriving during a flush
 * land in the fresh buffer. A message whose broadcast throws is appended to the fresh
 * buffer and retried on the next flush. With {@code maxDeliveryAttempts == 0} a message is
 * retried on every flush forever; a positive value drops the message once it has failed
 * that many times.
 * </p>
 */
public class MessageQueue {
    private static final Logger log = LoggerFactory.getLogger(MessageQueue.class);

    private final IBroadcastRouter router;
    private final Duration flushInterval;
    private final int maxDeliveryAttempts;
    private final Scheduler scheduler;
    private final MetricsService metricsService;

    private final Object bufferLock = new Object();
    private List<QueuedMessage> buffer = new ArrayList<>();   // guarded by bufferLock
    private long generation;                                  // bumped by clear(), guarded by bufferLock

    // One flush pass at a time; enqueue never takes this lock
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicReference<Disposable> task = new AtomicReference<>();

    /**
     * @param router              router used to broadcast flushed messages
     * @param flushInterval       time between scheduled flushes, must be positive
     * @param maxDeliveryAttempts failed attempts after which a message is dropped, 0 for no limit
     * @param scheduler           scheduler driving the flush timer
     * @param metricsService      metrics sink
     */
    public MessageQueue(IBroadcastRouter router, Duration flushInterval, int maxDeliveryAttempts,
                        Scheduler scheduler, MetricsService metricsService) {
        this.router = Objects.requireNonNull(router, "router");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("Flush interval must be positive, got " + flushInterval);
        }
        if (maxDeliveryAttempts < 0) {
            throw new IllegalArgumentException("maxDeliveryAttempts must be >= 0, got " + maxDeliveryAttempts);
        }
        this.flushInterval = flushInterval;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    /**
     * Appends a message to the buffer, assigning an id and timestamp if absent.
     *
     * @return the message id
     */
    public String enqueue(BroadcastMessage message) {
        BroadcastMessage stamped = Objects.requireNonNull(message, "message").withDefaults();
        synchronized (bufferLock) {
            buffer.add(new QueuedMessage(stamped));
        }
        log.debug("Queued message {} ({})", stamped.getId(), stamped.getType());
        return stamped.getId();
    }

    /**
     * Broadcasts every buffered message in enqueue order.
     *
     * @return number of messages whose broadcast completed
     */
    public int flush() {
        flushLock.lock();
        try {
            List<QueuedMessage> batch;
            long batchGeneration;
            synchronized (bufferLock) {
                if (buffer.isEmpty()) {
                    return 0;
                }
                batch = buffer;
                batchGeneration = generation;
                buffer = new ArrayList<>();
            }

            int processed = 0;
            int requeued = 0;
            for (QueuedMessage queued : batch) {
                BroadcastMessage message = queued.message;
                try {
                    router.broadcast(message, message.getTarget());
                    processed++;
                } catch (RuntimeException e) {
                    queued.attempts++;
                    if (maxDeliveryAttempts > 0 && queued.attempts >= maxDeliveryAttempts) {
                        log.warn("Dropping message {} after {} failed attempts", message.getId(), queued.attempts, e);
                        metricsService.recordDropped();
                        continue;
                    }
                    if (!requeue(queued, batchGeneration)) {
                        log.debug("Queue cleared during flush, not re-queuing message {}", message.getId());
                        continue;
                    }
                    log.warn("Broadcast of queued message {} failed (attempt {}), re-queued: {}",
                        message.getId(), queued.attempts, e.getMessage());
                    metricsService.recordRequeued();
                    requeued++;
                }
            }

            log.debug("Flushed {} queued messages ({} re-queued)", processed, requeued);
            return processed;
        } finally {
            flushLock.unlock();
        }
    }

    private boolean requeue(QueuedMessage queued, long batchGeneration) {
        synchronized (bufferLock) {
            if (generation != batchGeneration) {
                return false;
            }
            buffer.add(queued);
            return true;
        }
    }

    public int size() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    /**
     * @return buffered messages in delivery order
     */
    public List<BroadcastMessage> pending() {
        synchronized (bufferLock) {
            return buffer.stream().map(queued -> queued.message).collect(Collectors.toList());
        }
    }

    /**
     * Discards every buffered message. Messages of a flush already in progress are not
     * re-queued afterwards, even if their broadcast fails.
     *
     * @return number of messages discarded
     */
    public int clear() {
        synchronized (bufferLock) {
            int discarded = buffer.size();
            buffer = new ArrayList<>();
            generation++;
            return discarded;
        }
    }

    public void start() {
        if (task.get() != null) {
            return;
        }
        Disposable flushes = Flux.interval(flushInterval, flushInterval, scheduler)
            .subscribe(
                tick -> runFlush(),
                err -> log.error("Queue flush timer terminated", err)
            );
        if (!task.compareAndSet(null, flushes)) {
            flushes.dispose();
            return;
        }
        log.info("Message queue flushing every {}", flushInterval);
    }

    public void stop() {
        Disposable flushes = task.getAndSet(null);
        if (flushes != null) {
            flushes.dispose();
            log.info("Message queue flush timer stopped");
        }
    }

    public boolean isRunning() {
        return task.get() != null;
    }

    private void runFlush() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Queue flush failed", e);
        }
    }

    private static final class QueuedMessage {
        private final BroadcastMessage message;
        private int attempts;

        private QueuedMessage(BroadcastMessage message) {
            this.message = message;
        }
    }
}
