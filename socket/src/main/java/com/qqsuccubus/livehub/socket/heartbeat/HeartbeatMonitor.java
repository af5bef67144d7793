package com.qqsuccubus.livehub.socket.heartbeat;

import com.qqsuccubus.livehub.socket.connection.Connection;
import com.qqsuccubus.livehub.socket.connection.ConnectionRegistry;
import com.qqsuccubus.livehub.socket.connection.HeartbeatState;
import com.qqsuccubus.livehub.socket.metrics.MetricsService;
import com.qqsuccubus.livehub.socket.transport.TransportException;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically probes every registered connection.
 * <p>
 * On each tick:
 * <ul>
 *   <li>a connection whose transport is no longer open is marked dead, no probe is sent</li>
 *   <li>otherwise a ping is sent; if the previous ping was never answered the connection
 *       becomes {@link HeartbeatState#STALE}</li>
 * </ul>
 * A pong (reported through {@link ConnectionRegistry#recordPong}) brings a connection back
 * to {@link HeartbeatState#ACTIVE}. The monitor never removes connections: removal happens
 * when a send to the connection fails, or when the socket reports its close.
 * </p>
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final ConnectionRegistry registry;
    private final Duration interval;
    private final Scheduler scheduler;
    private final MetricsService metricsService;
    private final AtomicReference<Disposable> task = new AtomicReference<>();

    /**
     * @param registry       connections to probe
     * @param interval       time between ticks, must be positive
     * @param scheduler      scheduler driving the ticks
     * @param metricsService metrics sink
     */
    public HeartbeatMonitor(ConnectionRegistry registry, Duration interval, Scheduler scheduler,
                            MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive, got " + interval);
        }
        this.interval = interval;
    }

    public void start() {
        if (task.get() != null) {
            return;
        }
        Disposable ticks = Flux.interval(interval, interval, scheduler)
            .subscribe(
                tick -> runTick(),
                err -> log.error("Heartbeat timer terminated", err)
            );
        if (!task.compareAndSet(null, ticks)) {
            ticks.dispose();
            return;
        }
        log.info("Heartbeat monitor started (interval={})", interval);
    }

    public void stop() {
        Disposable ticks = task.getAndSet(null);
        if (ticks != null) {
            ticks.dispose();
            log.info("Heartbeat monitor stopped");
        }
    }

    public boolean isRunning() {
        return task.get() != null;
    }

    private void runTick() {
        try {
            TickResult result = tick();
            log.debug("Heartbeat tick: {}", result);
        } catch (RuntimeException e) {
            log.error("Heartbeat tick failed", e);
        }
    }

    /**
     * Runs one probe round over a snapshot of the registry.
     *
     * @return counts of probed, stale and newly dead connections
     */
    public TickResult tick() {
        int probed = 0;
        int stale = 0;
        int dead = 0;

        for (Connection connection : registry.snapshot()) {
            if (!connection.transport().isOpen()) {
                if (registry.markDead(connection.getId())) {
                    dead++;
                    metricsService.recordHeartbeatDead();
                    log.debug("Connection {} transport closed, marked dead", connection.getId());
                }
                continue;
            }

            try {
                connection.transport().ping();
            } catch (TransportException e) {
                log.debug("Ping to connection {} failed: {}", connection.getId(), e.getMessage());
                dead += markDead(connection);
                continue;
            } catch (RuntimeException e) {
                log.warn("Unexpected ping failure on connection {}", connection.getId(), e);
                dead += markDead(connection);
                continue;
            }

            metricsService.recordHeartbeatProbe();
            probed++;
            Optional<HeartbeatState> state = registry.recordProbe(connection.getId());
            if (state.isPresent() && state.get() == HeartbeatState.STALE) {
                stale++;
            }
        }
        return new TickResult(probed, stale, dead);
    }

    private int markDead(Connection connection) {
        if (!registry.markDead(connection.getId())) {
            return 0;
        }
        metricsService.recordHeartbeatDead();
        return 1;
    }

    @Value
    public static class TickResult {
        int probed;
        int stale;
        int dead;
    }
}
