package kr.crownrpg.relay.core.heartbeat;

import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.lifecycle.ManagedLifecycle;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.connection.RemovalReason;
import kr.crownrpg.relay.core.internal.ThreadFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic liveness sweep over a {@link ConnectionRegistry}.
 * <p>
 * Each tick either evicts a connection whose flag is still cleared from the previous tick, or clears the flag and
 * sends a probe. An acknowledgment sets the flag again, so a connection survives one missed probe and is evicted on
 * the second consecutive one.
 */
public final class HeartbeatMonitor implements ManagedLifecycle {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final ConnectionRegistry registry;
    private final Duration interval;
    private final ScheduledExecutorService sharedScheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> task;

    public HeartbeatMonitor(ConnectionRegistry registry, Duration interval) {
        this(registry, interval, null);
    }

    /**
     * @param scheduler shared scheduler left running on {@link #stop()}; {@code null} makes the monitor create its own
     *                  thread on every {@link #start()} and shut it down on {@link #stop()}
     */
    public HeartbeatMonitor(ConnectionRegistry registry, Duration interval, ScheduledExecutorService scheduler) {
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.interval = Preconditions.checkNotNull(interval, "interval");
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(), "interval must be positive");
        this.sharedScheduler = scheduler;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService executor = sharedScheduler != null
                ? sharedScheduler
                : ThreadFactories.singleScheduler("relay-heartbeat");
        long periodMillis = interval.toMillis();
        try {
            task = executor.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            if (executor != sharedScheduler) {
                executor.shutdownNow();
            }
            started.set(false);
            throw e;
        }
        scheduler = executor;
        LOGGER.info("하트비트 감시를 시작합니다 (주기 {} ms)", periodMillis);
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
        task = null;
        ScheduledExecutorService executor = scheduler;
        scheduler = null;
        if (executor != null && executor != sharedScheduler) {
            executor.shutdownNow();
        }
        LOGGER.info("하트비트 감시를 종료합니다");
    }

    public boolean isStarted() {
        return started.get();
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Runs one tick synchronously. Sweeps never overlap.
     */
    public synchronized SweepResult sweep() {
        int probed = 0;
        int evicted = 0;
        for (Connection connection : registry.snapshot()) {
            if (!connection.clearAlive()) {
                evict(connection);
                evicted++;
                continue;
            }
            try {
                connection.transport().ping();
                probed++;
            } catch (RuntimeException e) {
                // left cleared; the next tick evicts it
                LOGGER.debug("Liveness probe to {} failed", connection.id(), e);
            }
        }
        if (evicted > 0) {
            LOGGER.info("하트비트 응답이 없는 연결 {}개를 정리했습니다 (probe {}개)", evicted, probed);
        }
        return new SweepResult(probed, evicted);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            LOGGER.warn("하트비트 감시 중 오류", e);
        }
    }

    private void evict(Connection connection) {
        LOGGER.info("Terminating dead connection: {}", connection.id());
        registry.remove(connection.id(), RemovalReason.LIVENESS_TIMEOUT);
        try {
            connection.transport().terminate();
        } catch (RuntimeException e) {
            LOGGER.debug("Terminate of {} failed; already evicted", connection.id(), e);
        }
    }

    public record SweepResult(int probed, int evicted) {
    }
}
