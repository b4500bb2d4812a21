package io.tasker4j.internal;

import io.tasker4j.spi.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TickScheduler} over a {@link ScheduledExecutorService}.
 *
 * <p>A single-threaded executor makes every tick run on one thread, which is how the event-loop runtime
 * gets its cooperative scheduling. A tick that throws is logged and keeps its schedule.
 */
public class ExecutorTickScheduler implements TickScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTickScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorTickScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public Registration every(Duration period, Runnable tick) {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(tick, "tick must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration");
        }

        long millis = period.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                log.error("tasker tick failed period={} msg={}", period, e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);

        return () -> future.cancel(false);
    }
}
