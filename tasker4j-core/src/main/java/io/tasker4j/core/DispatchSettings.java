package io.tasker4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and batching knobs of the dispatch loop.
 *
 * @param immediateBatchCap maximum payloads popped from the immediate queue per drain tick
 * @param cronTick          period of the cron tick
 * @param queueTick         period of the immediate drain and the delayed sweep
 * @param delayedLookBack   how far back the delayed sweep queries
 * @param delayedLookAhead  how far ahead the delayed sweep queries
 * @param staleThreshold    due delayed entries older than this are removed without being executed
 */
public record DispatchSettings(
        int immediateBatchCap,
        Duration cronTick,
        Duration queueTick,
        Duration delayedLookBack,
        Duration delayedLookAhead,
        Duration staleThreshold
) {

    public static final int DEFAULT_IMMEDIATE_BATCH_CAP = 20;

    public DispatchSettings {
        if (immediateBatchCap <= 0) {
            throw new IllegalArgumentException("immediateBatchCap must be positive");
        }
        requirePositive(cronTick, "cronTick");
        requirePositive(queueTick, "queueTick");
        requireNotNegative(delayedLookBack, "delayedLookBack");
        requireNotNegative(delayedLookAhead, "delayedLookAhead");
        requireNotNegative(staleThreshold, "staleThreshold");
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(
                DEFAULT_IMMEDIATE_BATCH_CAP,
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofHours(1),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5)
        );
    }

    public DispatchSettings withQueueTick(Duration queueTick) {
        return new DispatchSettings(immediateBatchCap, cronTick, queueTick, delayedLookBack, delayedLookAhead, staleThreshold);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private static void requireNotNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
