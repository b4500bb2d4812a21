package io.tasker4j.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Identifies a recurring job and its firing rule.
 *
 * <p>For {@link ScheduleMode#CRON_EXPRESSION} descriptors, {@code upcoming} is a lookahead cache of
 * future firing times (epoch seconds, strictly increasing). A {@code null} cache means "not computed yet";
 * an empty one means "exhausted". Both are refilled by the dispatch loop.
 *
 * <p>Immutable. The dispatch loop replaces the cache through {@link #withUpcoming(List)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecurringJobDescriptor(
        String jobClass,
        ScheduleMode mode,
        long intervalSeconds,
        String cronExpression,
        List<Long> upcoming
) {

    public RecurringJobDescriptor {
        Objects.requireNonNull(jobClass, "jobClass must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (jobClass.isBlank()) {
            throw new IllegalArgumentException("jobClass must not be blank");
        }

        if (mode == ScheduleMode.INTERVAL) {
            if (intervalSeconds <= 0) {
                throw new IllegalArgumentException("intervalSeconds must be positive for interval job: " + jobClass);
            }
            cronExpression = null;
            upcoming = null;
        } else {
            if (cronExpression == null || cronExpression.isBlank()) {
                throw new IllegalArgumentException("cronExpression must not be blank for cron job: " + jobClass);
            }
            intervalSeconds = 0;
            if (upcoming != null) {
                upcoming = List.copyOf(upcoming);
                requireStrictlyIncreasing(jobClass, upcoming);
            }
        }
    }

    public static RecurringJobDescriptor interval(String jobClass, long intervalSeconds) {
        return new RecurringJobDescriptor(jobClass, ScheduleMode.INTERVAL, intervalSeconds, null, null);
    }

    public static RecurringJobDescriptor cron(String jobClass, String cronExpression, List<Long> upcoming) {
        return new RecurringJobDescriptor(jobClass, ScheduleMode.CRON_EXPRESSION, 0, cronExpression, upcoming);
    }

    public boolean usesInterval() {
        return mode == ScheduleMode.INTERVAL;
    }

    public boolean usesCron() {
        return mode == ScheduleMode.CRON_EXPRESSION;
    }

    /**
     * True when the lookahead cache must be recomputed before it can be consulted.
     */
    public boolean needsRefill() {
        return usesCron() && (upcoming == null || upcoming.isEmpty());
    }

    public OptionalLong earliest() {
        if (upcoming == null || upcoming.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(upcoming.get(0));
    }

    public RecurringJobDescriptor withUpcoming(List<Long> newUpcoming) {
        if (!usesCron()) {
            throw new IllegalStateException("Interval job has no lookahead cache: " + jobClass);
        }
        return new RecurringJobDescriptor(jobClass, mode, 0, cronExpression, newUpcoming);
    }

    private static void requireStrictlyIncreasing(String jobClass, List<Long> timestamps) {
        Long previous = null;
        for (Long ts : timestamps) {
            Objects.requireNonNull(ts, "upcoming must not contain null");
            if (previous != null && ts <= previous) {
                throw new IllegalArgumentException("upcoming must be strictly increasing for job: " + jobClass);
            }
            previous = ts;
        }
    }
}
