package io.tasker4j.internal;

import io.tasker4j.core.JobSchedule;
import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.core.ScheduleCalculator;
import io.tasker4j.utils.ScheduleExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns discovered {@code (jobClass, expression)} pairs into recurring job descriptors.
 *
 * <p>Entries with a blank class or an unusable expression are skipped with a warning.
 */
public class RecurringJobDiscovery {
    private static final Logger log = LoggerFactory.getLogger(RecurringJobDiscovery.class);

    private final ScheduleCalculator calculator;
    private final Clock clock;

    public RecurringJobDiscovery(ScheduleCalculator calculator, Clock clock) {
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<RecurringJobDescriptor> discover(List<JobSchedule> schedules) {
        if (schedules == null || schedules.isEmpty()) {
            return List.of();
        }

        long now = clock.instant().getEpochSecond();
        List<RecurringJobDescriptor> out = new ArrayList<>(schedules.size());
        for (JobSchedule schedule : schedules) {
            try {
                out.add(describe(schedule, now));
            } catch (RuntimeException e) {
                log.warn("tasker skipped recurring job jobClass={} expression={} msg={}",
                        schedule == null ? null : schedule.jobClass(),
                        schedule == null ? null : schedule.expression(),
                        e.getMessage());
            }
        }
        return out;
    }

    private RecurringJobDescriptor describe(JobSchedule schedule, long now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        String expr = ScheduleExpressions.normalize(schedule.expression());

        if (ScheduleExpressions.isInterval(expr)) {
            return RecurringJobDescriptor.interval(schedule.jobClass(), ScheduleExpressions.intervalSeconds(expr));
        }

        List<Long> window = calculator.nextWindow(expr, now);
        if (window.isEmpty()) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + expr);
        }
        return RecurringJobDescriptor.cron(schedule.jobClass(), expr, window);
    }
}
