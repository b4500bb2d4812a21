package io.tasker4j.core;

import io.tasker4j.utils.ScheduleExpressions;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes upcoming firing times of cron expressions.
 *
 * <p>Results are epoch seconds, strictly increasing and strictly after {@code from}. The computation is a
 * pure function of the expression, the zone and {@code from}, so an exhausted window can be refilled by
 * calling again with the current time.
 *
 * <p>Interval jobs are not handled here; they run on their own periodic timer.
 */
public class ScheduleCalculator {

    /**
     * Number of firing times precomputed per lookahead window.
     */
    public static final int WINDOW_SIZE = 100;

    private final ZoneId zone;

    public ScheduleCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public static ScheduleCalculator systemDefault() {
        return new ScheduleCalculator(ZoneId.systemDefault());
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Next {@link #WINDOW_SIZE} firing times after {@code from}.
     */
    public List<Long> nextWindow(String cronExpression, long from) {
        return nextOccurrences(cronExpression, from, WINDOW_SIZE);
    }

    /**
     * @param cronExpression 5-field Unix or 6/7-field Quartz cron
     * @param from           epoch seconds; every result is strictly greater
     * @param count          maximum number of results
     */
    public List<Long> nextOccurrences(String cronExpression, long from, int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }

        CronExpression exp = compile(cronExpression);
        List<Long> out = new ArrayList<>(count);
        Date cursor = new Date(from * 1000L);
        long last = from;
        while (out.size() < count) {
            Date next = exp.getNextValidTimeAfter(cursor);
            if (next == null) {
                break;
            }
            long ts = next.getTime() / 1000L;
            // zone transitions can map two wall-clock slots onto one instant
            if (ts > last) {
                out.add(ts);
                last = ts;
            }
            cursor = next;
        }
        return out;
    }

    /**
     * Validates an expression without computing anything.
     */
    public boolean isValid(String cronExpression) {
        try {
            compile(cronExpression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private CronExpression compile(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("cronExpression must not be blank");
        }
        String quartz = ScheduleExpressions.toQuartzCron(cronExpression);
        if (!CronExpression.isValidExpression(quartz)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression, ex);
        }
    }
}
