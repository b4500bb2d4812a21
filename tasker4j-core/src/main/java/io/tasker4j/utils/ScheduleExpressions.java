package io.tasker4j.utils;

import org.quartz.CronExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses recurring-job schedule expressions.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Fixed intervals: "every 30s", "@every 5m", "@every 1 hour 30 minutes", "@hourly"</li>
 *   <li>Macros: "@daily", "@midnight", "@weekly", "@monthly", "@yearly", "@annually"</li>
 *   <li>5-field Unix cron (minute hour day-of-month month day-of-week)</li>
 *   <li>6/7-field Quartz cron (seconds first)</li>
 * </ul>
 * <p>
 * Note: {@link #normalize(String)} rewrites the coarse step forms "0/N" in the minute or hour field
 * into fixed intervals, so "0/15 * * * *" runs every 15 minutes from startup rather than on the quarter hour.
 */
public final class ScheduleExpressions {

    public static final String EVERY_PREFIX = "@every ";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ZERO_STEP = Pattern.compile("^0/([1-9][0-9]*)$");
    private static final Pattern UNIX_DOW_NUMBER = Pattern.compile("(?<![/#\\d])\\d+");

    private static final Pattern INTERVAL_TOKEN = Pattern.compile("\\s*(\\d+)\\s*([a-z]+)\\s*");

    private static final Map<String, Long> UNIT_SECONDS = Map.ofEntries(
            Map.entry("s", 1L), Map.entry("sec", 1L), Map.entry("second", 1L), Map.entry("seconds", 1L),
            Map.entry("m", 60L), Map.entry("min", 60L), Map.entry("minute", 60L), Map.entry("minutes", 60L),
            Map.entry("h", 3600L), Map.entry("hour", 3600L), Map.entry("hours", 3600L),
            Map.entry("d", 86400L), Map.entry("day", 86400L), Map.entry("days", 86400L),
            Map.entry("w", 604800L), Map.entry("week", 604800L), Map.entry("weeks", 604800L)
    );

    private static final Map<Long, String> UNIT_SECONDS_CANONICAL = Map.of(
            1L, "second", 60L, "minute", 3600L, "hour", 86400L, "day", 604800L, "week"
    );

    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *"
    );

    private ScheduleExpressions() {
    }

    /**
     * Normalizes a raw expression into either {@code "@every <duration>"} or a cron expression.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String expr = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        if (expr.startsWith("every")) {
            return "@" + expr;
        }
        if (expr.startsWith("@hourly")) {
            return "@every 1h";
        }
        String macro = MACROS.get(expr);
        if (macro != null) {
            return macro;
        }
        if (expr.startsWith("@")) {
            return expr;
        }

        List<String> parts = new ArrayList<>(Arrays.asList(expr.split(" ")));
        while (parts.size() < 5) {
            parts.add("*");
        }

        if (parts.size() == 5) {
            Matcher minuteStep = ZERO_STEP.matcher(parts.get(0));
            if (minuteStep.matches()) {
                return EVERY_PREFIX + minuteStep.group(1) + "m";
            }
            Matcher hourStep = ZERO_STEP.matcher(parts.get(1));
            if (hourStep.matches()) {
                return EVERY_PREFIX + hourStep.group(1) + "h";
            }
        }

        return String.join(" ", parts);
    }

    public static boolean isInterval(String normalized) {
        return normalized != null && normalized.startsWith(EVERY_PREFIX);
    }

    /**
     * Extracts the period of a normalized {@code "@every <duration>"} expression.
     */
    public static long intervalSeconds(String normalized) {
        if (!isInterval(normalized)) {
            throw new IllegalArgumentException("Not an interval expression: " + normalized);
        }
        long seconds = parseIntervalBody(normalized.substring(EVERY_PREFIX.length()));
        if (seconds <= 0) {
            throw new IllegalArgumentException("Interval must be at least one second: " + normalized);
        }
        return seconds;
    }

    /**
     * Converts a cron expression into Quartz syntax.
     * - 5-field Unix cron: prepends seconds "0", shifts numeric day-of-week (0-7, Sunday=0/7) to Quartz (1-7, Sunday=1)
     *   and puts "?" into whichever day field is unrestricted.
     * - 6/7-field Quartz cron: only fills in "?" when both day fields are "*".
     */
    public static String toQuartzCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = WHITESPACE.split(s);
        if (parts.length == 5) {
            String dow = shiftDayOfWeek(parts[4]);
            return quartzDays("0", parts[0], parts[1], parts[2], parts[3], dow);
        }
        if (parts.length == 6 || parts.length == 7) {
            String dom = parts[3];
            String dow = parts[5];
            if ("*".equals(dom) && "*".equals(dow)) {
                dow = "?";
            }
            List<String> out = new ArrayList<>(Arrays.asList(parts));
            out.set(3, dom);
            out.set(5, dow);
            return String.join(" ", out);
        }
        return s;
    }

    private static String quartzDays(String sec, String min, String hour, String dom, String month, String dow) {
        String d1 = dom;
        String d2 = dow;

        if ("*".equals(d2) || "?".equals(d2)) {
            d2 = "?";
        } else if ("*".equals(d1) || "?".equals(d1)) {
            d1 = "?";
        } else {
            throw new IllegalArgumentException(
                    "Restricting both day-of-month and day-of-week is not supported: " + dom + " " + dow);
        }

        return String.join(" ", sec, min, hour, d1, month, d2);
    }

    private static String shiftDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        Matcher m = UNIX_DOW_NUMBER.matcher(field);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int unix = Integer.parseInt(m.group());
            if (unix > 7) {
                throw new IllegalArgumentException("Invalid day-of-week: " + field);
            }
            m.appendReplacement(sb, Integer.toString((unix % 7) + 1));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String expression) {
        try {
            return CronExpression.isValidExpression(toQuartzCron(expression));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Parses the body of an {@code "@every"} expression. The body is a sequence of amount/unit pairs, written
     * compact ("1h30m") or spelled out ("1 hour 30 minutes"). A bare number counts as seconds. Each unit may
     * appear once.
     */
    static long parseIntervalBody(String body) {
        String s = body.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("interval must not be empty");
        }
        if (s.chars().allMatch(Character::isDigit)) {
            return parseAmount(s);
        }

        Matcher m = INTERVAL_TOKEN.matcher(s);
        Set<String> seen = new HashSet<>();
        long total = 0;
        int pos = 0;
        while (m.find()) {
            if (m.start() != pos) {
                throw new IllegalArgumentException("Unexpected text in interval: " + s.substring(pos, m.start()));
            }
            String unit = m.group(2);
            Long unitSeconds = UNIT_SECONDS.get(unit);
            if (unitSeconds == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + unit);
            }
            String canonical = UNIT_SECONDS_CANONICAL.get(unitSeconds);
            if (!seen.add(canonical)) {
                throw new IllegalArgumentException("Duplicate interval unit: " + canonical);
            }
            try {
                total = Math.addExact(total, Math.multiplyExact(parseAmount(m.group(1)), unitSeconds));
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Interval out of range: " + s);
            }
            pos = m.end();
        }
        if (pos != s.length() || seen.isEmpty()) {
            throw new IllegalArgumentException("Invalid interval: " + s);
        }
        return total;
    }

    private static long parseAmount(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Interval amount out of range: " + digits);
        }
    }
}
