package io.sendflow.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

/**
 * Evaluates cron recurrence rules.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field Unix cron: "minute hour day-of-month month day-of-week", numeric days of week
 *       0-7 with 0 and 7 meaning Sunday</li>
 *   <li>6-field cron with a leading seconds field, passed to Quartz as is</li>
 * </ul>
 * <p>
 * Note: Quartz does not support restricting both day-of-month and day-of-week at once.
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    /**
     * Translate a 5- or 6-field expression into Quartz syntax.
     * - 5-field input gets a "0" seconds field and Unix day-of-week numbering is mapped to Quartz (1 = Sunday).
     * - Whichever of day-of-month / day-of-week is unrestricted becomes "?".
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], unixDaysOfWeekToQuartz(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + expression);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dow) || "?".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom) || "?".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String unixDaysOfWeekToQuartz(String field) {
        List<String> mapped = new ArrayList<>();
        for (String item : field.split(",")) {
            String range = item;
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = item.substring(slash);
            }

            String[] bounds = range.split("-", -1);
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < bounds.length; i++) {
                if (i > 0) {
                    out.append('-');
                }
                out.append(mapDay(bounds[i]));
            }
            if (step != null) {
                out.append(step);
            }
            mapped.add(out.toString());
        }
        return String.join(",", mapped);
    }

    private static String mapDay(String token) {
        if (!token.matches("^\\d+$")) {
            return token;
        }
        int day = Integer.parseInt(token);
        if (day > 7) {
            return token;
        }
        return Integer.toString(day % 7 + 1);
    }

    /**
     * Returns true if the string is a 5- or 6-field expression Quartz accepts.
     */
    public static boolean isValid(String expression) {
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * First occurrence strictly after {@code from}, or {@code null} when the rule never fires again.
     *
     * @param zone zone the rule's wall-clock fields are evaluated in
     */
    public static Instant nextAfter(String expression, ZoneId zone, Instant from) {
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }
        CronExpression exp = parse(expression);
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        return next == null ? null : next.toInstant();
    }

    /**
     * Advance a recurring schedule after it fired.
     *
     * <p>The next occurrence follows {@code previousNextRunAt} on the rule's cadence. When the
     * evaluation was late enough that this occurrence already passed, missed occurrences are
     * skipped and the first one after {@code evaluatedAt} is returned instead.
     *
     * @return next scheduled run time, or {@code null} when the rule never fires again
     */
    public static Instant computeNextRunAt(String expression, ZoneId zone, Instant previousNextRunAt, Instant evaluatedAt) {
        if (evaluatedAt == null) {
            throw new IllegalArgumentException("evaluatedAt must not be null");
        }
        Instant base = previousNextRunAt != null ? previousNextRunAt : evaluatedAt;

        Instant next = nextAfter(expression, zone, base);
        if (next != null && !next.isAfter(evaluatedAt)) {
            next = nextAfter(expression, zone, evaluatedAt);
        }
        return next;
    }

    private static CronExpression parse(String expression) {
        String cron = normalizeCron(expression);
        try {
            return new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, ex);
        }
    }
}
