package io.minicron4j.utils;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import org.quartz.CronExpression;

/**
 * Computes the delay until the next trigger of a simplified cron expression.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Presets: "@hourly", "@daily", "@weekly" (fixed intervals, not aligned to the clock)</li>
 *   <li>5-field cron "minute hour day-of-month month day-of-week" where only minute, hour and
 *       day-of-week (0-6, 0 = Sunday) are evaluated, and only as single numbers</li>
 * </ul>
 * <p>
 * Note: day-of-month and month are accepted in any form and ignored.
 */
public final class CronEvaluator {

    public static final String WILDCARD = "*";

    private static final Map<String, Duration> PRESETS = Map.of(
            "@hourly", Duration.ofHours(1),
            "@daily", Duration.ofDays(1),
            "@weekly", Duration.ofDays(7)
    );

    private static final Duration FALLBACK = Duration.ofHours(1);

    /** Marks a concrete field that is not a plain in-range number. */
    private static final int INVALID = -2;
    private static final int ANY = -1;

    private CronEvaluator() {
    }

    /**
     * Computes the delay from {@code now} until the next trigger.
     *
     * @param cron cron expression or preset
     * @param now  current time; its zone decides what "today" and "hour" mean
     * @return a non-negative delay, or {@code null} when the expression is unschedulable
     */
    public static Duration untilNext(String cron, ZonedDateTime now) {
        if (now == null) {
            throw new IllegalArgumentException("now must not be null");
        }
        if (cron == null) {
            return null;
        }

        String s = cron.trim();
        Duration preset = PRESETS.get(s);
        if (preset != null) {
            return preset;
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 5) {
            return null;
        }

        int minute = parseField(parts[0], 59);
        int hour = parseField(parts[1], 23);
        int dayOfWeek = parseField(parts[4], 6);
        if (minute == INVALID || hour == INVALID || dayOfWeek == INVALID) {
            return null;
        }

        ZonedDateTime target;
        if (minute != ANY && hour != ANY) {
            target = now.withHour(hour).withMinute(minute).truncatedTo(ChronoUnit.MINUTES);

            if (dayOfWeek != ANY) {
                int today = now.getDayOfWeek().getValue() % 7;
                int daysAhead = (dayOfWeek - today + 7) % 7;
                if (daysAhead == 0 && !target.isAfter(now)) {
                    daysAhead = 7;
                }
                target = target.plusDays(daysAhead);
            } else if (!target.isAfter(now)) {
                target = target.plusDays(1);
            }
        } else if (minute != ANY) {
            target = now.withMinute(minute).truncatedTo(ChronoUnit.MINUTES);
            if (!target.isAfter(now)) {
                target = target.plusHours(1);
            }
        } else {
            return FALLBACK;
        }

        return Duration.between(now, target);
    }

    /**
     * Convenience overload: "now" is taken from {@code clock}, in the clock's zone.
     */
    public static Duration untilNext(String cron, Clock clock) {
        return untilNext(cron, ZonedDateTime.now(clock));
    }

    public static boolean isPreset(String cron) {
        return cron != null && PRESETS.containsKey(cron.trim());
    }

    /**
     * Returns true if the expression is a preset or valid standard cron syntax, whether or not this
     * evaluator can schedule it.
     */
    public static boolean looksLikeCron(String cron) {
        if (isPreset(cron)) {
            return true;
        }
        try {
            return CronExpression.isValidExpression(toQuartzCron(cron));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Translate a 5-field expression into Quartz syntax: prepend seconds, and use "?" for the
     * day field Quartz requires to be unspecified. Quartz numbers weekdays 1-7 from Sunday.
     */
    static String toQuartzCron(String cron) {
        if (cron == null) {
            throw new IllegalArgumentException("cron must not be null");
        }
        String[] parts = cron.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException("Expected 5 fields: " + cron);
        }

        String dom = parts[2];
        String dow = parts[4];
        if (WILDCARD.equals(dow)) {
            dow = "?";
        } else {
            if (WILDCARD.equals(dom)) {
                dom = "?";
            }
            dow = shiftWeekdays(dow);
        }
        return String.join(" ", "0", parts[0], parts[1], dom, parts[3], dow);
    }

    private static String shiftWeekdays(String field) {
        StringBuilder out = new StringBuilder();
        StringBuilder digits = new StringBuilder();
        boolean afterSlash = false;
        for (char ch : (field + " ").toCharArray()) {
            if (Character.isDigit(ch)) {
                digits.append(ch);
                continue;
            }
            if (digits.length() > 0) {
                int n = Integer.parseInt(digits.toString());
                out.append(afterSlash ? n : (n % 7) + 1);
                digits.setLength(0);
            }
            afterSlash = ch == '/';
            if (ch != ' ') {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private static int parseField(String field, int max) {
        if (WILDCARD.equals(field)) {
            return ANY;
        }
        if (!field.matches("^\\d{1,2}$")) {
            return INVALID;
        }
        int n = Integer.parseInt(field);
        return n <= max ? n : INVALID;
    }
}
