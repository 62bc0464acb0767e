package io.minicron4j.utils;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts human-friendly trigger times into cron expressions, and delays into short text.
 */
public final class ScheduleExpressions {

    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern RELATIVE =
            Pattern.compile("^in\\s+(\\d+)\\s*(m|min|h|hr|hour)s?$", Pattern.CASE_INSENSITIVE);

    private ScheduleExpressions() {
    }

    /**
     * Convert a trigger time into a cron expression.
     * <ul>
     *   <li>"17:00" becomes "0 17 * * *" (daily at that time)</li>
     *   <li>"in 30m", "in 2h", "in 1 hour" become the minute and hour of {@code now} plus the offset</li>
     *   <li>a 5-field expression is returned unchanged</li>
     * </ul>
     *
     * @return the cron expression, or {@code null} if {@code time} matches none of the formats
     */
    public static String toCron(String time, ZonedDateTime now) {
        if (time == null) {
            return null;
        }
        String s = time.trim();

        Matcher clock = CLOCK.matcher(s);
        if (clock.matches()) {
            int h = Integer.parseInt(clock.group(1));
            int m = Integer.parseInt(clock.group(2));
            if (h <= 23 && m <= 59) {
                return m + " " + h + " * * *";
            }
        }

        Matcher relative = RELATIVE.matcher(s);
        if (relative.matches()) {
            if (now == null) {
                throw new IllegalArgumentException("now must not be null for relative times");
            }
            long value = Long.parseLong(relative.group(1));
            String unit = relative.group(2).toLowerCase(Locale.ROOT);
            long minutes = unit.startsWith("h") ? value * 60 : value;
            ZonedDateTime target = now.plusMinutes(minutes);
            return target.getMinute() + " " + target.getHour() + " * * *";
        }

        if (s.split("\\s+").length == 5) {
            return s;
        }
        return null;
    }

    /**
     * Short description of a delay, e.g. "in 5 minutes", "in 2h 5m", "in 3 hours", "in 2 days".
     */
    public static String describe(Duration delay) {
        if (delay == null) {
            return "unknown";
        }
        long mins = Math.round(delay.toMillis() / 60_000.0);
        if (mins < 60) {
            return "in " + mins + " minutes";
        }
        long hrs = mins / 60;
        long remainMins = mins % 60;
        if (hrs < 24) {
            return remainMins > 0
                    ? "in " + hrs + "h " + remainMins + "m"
                    : "in " + hrs + " hours";
        }
        return "in " + (hrs / 24) + " days";
    }
}
