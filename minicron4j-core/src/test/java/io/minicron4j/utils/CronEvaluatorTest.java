package io.minicron4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronEvaluatorTest {

    // 2026-01-05 is a Monday
    private static final ZonedDateTime MONDAY_0900 = at("2026-01-05T09:00:00Z");

    @Test
    void presetsShouldReturnFixedIntervals() {
        assertEquals(3_600_000L, CronEvaluator.untilNext("@hourly", MONDAY_0900).toMillis());
        assertEquals(86_400_000L, CronEvaluator.untilNext("@daily", MONDAY_0900).toMillis());
        assertEquals(604_800_000L, CronEvaluator.untilNext("@weekly", MONDAY_0900).toMillis());
    }

    @Test
    void presetsShouldNotDependOnWallClock() {
        ZonedDateTime odd = at("2026-03-17T13:47:12.345Z");
        assertEquals(Duration.ofHours(1), CronEvaluator.untilNext("@hourly", odd));
    }

    @Test
    void weekdayCronBeforeTimeShouldFireSameDay() {
        Duration d = CronEvaluator.untilNext("30 9 * * 1", MONDAY_0900);
        assertEquals(Duration.ofMinutes(30), d);
    }

    @Test
    void weekdayCronAfterTimeShouldFireNextWeek() {
        Duration d = CronEvaluator.untilNext("30 9 * * 1", at("2026-01-05T09:30:01Z"));
        assertEquals(at("2026-01-12T09:30:00Z").toInstant(),
                at("2026-01-05T09:30:01Z").plus(d).toInstant());
    }

    @Test
    void weekdayCronAtExactTimeShouldFireNextWeek() {
        Duration d = CronEvaluator.untilNext("30 9 * * 1", at("2026-01-05T09:30:00Z"));
        assertEquals(Duration.ofDays(7), d);
    }

    @Test
    void weekdayCronShouldAdvanceToLaterWeekday() {
        // Monday 09:00 -> Wednesday 08:15
        Duration d = CronEvaluator.untilNext("15 8 * * 3", MONDAY_0900);
        assertEquals(Duration.ofDays(2).minusMinutes(45), d);
    }

    @Test
    void sundayShouldBeZero() {
        // Monday -> next Sunday 10:00
        Duration d = CronEvaluator.untilNext("0 10 * * 0", MONDAY_0900);
        assertEquals(Duration.ofDays(6).plusHours(1), d);
    }

    @Test
    void dailyCronShouldRollToTomorrowOncePassed() {
        assertEquals(Duration.ofHours(8), CronEvaluator.untilNext("0 17 * * *", MONDAY_0900));
        assertEquals(Duration.ofHours(23), CronEvaluator.untilNext("0 8 * * *", MONDAY_0900));
    }

    @Test
    void dailyCronShouldIgnoreSecondsOfNow() {
        Duration d = CronEvaluator.untilNext("1 9 * * *", at("2026-01-05T09:00:30.500Z"));
        assertEquals(Duration.ofMillis(29_500), d);
    }

    @Test
    void minuteOnlyCronShouldFireWithinCurrentOrNextHour() {
        assertEquals(Duration.ofMinutes(20), CronEvaluator.untilNext("20 * * * *", MONDAY_0900));
        assertEquals(Duration.ofMinutes(55), CronEvaluator.untilNext("5 * * * *", at("2026-01-05T09:10:00Z")));
    }

    @Test
    void wildcardMinuteAndHourShouldFallBackToOneHour() {
        assertEquals(Duration.ofHours(1), CronEvaluator.untilNext("* * * * *", MONDAY_0900));
        assertEquals(Duration.ofHours(1), CronEvaluator.untilNext("* 9 * * *", MONDAY_0900));
    }

    @Test
    void dayOfMonthAndMonthShouldBeIgnored() {
        assertEquals(
                CronEvaluator.untilNext("0 17 * * *", MONDAY_0900),
                CronEvaluator.untilNext("0 17 31 2 *", MONDAY_0900)
        );
        assertEquals(
                CronEvaluator.untilNext("0 17 * * *", MONDAY_0900),
                CronEvaluator.untilNext("0 17 1-15 */2 *", MONDAY_0900)
        );
    }

    @Test
    void malformedCronShouldBeUnschedulable() {
        assertNull(CronEvaluator.untilNext("* * *", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("0 0 0 * * *", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("@monthly", MONDAY_0900));
        assertNull(CronEvaluator.untilNext(null, MONDAY_0900));
    }

    @Test
    void unsupportedFieldSyntaxShouldBeUnschedulable() {
        assertNull(CronEvaluator.untilNext("*/5 * * * *", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("0 9 * * 1-5", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("60 9 * * *", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("0 24 * * *", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("0 9 * * 7", MONDAY_0900));
        assertNull(CronEvaluator.untilNext("abc 9 * * *", MONDAY_0900));
    }

    @Test
    void nullNowShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronEvaluator.untilNext("@daily", (ZonedDateTime) null));
    }

    @Test
    void looksLikeCronShouldRecognizeStandardSyntax() {
        assertTrue(CronEvaluator.looksLikeCron("@weekly"));
        assertTrue(CronEvaluator.looksLikeCron("30 9 * * 1"));
        assertTrue(CronEvaluator.looksLikeCron("*/5 * * * *"));
        assertTrue(CronEvaluator.looksLikeCron("0 9 * * 1-5"));
        assertFalse(CronEvaluator.looksLikeCron("* * *"));
        assertFalse(CronEvaluator.looksLikeCron("every day"));
    }

    @Test
    void toQuartzCronShouldShiftWeekdays() {
        assertEquals("0 30 9 ? * 2", CronEvaluator.toQuartzCron("30 9 * * 1"));
        assertEquals("0 0 9 ? * 2-6", CronEvaluator.toQuartzCron("0 9 * * 1-5"));
        assertEquals("0 */5 * * * ?", CronEvaluator.toQuartzCron("*/5 * * * *"));
    }

    private static ZonedDateTime at(String instant) {
        return ZonedDateTime.parse(instant).withZoneSameInstant(ZoneOffset.UTC);
    }
}
