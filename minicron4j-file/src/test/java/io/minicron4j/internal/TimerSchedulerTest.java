package io.minicron4j.internal;

import io.minicron4j.core.Job;
import io.minicron4j.core.JobSpec;
import io.minicron4j.core.JobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimerSchedulerTest {

    private TimerScheduler timers;

    @AfterEach
    void tearDown() {
        if (timers != null) {
            timers.shutdown(Duration.ofSeconds(2));
        }
    }

    @Test
    void unschedulableCronShouldLeaveJobIdle() {
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1, job -> false);

        assertFalse(timers.arm(job("j1", "* * *")));
        assertFalse(timers.isArmed("j1"));
        assertEquals(JobState.IDLE, timers.state("j1"));
        assertEquals(0, timers.armedCount());
    }

    @Test
    void armingTwiceShouldKeepOneTimer() {
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1, job -> false);

        assertTrue(timers.arm(job("j1", "@daily")));
        assertTrue(timers.arm(job("j1", "@daily")));

        assertEquals(1, timers.armedCount());
        assertEquals(JobState.ARMED, timers.state("j1"));
    }

    @Test
    void cancelShouldPreventFire() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1,
                (cron, now) -> Duration.ofMillis(100),
                job -> {
                    fired.incrementAndGet();
                    return false;
                });

        timers.arm(job("j1", "@hourly"));
        timers.cancel("j1");
        Thread.sleep(300);

        assertEquals(0, fired.get());
        assertFalse(timers.isArmed("j1"));
    }

    @Test
    void fireShouldRearmWhenSequenceAsks() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1,
                (cron, now) -> Duration.ofMillis(20),
                job -> fired.incrementAndGet() < 3);

        timers.arm(job("j1", "@hourly"));

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> fired.get() == 3 && timers.state("j1") == JobState.IDLE));
        Thread.sleep(100);
        assertEquals(3, fired.get());
    }

    @Test
    void stateShouldBeFiringWhileSequenceRuns() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1,
                (cron, now) -> Duration.ofMillis(10),
                job -> {
                    entered.countDown();
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return true;
                });

        timers.arm(job("j1", "@hourly"));
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        assertEquals(JobState.FIRING, timers.state("j1"));
        assertFalse(timers.isArmed("j1"));

        // cancelled mid-fire: the running sequence finishes but is not armed again
        timers.cancel("j1");
        release.countDown();
        Thread.sleep(100);
        assertEquals(JobState.IDLE, timers.state("j1"));
    }

    @Test
    void rearmDuringFireShouldWaitForRunningFire() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 2,
                (cron, now) -> Duration.ofMillis(10),
                job -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    entered.countDown();
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        inFlight.decrementAndGet();
                        fired.incrementAndGet();
                    }
                    return false;
                });

        Job job = job("j1", "@hourly");
        timers.arm(job);
        assertTrue(entered.await(2, TimeUnit.SECONDS));

        timers.cancel("j1");
        timers.arm(job);
        Thread.sleep(150);

        // expired but held back until the running fire returns
        assertTrue(timers.isFiring("j1"));
        assertEquals(JobState.ARMED, timers.state("j1"));
        assertEquals(0, fired.get());

        release.countDown();
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> fired.get() == 2 && timers.state("j1") == JobState.IDLE));
        assertEquals(1, maxInFlight.get());
        assertFalse(timers.isFiring("j1"));
    }

    @Test
    void minDelayShouldClampShortDelays() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ofSeconds(5), 1,
                (cron, now) -> Duration.ZERO,
                job -> {
                    fired.incrementAndGet();
                    return false;
                });

        timers.arm(job("j1", "@hourly"));
        Thread.sleep(200);

        assertEquals(0, fired.get());
        assertTrue(timers.isArmed("j1"));
    }

    @Test
    void sequenceFailureShouldNotRearm() {
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1,
                (cron, now) -> Duration.ofMillis(10),
                job -> {
                    throw new IllegalStateException("boom");
                });

        timers.arm(job("j1", "@hourly"));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> timers.state("j1") == JobState.IDLE));
    }

    @Test
    void armAfterShutdownShouldFail() {
        timers = new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 1, job -> false);
        timers.shutdown(Duration.ofMillis(100));

        assertThrows(IllegalStateException.class, () -> timers.arm(job("j1", "@daily")));
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimerScheduler(Clock.systemUTC(), Duration.ofSeconds(-1), 1, job -> false));
        assertThrows(IllegalArgumentException.class,
                () -> new TimerScheduler(Clock.systemUTC(), Duration.ZERO, 0, job -> false));
    }

    private static Job job(String id, String cron) {
        return Job.fromSpec(id, new JobSpec(id, "u", cron, true, true, "task", null));
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }
}
