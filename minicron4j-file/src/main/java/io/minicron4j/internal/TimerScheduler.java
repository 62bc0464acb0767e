package io.minicron4j.internal;

import io.minicron4j.core.Job;
import io.minicron4j.core.JobState;
import io.minicron4j.utils.CronEvaluator;
import io.minicron4j.utils.ScheduleExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one cancellable timer per job id.
 *
 * <p>Each job moves through {@link JobState#IDLE} -> {@link JobState#ARMED} ->
 * {@link JobState#FIRING} and back. Timers expire on a single dispatcher thread; the fire
 * sequence itself runs on the worker pool, so a slow job never delays another job's timer.
 * A job is armed again only after its fire sequence returns. A timer armed for a job whose
 * previous fire is still running (toggled or updated mid-fire) is held back until that fire
 * completes, so two fires of the same job never overlap.
 */
public class TimerScheduler {
    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    /**
     * Runs the work for one expiry.
     */
    @FunctionalInterface
    public interface FireSequence {
        /**
         * @return true if the job should be armed again
         */
        boolean fire(Job job);
    }

    /**
     * Delay until the next trigger, or {@code null} when unschedulable.
     */
    @FunctionalInterface
    public interface DelayFunction {
        Duration untilNext(String cron, ZonedDateTime now);
    }

    private final Clock clock;
    private final Duration minDelay;
    private final DelayFunction delays;
    private final FireSequence fireSequence;

    private final ScheduledExecutorService timerPool;
    private final ExecutorService workerPool;

    // guarded by this
    private final Map<String, ArmedTimer> timers = new HashMap<>();
    // guarded by this; survives cancel()
    private final Set<String> firing = new HashSet<>();

    private static final class ArmedTimer {
        private final Job job;
        private ScheduledFuture<?> future;
        private JobState state = JobState.ARMED;
        private boolean cancelled;
        // expired while an earlier fire of the same job was running
        private boolean deferred;

        private ArmedTimer(Job job) {
            this.job = job;
        }
    }

    public TimerScheduler(Clock clock, Duration minDelay, int maxConcurrency, FireSequence fireSequence) {
        this(clock, minDelay, maxConcurrency, CronEvaluator::untilNext, fireSequence);
    }

    public TimerScheduler(Clock clock,
                          Duration minDelay,
                          int maxConcurrency,
                          DelayFunction delays,
                          FireSequence fireSequence) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.minDelay = Objects.requireNonNull(minDelay, "minDelay must not be null");
        this.delays = Objects.requireNonNull(delays, "delays must not be null");
        this.fireSequence = Objects.requireNonNull(fireSequence, "fireSequence must not be null");
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must not be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }

        this.timerPool = Executors.newSingleThreadScheduledExecutor(daemonThreads("minicron.timer"));
        this.workerPool = Executors.newFixedThreadPool(maxConcurrency, daemonThreads("minicron.worker"));
    }

    /**
     * Cancel any timer for the job, then arm a new one if its cron can be evaluated.
     *
     * @return false if the job was left without a timer
     */
    public synchronized boolean arm(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.getId();
        cancel(id);

        Duration delay = delays.untilNext(job.getCron(), ZonedDateTime.now(clock));
        if (delay == null || delay.isNegative()) {
            log.debug("Job not armed, cron is unschedulable id={} cron={}", id, job.getCron());
            return false;
        }
        if (delay.compareTo(minDelay) < 0) {
            delay = minDelay;
        }

        ArmedTimer t = new ArmedTimer(job);
        try {
            t.future = timerPool.schedule(() -> dispatch(t), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Scheduler has been shut down", e);
        }
        timers.put(id, t);

        log.debug("Job armed id={} name={} fires {}", id, job.getName(), ScheduleExpressions.describe(delay));
        return true;
    }

    /**
     * Clear the pending timer for {@code id}. A fire already in progress runs to completion but
     * is not armed again.
     */
    public synchronized void cancel(String id) {
        ArmedTimer t = timers.remove(id);
        if (t == null) {
            return;
        }
        t.cancelled = true;
        if (t.future != null) {
            t.future.cancel(false);
        }
        log.debug("Job timer cancelled id={} state={}", id, t.state);
    }

    public synchronized void cancelAll() {
        List<String> ids = new ArrayList<>(timers.keySet());
        for (String id : ids) {
            cancel(id);
        }
    }

    public synchronized boolean isFiring(String id) {
        return firing.contains(id);
    }

    public synchronized JobState state(String id) {
        ArmedTimer t = timers.get(id);
        return t == null ? JobState.IDLE : t.state;
    }

    public boolean isArmed(String id) {
        return state(id).hasTimer();
    }

    public synchronized int armedCount() {
        int n = 0;
        for (ArmedTimer t : timers.values()) {
            if (t.state.hasTimer()) {
                n++;
            }
        }
        return n;
    }

    /**
     * Cancel all timers and stop the pools, waiting up to {@code timeout} for running fires.
     */
    public void shutdown(Duration timeout) {
        cancelAll();
        timerPool.shutdownNow();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler workers did not finish within {}, interrupting", timeout);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }

    private void dispatch(ArmedTimer t) {
        String id = t.job.getId();
        synchronized (this) {
            if (t.cancelled || timers.get(id) != t) {
                return;
            }
            if (firing.contains(id)) {
                t.deferred = true;
                log.debug("Job fire deferred, previous fire still running id={}", id);
                return;
            }
            t.state = JobState.FIRING;
            firing.add(id);
        }

        try {
            workerPool.execute(() -> runFire(t));
        } catch (RejectedExecutionException e) {
            log.warn("Job fire rejected, scheduler is shutting down id={}", id);
            synchronized (this) {
                firing.remove(id);
                if (timers.get(id) == t) {
                    timers.remove(id);
                }
            }
        }
    }

    private void runFire(ArmedTimer t) {
        String id = t.job.getId();
        boolean rearm = false;
        try {
            rearm = fireSequence.fire(t.job);
        } catch (RuntimeException e) {
            log.error("Job fire sequence failed id={} msg={}", id, e.getMessage(), e);
        }

        synchronized (this) {
            firing.remove(id);
            ArmedTimer current = timers.get(id);
            // cancelled, or re-armed by a toggle while firing
            if (current != t) {
                if (current != null && current.deferred) {
                    current.deferred = false;
                    dispatch(current);
                }
                return;
            }
            timers.remove(id);
            if (rearm && !t.cancelled) {
                try {
                    arm(t.job);
                } catch (IllegalStateException e) {
                    log.debug("Job not re-armed, scheduler is shutting down id={}", id);
                }
            }
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
