package io.minicron4j.internal.file;

import io.minicron4j.JobBuilder;
import io.minicron4j.JobExecutor;
import io.minicron4j.NotificationSink;
import io.minicron4j.Scheduler;
import io.minicron4j.config.SchedulerProperties;
import io.minicron4j.core.Job;
import io.minicron4j.core.JobSpec;
import io.minicron4j.core.JobState;
import io.minicron4j.core.JobUpdate;
import io.minicron4j.internal.SimpleJobBuilder;
import io.minicron4j.internal.TimerScheduler;
import io.minicron4j.utils.CronEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler backed by a single JSON file.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-shot jobs (fire once, then disable themselves)</li>
 *   <li>Repeating jobs (re-armed from the completion time of each fire)</li>
 *   <li>Every mutation persisted before the call returns</li>
 * </ul>
 *
 * <p>All mutations of the in-memory job list go through one lock. The notify and execute steps
 * of a fire run outside it, so jobs with overlapping fire times may run concurrently.
 */
public class FileScheduler implements Scheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileScheduler.class);

    private final SchedulerProperties props;
    private final FileJobStore jobStore;
    private final JobExecutor executor;
    private final NotificationSink notificationSink;
    private final Clock clock;
    private final TimerScheduler timers;

    private final Object lock = new Object();
    // guarded by lock
    private final List<Job> jobs = new ArrayList<>();
    // guarded by lock; set by stopAll(), cleared when init() re-arms
    private boolean stopped;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FileScheduler(SchedulerProperties props,
                         FileJobStore jobStore,
                         JobExecutor executor,
                         NotificationSink notificationSink) {
        this(props, jobStore, executor, notificationSink, Clock.systemDefaultZone(), CronEvaluator::untilNext);
    }

    /**
     * @param notificationSink may be null, in which case {@code notify} flags are ignored
     * @param delays           next-trigger calculation; tests substitute short delays
     */
    public FileScheduler(SchedulerProperties props,
                         FileJobStore jobStore,
                         JobExecutor executor,
                         NotificationSink notificationSink,
                         Clock clock,
                         TimerScheduler.DelayFunction delays) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.notificationSink = notificationSink;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timers = new TimerScheduler(
                clock,
                Objects.requireNonNull(props.getMinDelay(), "minicron.minDelay must not be null"),
                props.getMaxConcurrency(),
                delays,
                this::fire
        );
    }

    /**
     * Create the data directory, load persisted jobs and arm every enabled one. Idempotent while
     * timers are running; after {@link #stopAll()} it re-arms the enabled jobs held in memory.
     */
    @Override
    public void init() {
        ensureOpen();
        if (!initialized.compareAndSet(false, true)) {
            resume();
            return;
        }

        jobStore.ensureDirectory();

        int armed = 0;
        synchronized (lock) {
            jobs.clear();
            jobs.addAll(jobStore.load());
            for (Job job : jobs) {
                if (job.isEnabled() && armOrWarn(job)) {
                    armed++;
                }
            }
            log.info("Scheduler started jobs={} armed={} path={}", jobs.size(), armed, jobStore.getJobsPath());
        }
    }

    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, clock, this::addJob);
    }

    @Override
    public Job addJob(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(spec.name(), "name must not be null");
        Objects.requireNonNull(spec.cron(), "cron must not be null");
        Objects.requireNonNull(spec.task(), "task must not be null");
        Objects.requireNonNull(spec.userId(), "userId must not be null");
        ensureOpen();

        synchronized (lock) {
            Job job = Job.fromSpec(newId(), spec);
            jobs.add(job);
            persist();
            if (job.isEnabled()) {
                armOrWarn(job);
            }
            log.info("Job added id={} name={} cron={} enabled={} repeat={}",
                    job.getId(), job.getName(), job.getCron(), job.isEnabled(), job.isRepeat());
            return job.copy();
        }
    }

    @Override
    public boolean removeJob(String id) {
        ensureOpen();
        synchronized (lock) {
            int idx = indexOf(id);
            if (idx == -1) {
                return false;
            }
            timers.cancel(id);
            Job removed = jobs.remove(idx);
            persist();
            log.info("Job removed id={} name={}", id, removed.getName());
            return true;
        }
    }

    @Override
    public Job toggleJob(String id) {
        ensureOpen();
        synchronized (lock) {
            Job job = find(id);
            if (job == null) {
                return null;
            }
            job.setEnabled(!job.isEnabled());
            if (job.isEnabled()) {
                armOrWarn(job);
            } else {
                timers.cancel(id);
            }
            persist();
            log.info("Job toggled id={} enabled={}", id, job.isEnabled());
            return job.copy();
        }
    }

    @Override
    public Job updateAndEnable(String id, JobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        ensureOpen();
        synchronized (lock) {
            Job job = find(id);
            if (job == null) {
                return null;
            }
            update.applyTo(job);
            job.setEnabled(true);
            armOrWarn(job);
            persist();
            log.info("Job updated and enabled id={} cron={} repeat={}", id, job.getCron(), job.isRepeat());
            return job.copy();
        }
    }

    @Override
    public List<Job> listJobs() {
        return listJobs(null);
    }

    @Override
    public List<Job> listJobs(String userId) {
        boolean all = userId == null || userId.isBlank();
        synchronized (lock) {
            List<Job> out = new ArrayList<>(jobs.size());
            for (Job job : jobs) {
                if (all || userId.equals(job.getUserId())) {
                    out.add(job.copy());
                }
            }
            return out;
        }
    }

    @Override
    public Job findJob(String id) {
        synchronized (lock) {
            Job job = find(id);
            return job == null ? null : job.copy();
        }
    }

    @Override
    public boolean isArmed(String id) {
        return timers.isArmed(id);
    }

    @Override
    public JobState state(String id) {
        return timers.state(id);
    }

    public int armedCount() {
        return timers.armedCount();
    }

    @Override
    public void stopAll() {
        synchronized (lock) {
            timers.cancelAll();
            stopped = true;
        }
        log.info("Scheduler timers stopped");
    }

    private void resume() {
        synchronized (lock) {
            if (!stopped) {
                return;
            }
            stopped = false;
            int armed = 0;
            for (Job job : jobs) {
                if (job.isEnabled() && armOrWarn(job)) {
                    armed++;
                }
            }
            log.info("Scheduler resumed jobs={} armed={}", jobs.size(), armed);
        }
    }

    /**
     * Stop all timers and release the thread pools. Running fires get up to
     * {@code minicron.shutdownTimeout} to finish. Should be idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Scheduler stopping...");
        timers.shutdown(props.getShutdownTimeout());
        log.info("Scheduler stopped successfully.");
    }

    /**
     * Fire sequence for one expiry. Returns true if the job should be armed again.
     */
    private boolean fire(Job job) {
        Job snapshot;
        synchronized (lock) {
            if (!isTracked(job)) {
                log.debug("Skipping fire of removed job id={}", job.getId());
                return false;
            }
            job.setLastRun(clock.instant());
            persist();
            snapshot = job.copy();
        }

        log.debug("Job fired id={} name={} lastRun={}", snapshot.getId(), snapshot.getName(), snapshot.getLastRun());

        if (snapshot.isNotify() && notificationSink != null) {
            try {
                notificationSink.deliver(snapshot, snapshot.getTask());
            } catch (RuntimeException e) {
                log.warn("Job notification failed id={} msg={}", snapshot.getId(), e.getMessage(), e);
            }
        }

        try {
            executor.execute(snapshot);
            log.debug("Job executed id={} name={}", snapshot.getId(), snapshot.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job executor interrupted id={} name={}", snapshot.getId(), snapshot.getName());
        } catch (Exception e) {
            log.error("Job executor failed id={} name={} msg={}", snapshot.getId(), snapshot.getName(), e.getMessage(), e);
        }

        synchronized (lock) {
            if (!isTracked(job)) {
                return false;
            }
            if (job.isRepeat()) {
                return job.isEnabled();
            }
            // toggled back on while firing: keep the new timer
            if (timers.state(job.getId()) == JobState.ARMED) {
                return false;
            }
            job.setEnabled(false);
            persist();
            log.info("One-shot job completed and disabled id={} name={}", job.getId(), job.getName());
            return false;
        }
    }

    // caller holds lock
    private boolean armOrWarn(Job job) {
        if (timers.arm(job)) {
            return true;
        }
        if (!CronEvaluator.looksLikeCron(job.getCron())) {
            log.warn("Job will not fire, cron is not a valid expression id={} cron={}", job.getId(), job.getCron());
        } else {
            log.warn("Job will not fire, cron uses syntax the evaluator does not support "
                    + "(only single values for minute, hour and day-of-week) id={} cron={}", job.getId(), job.getCron());
        }
        return false;
    }

    // caller holds lock
    private void persist() {
        if (!jobStore.save(jobs)) {
            log.warn("In-memory jobs now differ from {}", jobStore.getJobsPath());
        }
    }

    // caller holds lock
    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (indexOf(id) != -1);
        return id;
    }

    private int indexOf(String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private Job find(String id) {
        int idx = indexOf(id);
        return idx == -1 ? null : jobs.get(idx);
    }

    private boolean isTracked(Job job) {
        for (Job j : jobs) {
            if (j == job) {
                return true;
            }
        }
        return false;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler is closed");
        }
    }
}
