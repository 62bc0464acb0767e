package io.minicron4j;

import io.minicron4j.core.Job;
import io.minicron4j.core.JobSpec;
import io.minicron4j.core.JobState;
import io.minicron4j.core.JobUpdate;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Holds a persisted set of jobs and keeps one timer armed per enabled job. Every mutation is
 * persisted before the call returns. Returned {@link Job} instances are snapshots: changing them
 * does not affect the scheduler.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.init();
 *
 * Job job = scheduler.create("morning-digest")
 *         .cron("30 9 * * 1")
 *         .task("Summarize the inbox")
 *         .userId("alice")
 *         .notifyOnFire(true)
 *         .repeat(true)
 *         .save();
 *
 * scheduler.toggleJob(job.getId());
 * scheduler.stopAll();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Load persisted jobs and arm a timer for every enabled one. Should be idempotent; after
     * {@link #stopAll()} it arms the enabled jobs again.
     */
    void init();

    /**
     * Create a job builder. Nothing is persisted until {@link JobBuilder#save()} is called.
     */
    JobBuilder create(String name);

    /**
     * Assign a fresh id, append to the store, persist and arm the job if it is enabled.
     */
    Job addJob(JobSpec spec);

    /**
     * @return false if no job has this id
     */
    boolean removeJob(String id);

    /**
     * Flip {@code enabled} and arm or cancel the timer accordingly.
     *
     * @return the updated job, or {@code null} if not found
     */
    Job toggleJob(String id);

    /**
     * Apply a partial update, force {@code enabled = true} and re-arm.
     *
     * @return the updated job, or {@code null} if not found
     */
    Job updateAndEnable(String id, JobUpdate update);

    List<Job> listJobs();

    /**
     * Jobs owned by {@code userId}; a null or blank user returns every job.
     */
    List<Job> listJobs(String userId);

    /**
     * @return a snapshot of the job, or {@code null} if not found
     */
    Job findJob(String id);

    /**
     * Whether a timer is currently pending for this job.
     * An enabled job whose cron cannot be evaluated is never armed.
     */
    boolean isArmed(String id);

    JobState state(String id);

    /**
     * Cancel every pending timer. Persisted {@code enabled} flags are left untouched, and a later
     * {@link #init()} restores the timers.
     */
    void stopAll();
}
