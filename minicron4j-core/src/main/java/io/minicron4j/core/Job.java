package io.minicron4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted schedulable unit.
 *
 * <p>{@code notify} and {@code repeat} are nullable so that an absent flag stays absent after a
 * save/load cycle; {@link #isNotify()} and {@link #isRepeat()} treat null as false.
 */
public class Job {

    private String id;
    private String name;
    private String cron;
    private String task;
    private String userId;
    private boolean enabled;
    private Boolean notify;
    private Boolean repeat;
    private Instant lastRun;

    public Job() {
    }

    public static Job fromSpec(String id, JobSpec spec) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        Job job = new Job();
        job.setId(id);
        job.setName(spec.name());
        job.setCron(spec.cron());
        job.setTask(spec.task());
        job.setUserId(spec.userId());
        job.setEnabled(spec.enabled());
        job.setNotify(spec.notifyOnFire());
        job.setRepeat(spec.repeat());
        return job;
    }

    public Job copy() {
        Job c = new Job();
        c.id = id;
        c.name = name;
        c.cron = cron;
        c.task = task;
        c.userId = userId;
        c.enabled = enabled;
        c.notify = notify;
        c.repeat = repeat;
        c.lastRun = lastRun;
        return c;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getNotify() {
        return notify;
    }

    public void setNotify(Boolean notify) {
        this.notify = notify;
    }

    public boolean isNotify() {
        return Boolean.TRUE.equals(notify);
    }

    public Boolean getRepeat() {
        return repeat;
    }

    public void setRepeat(Boolean repeat) {
        this.repeat = repeat;
    }

    public boolean isRepeat() {
        return Boolean.TRUE.equals(repeat);
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job other)) return false;
        return enabled == other.enabled
                && Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(cron, other.cron)
                && Objects.equals(task, other.task)
                && Objects.equals(userId, other.userId)
                && Objects.equals(notify, other.notify)
                && Objects.equals(repeat, other.repeat)
                && Objects.equals(lastRun, other.lastRun);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, cron, task, userId, enabled, notify, repeat, lastRun);
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", name=" + name
                + ", cron=" + cron
                + ", userId=" + userId
                + ", enabled=" + enabled
                + ", notify=" + notify
                + ", repeat=" + repeat
                + ", lastRun=" + lastRun
                + '}';
    }
}
