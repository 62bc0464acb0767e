package io.minicron4j.internal.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.minicron4j.core.Job;

import java.time.Instant;

/**
 * JSON model for one persisted job. Optional fields are omitted when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "name", "cron", "task", "userId", "enabled", "notify", "repeat", "lastRun"})
public class JobDocument {

    private String id;
    private String name;
    private String cron;
    private String task;
    private String userId;
    private boolean enabled;
    private Boolean notify;
    private Boolean repeat;
    private Instant lastRun;

    public JobDocument() {
    }

    public static JobDocument fromJob(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setName(job.getName());
        doc.setCron(job.getCron());
        doc.setTask(job.getTask());
        doc.setUserId(job.getUserId());
        doc.setEnabled(job.isEnabled());
        doc.setNotify(job.getNotify());
        doc.setRepeat(job.getRepeat());
        doc.setLastRun(job.getLastRun());
        return doc;
    }

    /**
     * Reverse of {@link #fromJob(Job)}.
     */
    public Job toJob() {
        Job job = new Job();
        job.setId(id);
        job.setName(name);
        job.setCron(cron);
        job.setTask(task);
        job.setUserId(userId);
        job.setEnabled(enabled);
        job.setNotify(notify);
        job.setRepeat(repeat);
        job.setLastRun(lastRun);
        return job;
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

    public Boolean getRepeat() {
        return repeat;
    }

    public void setRepeat(Boolean repeat) {
        this.repeat = repeat;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }
}
