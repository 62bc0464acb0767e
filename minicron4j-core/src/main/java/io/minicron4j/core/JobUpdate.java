package io.minicron4j.core;

/**
 * Partial update applied by {@code Scheduler.updateAndEnable}. Null fields are left unchanged.
 */
public record JobUpdate(
        String name,
        String cron,
        String task,
        Boolean repeat
) {

    public static JobUpdate cron(String cron) {
        return new JobUpdate(null, cron, null, null);
    }

    public boolean isEmpty() {
        return name == null && cron == null && task == null && repeat == null;
    }

    public void applyTo(Job job) {
        if (name != null) job.setName(name);
        if (cron != null) job.setCron(cron);
        if (task != null) job.setTask(task);
        if (repeat != null) job.setRepeat(repeat);
    }
}
