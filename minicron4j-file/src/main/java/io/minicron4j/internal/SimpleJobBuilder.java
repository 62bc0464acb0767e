package io.minicron4j.internal;

import io.minicron4j.JobBuilder;
import io.minicron4j.core.Job;
import io.minicron4j.core.JobSpec;
import io.minicron4j.utils.ScheduleExpressions;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder implements JobBuilder {

    public static final String DEFAULT_USER = "default";

    private final String name;
    private final Clock clock;
    private final Function<JobSpec, Job> persister;

    private String cron;
    private String task;
    private String userId = DEFAULT_USER;
    private boolean enabled = true;
    private Boolean notify;
    private Boolean repeat;

    public SimpleJobBuilder(String name, Clock clock, Function<JobSpec, Job> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder cron(String cron) {
        Objects.requireNonNull(cron, "cron must not be null");
        if (cron.isBlank()) throw new IllegalArgumentException("cron must not be blank");

        this.cron = cron.trim();
        return this;
    }

    @Override
    public JobBuilder at(String time) {
        Objects.requireNonNull(time, "time must not be null");

        String converted = ScheduleExpressions.toCron(time, ZonedDateTime.now(clock));
        if (converted == null) {
            throw new IllegalArgumentException(
                    "Cannot parse time \"" + time + "\". Use \"HH:MM\", \"in Xm\", \"in Xh\", or cron format.");
        }
        this.cron = converted;
        return this;
    }

    @Override
    public JobBuilder task(String task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        return this;
    }

    @Override
    public JobBuilder userId(String userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");

        this.userId = userId;
        return this;
    }

    @Override
    public JobBuilder disabled() {
        this.enabled = false;
        return this;
    }

    @Override
    public JobBuilder notifyOnFire(boolean notify) {
        this.notify = notify;
        return this;
    }

    @Override
    public JobBuilder repeat(boolean repeat) {
        this.repeat = repeat;
        return this;
    }

    @Override
    public JobSpec build() {
        if (cron == null) {
            throw new IllegalStateException("cron or at(...) must be set before build()");
        }
        return new JobSpec(
                name,
                userId,
                cron,
                enabled,
                repeat,
                task == null ? name : task,
                notify
        );
    }

    @Override
    public Job save() {
        return persister.apply(build());
    }
}
