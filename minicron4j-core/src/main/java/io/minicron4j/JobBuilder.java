package io.minicron4j;

import io.minicron4j.core.Job;
import io.minicron4j.core.JobSpec;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + add to the scheduler</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Cron expression: a preset ({@code @hourly}, {@code @daily}, {@code @weekly}) or
     * {@code minute hour day-of-month month day-of-week}.
     */
    JobBuilder cron(String cron);

    /**
     * Friendly time: "17:00", "in 30m", "in 2h", or a 5-field cron expression.
     *
     * @throws IllegalArgumentException if the time cannot be converted
     */
    JobBuilder at(String time);

    JobBuilder task(String task);

    JobBuilder userId(String userId);

    /**
     * Store the job disabled. No timer is armed until it is toggled.
     */
    JobBuilder disabled();

    JobBuilder notifyOnFire(boolean notify);

    JobBuilder repeat(boolean repeat);

    JobSpec build();

    Job save();
}
