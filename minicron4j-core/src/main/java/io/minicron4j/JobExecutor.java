package io.minicron4j;

import io.minicron4j.core.Job;

/**
 * Performs the actual work of a job when its timer fires.
 *
 * <p>Called on a worker thread. The job is not re-armed (or disabled) until this returns.
 */
@FunctionalInterface
public interface JobExecutor {

    void execute(Job job) throws Exception;
}
