package io.minicron4j;

import io.minicron4j.core.Job;

/**
 * Receives a message when a job with {@code notify} set fires.
 *
 * <p>Invoked synchronously from the fire sequence, before the executor runs. Implementations
 * should return quickly.
 */
@FunctionalInterface
public interface NotificationSink {

    void deliver(Job job, String message);
}
