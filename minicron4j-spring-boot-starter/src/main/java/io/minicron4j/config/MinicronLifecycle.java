package io.minicron4j.config;

import io.minicron4j.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Arms the scheduler's timers when the context starts and cancels them when it stops.
 *
 * <p>The context may be stopped and started again; each start after the first re-arms the
 * enabled jobs through {@link Scheduler#init()}.
 */
public class MinicronLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(MinicronLifecycle.class);

    private final Scheduler scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger starts = new AtomicInteger();

    public MinicronLifecycle(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.init();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        int n = starts.incrementAndGet();
        if (n > 1) {
            log.info("Minicron timers restored after stop restart={}", n - 1);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.stopAll();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of times {@link #start()} has armed the scheduler.
     */
    public int getStartCount() {
        return starts.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
