package io.minicron4j.core;

/**
 * Timer state of a single job.
 */
public enum JobState {
    /**
     * No pending timer: disabled, unschedulable, cancelled or finished.
     */
    IDLE {
        @Override
        public boolean hasTimer() {
            return false;
        }
    },
    ARMED {
        @Override
        public boolean hasTimer() {
            return true;
        }
    },
    /**
     * The fire sequence is running; the next timer is armed only after it completes.
     */
    FIRING {
        @Override
        public boolean hasTimer() {
            return false;
        }
    };

    public abstract boolean hasTimer();
}
