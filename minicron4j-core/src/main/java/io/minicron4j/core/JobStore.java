package io.minicron4j.core;

import java.util.List;

/**
 * Whole-collection persistence for jobs. There are no partial updates: every save replaces the
 * stored list.
 */
public interface JobStore {

    /**
     * @return the persisted jobs; an empty list when nothing is stored or the stored data is unreadable
     */
    List<Job> load();

    /**
     * Replace the stored list.
     *
     * @return false if the write failed; in-memory state is not rolled back
     */
    boolean save(List<Job> jobs);
}
