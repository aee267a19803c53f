package io.shiftwatch.store;

import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.JobState;
import io.shiftwatch.core.MonitorJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable registry of job definitions keyed by name. The scheduler rehydrates from it on start.
 */
public interface JobStore {

    /**
     * @throws DuplicateJobException if the name is already stored
     */
    void insert(MonitorJob job);

    Optional<MonitorJob> findByName(String name);

    List<MonitorJob> findAll();

    /**
     * Persist state and next run time; {@code nextRunAt} may be null.
     *
     * @return false if no job with that name is stored
     */
    boolean updateSchedule(String name, JobState state, Instant nextRunAt);

    /**
     * @return false if no job with that name was stored
     */
    boolean deleteByName(String name);
}
