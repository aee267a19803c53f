package io.shiftwatch;

import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.JobNotFoundException;
import io.shiftwatch.core.MonitorJob;

import java.util.List;
import java.util.Optional;

/**
 * Owns the set of named jobs and drives their periodic firings.
 *
 * <p>Per job the lifecycle is {@code Scheduled -> Running -> Scheduled}; {@code Paused} is
 * reachable from {@code Scheduled} and returns to it on resume; removal is terminal. A firing that
 * throws is logged and the job stays scheduled.
 */
public interface JobScheduler {

    /**
     * Rehydrate persisted jobs and start dispatching. Idempotent.
     */
    void start();

    /**
     * Stop dispatching, letting in-flight firings finish within the shutdown timeout. Idempotent.
     */
    void stop();

    /**
     * Register and persist a new job; its first fire time is computed from now.
     *
     * @throws DuplicateJobException if a job with the same name exists
     */
    MonitorJob addJob(MonitorJob job);

    /**
     * @throws JobNotFoundException if no such job exists
     */
    void removeJob(String name);

    /**
     * Prevent new firings. An in-flight firing is not cancelled.
     *
     * @throws JobNotFoundException if no such job exists
     */
    MonitorJob pauseJob(String name);

    /**
     * @throws JobNotFoundException if no such job exists
     */
    MonitorJob resumeJob(String name);

    Optional<MonitorJob> getJob(String name);

    boolean jobExists(String name);

    /**
     * Jobs ordered by next run time; paused jobs last.
     */
    List<MonitorJob> listJobs();

    /**
     * Skip every firing until {@link #resume()}; triggers keep advancing.
     */
    void pause();

    void resume();
}
