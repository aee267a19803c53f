package io.shiftwatch.support;

import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.JobState;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.store.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryJobStore implements JobStore {

    private final Map<String, MonitorJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(MonitorJob job) {
        if (jobs.putIfAbsent(job.name(), job) != null) {
            throw new DuplicateJobException(job.name());
        }
    }

    @Override
    public Optional<MonitorJob> findByName(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    @Override
    public List<MonitorJob> findAll() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public boolean updateSchedule(String name, JobState state, Instant nextRunAt) {
        return jobs.computeIfPresent(name, (n, job) -> job.withSchedule(state, nextRunAt)) != null;
    }

    @Override
    public boolean deleteByName(String name) {
        return jobs.remove(name) != null;
    }
}
