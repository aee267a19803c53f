package io.shiftwatch.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered job as the scheduler sees it.
 *
 * <p>{@code nextRunAt} is scheduler bookkeeping: {@code null} while paused or before the job is
 * first scheduled.
 */
public record MonitorJob(
        String name,
        Trigger trigger,
        FunctionKind kind,
        JobParameters parameters,
        JobState state,
        Instant nextRunAt
) {

    public MonitorJob {
        Objects.requireNonNull(name, "job name must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        if (!kind.parametersType().isInstance(parameters)) {
            throw new IllegalArgumentException("job " + name + " of kind " + kind
                    + " requires " + kind.parametersType().getSimpleName());
        }
        if (state == null) {
            state = JobState.ACTIVE;
        }
    }

    public static MonitorJob active(String name, Trigger trigger, FunctionKind kind, JobParameters parameters) {
        return new MonitorJob(name, trigger, kind, parameters, JobState.ACTIVE, null);
    }

    public <P extends JobParameters> P parameters(Class<P> type) {
        return type.cast(parameters);
    }

    public boolean isPaused() {
        return state == JobState.PAUSED;
    }

    public boolean isShiftReportChild() {
        return ShiftReportNames.isChild(name);
    }

    public MonitorJob withSchedule(JobState newState, Instant newNextRunAt) {
        return new MonitorJob(name, trigger, kind, parameters, newState, newNextRunAt);
    }
}
