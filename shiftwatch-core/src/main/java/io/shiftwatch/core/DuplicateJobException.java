package io.shiftwatch.core;

public class DuplicateJobException extends ShiftWatchException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super("Job with this name already exists: " + jobName);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
