package io.shiftwatch.core;

public class JobNotFoundException extends ShiftWatchException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
