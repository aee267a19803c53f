package io.shiftwatch.core;

public class ReportNotConfiguredException extends ShiftWatchException {

    public ReportNotConfiguredException(String jobName) {
        super("Job is not configured to send shift reports: " + jobName);
    }
}
