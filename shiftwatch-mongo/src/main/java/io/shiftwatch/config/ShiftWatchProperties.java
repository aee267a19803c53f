package io.shiftwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Runtime configuration of the monitoring engine.
 */
@ConfigurationProperties(prefix = "shiftwatch")
public class ShiftWatchProperties {
    private boolean enabled = true;
    private String timezone = "UTC";
    private String firstShift = "08:00";
    private String secondShift = "20:00";
    private boolean skipEqualityCheck = false;
    private Duration reportLookback = Duration.ofHours(1);
    private int maxWorkers = 10;
    private int maxInstances = 2; // per job name
    private Duration misfireGraceTime = Duration.ofSeconds(3600);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String jobsCollection = "monitor_jobs";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getFirstShift() {
        return firstShift;
    }

    public void setFirstShift(String firstShift) {
        this.firstShift = firstShift;
    }

    public String getSecondShift() {
        return secondShift;
    }

    public void setSecondShift(String secondShift) {
        this.secondShift = secondShift;
    }

    public boolean isSkipEqualityCheck() {
        return skipEqualityCheck;
    }

    public void setSkipEqualityCheck(boolean skipEqualityCheck) {
        this.skipEqualityCheck = skipEqualityCheck;
    }

    public Duration getReportLookback() {
        return reportLookback;
    }

    public void setReportLookback(Duration reportLookback) {
        this.reportLookback = reportLookback;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public void setMaxInstances(int maxInstances) {
        this.maxInstances = maxInstances;
    }

    public Duration getMisfireGraceTime() {
        return misfireGraceTime;
    }

    public void setMisfireGraceTime(Duration misfireGraceTime) {
        this.misfireGraceTime = misfireGraceTime;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getJobsCollection() {
        return jobsCollection;
    }

    public void setJobsCollection(String jobsCollection) {
        this.jobsCollection = jobsCollection;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * @throws IllegalArgumentException if {@code timezone} is not a valid zone id
     */
    public ZoneId zoneId() {
        try {
            return ZoneId.of(timezone);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("shiftwatch.timezone is not a valid zone id: " + timezone, e);
        }
    }

    public LocalTime firstShiftStart() {
        return parseTime("shiftwatch.first-shift", firstShift);
    }

    public LocalTime secondShiftStart() {
        return parseTime("shiftwatch.second-shift", secondShift);
    }

    private static LocalTime parseTime(String property, String value) {
        if (value == null) {
            throw new IllegalArgumentException(property + " must be set");
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(property + " must be HH:mm, got: " + value, e);
        }
    }
}
