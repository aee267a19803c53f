package io.shiftwatch.idle;

/**
 * Raised once per idle episode when a job has stalled for {@link IdleFaultDetector#THRESHOLD} cycles.
 *
 * @param fault a sensor failed to read on the cycle that crossed the threshold
 */
public record IdleAlert(String jobName, int cycles, boolean fault) {
}
