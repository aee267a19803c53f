package io.shiftwatch.production;

/**
 * Counter arithmetic. A counter that goes backwards is taken to have restarted from zero.
 */
public final class DeltaEngine {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private DeltaEngine() {
    }

    /**
     * Increment of a cumulative counter since the last sample; never negative.
     *
     * @param lastValue    previous counter value, or {@code null} if there is none
     * @param currentValue counter value just read
     */
    public static double delta(Double lastValue, double currentValue) {
        if (lastValue == null) {
            return 0.0;
        }
        if (currentValue >= lastValue) {
            return currentValue - lastValue;
        }
        return Math.max(0.0, currentValue);
    }

    /**
     * Hourly rate for an increment over the elapsed time; 0 when no time elapsed.
     */
    public static double speed(double difference, double elapsedSeconds) {
        if (elapsedSeconds > 0) {
            return difference * SECONDS_PER_HOUR / elapsedSeconds;
        }
        return 0.0;
    }
}
