package io.shiftwatch.sensor;

import io.shiftwatch.core.TitledValue;

/**
 * Outcome of a single sensor read. {@code value} is null when nothing was read; {@code fault}
 * tells a failed read apart from a sensor that is simply disabled.
 */
public record SensorReading(TitledValue value, boolean fault) {

    private static final SensorReading FAULT = new SensorReading(null, true);
    private static final SensorReading DISABLED = new SensorReading(null, false);

    public static SensorReading ok(TitledValue value) {
        return new SensorReading(value, false);
    }

    public static SensorReading failed() {
        return FAULT;
    }

    public static SensorReading disabled() {
        return DISABLED;
    }

    public boolean hasValue() {
        return value != null;
    }
}
