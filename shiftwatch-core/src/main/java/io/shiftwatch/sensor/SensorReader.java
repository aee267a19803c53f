package io.shiftwatch.sensor;

import io.shiftwatch.core.SensorType;

/**
 * Reads one sensor over a field protocol. One implementation per {@link SensorType}.
 *
 * <p>May block on network I/O. Implementations report failures through
 * {@link SensorReading#failed()} instead of throwing.
 */
public interface SensorReader {

    SensorType type();

    SensorReading read(String sensorId);
}
