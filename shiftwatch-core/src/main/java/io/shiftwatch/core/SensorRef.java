package io.shiftwatch.core;

import java.util.Objects;

/**
 * Reference to a configured sensor: its id in the sensor registry and its protocol class.
 */
public record SensorRef(String id, SensorType type) {

    public SensorRef {
        Objects.requireNonNull(id, "sensor id must not be null");
        Objects.requireNonNull(type, "sensor type must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("sensor id must not be blank");
        }
    }

    public static SensorRef of(SensorType type, String id) {
        return new SensorRef(id, type);
    }
}
