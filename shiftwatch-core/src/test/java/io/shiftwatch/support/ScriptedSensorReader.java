package io.shiftwatch.support;

import io.shiftwatch.core.SensorType;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.sensor.SensorReader;
import io.shiftwatch.sensor.SensorReading;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Returns whatever reading was last set for a sensor id; unknown ids read as a fault.
 */
public class ScriptedSensorReader implements SensorReader {

    private final SensorType type;
    private final Map<String, SensorReading> readings = new ConcurrentHashMap<>();

    public ScriptedSensorReader(SensorType type) {
        this.type = type;
    }

    public ScriptedSensorReader set(String sensorId, String title, double value, String unit) {
        readings.put(sensorId, SensorReading.ok(new TitledValue(title, value, unit)));
        return this;
    }

    public ScriptedSensorReader fail(String sensorId) {
        readings.put(sensorId, SensorReading.failed());
        return this;
    }

    @Override
    public SensorType type() {
        return type;
    }

    @Override
    public SensorReading read(String sensorId) {
        return readings.getOrDefault(sensorId, SensorReading.failed());
    }
}
