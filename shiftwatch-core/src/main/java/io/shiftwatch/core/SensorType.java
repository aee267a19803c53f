package io.shiftwatch.core;

/**
 * Protocol class of a field sensor. Each type is served by one {@link io.shiftwatch.sensor.SensorReader}.
 */
public enum SensorType {
    OPC,
    PLC,
    MODBUS_TCP
}
