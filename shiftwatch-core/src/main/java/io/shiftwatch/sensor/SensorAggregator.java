package io.shiftwatch.sensor;

import io.shiftwatch.core.SensorRef;
import io.shiftwatch.core.SensorType;
import io.shiftwatch.core.TitledValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the sensors of a job and combines them per the job's summation policy.
 *
 * <p>A failed read never aborts the cycle: it contributes no value and raises the fault flag.
 */
public class SensorAggregator {
    private static final Logger log = LoggerFactory.getLogger(SensorAggregator.class);

    static final String UNKNOWN_TITLE = "Unknown";
    static final String UNKNOWN_UNIT = "~";

    private final Map<SensorType, SensorReader> readersByType = new EnumMap<>(SensorType.class);

    public SensorAggregator(List<? extends SensorReader> readers) {
        for (SensorReader reader : readers) {
            SensorReader previous = readersByType.putIfAbsent(reader.type(), reader);
            if (previous != null) {
                throw new IllegalStateException("Duplicate SensorReader for type: " + reader.type());
            }
        }
    }

    public boolean supports(SensorType type) {
        return readersByType.containsKey(type);
    }

    /**
     * @param sensors   sensors in job order
     * @param summation sum every value into one, titled after the last sensor read
     */
    public AggregatedReading read(List<SensorRef> sensors, boolean summation) {
        Objects.requireNonNull(sensors, "sensors must not be null");

        List<TitledValue> values = new ArrayList<>(sensors.size());
        String title = UNKNOWN_TITLE;
        String metricUnit = UNKNOWN_UNIT;
        double sum = 0.0;
        boolean allZero = true;
        boolean fault = false;

        for (SensorRef sensor : sensors) {
            SensorReading reading = readOne(sensor);
            if (reading.fault()) {
                fault = true;
            }
            if (!reading.hasValue()) {
                continue;
            }

            TitledValue value = reading.value();
            if (value.value() > 0) {
                allZero = false;
            }
            if (summation) {
                sum += value.value();
                title = value.title();
                metricUnit = value.metricUnit();
            }
            values.add(value);
        }

        if (values.isEmpty()) {
            return new AggregatedReading(List.of(new TitledValue(title, 0.0, metricUnit)), allZero, fault);
        }
        if (summation) {
            return new AggregatedReading(List.of(new TitledValue(title, sum, metricUnit)), allZero, fault);
        }
        return new AggregatedReading(values, allZero, fault);
    }

    private SensorReading readOne(SensorRef sensor) {
        SensorReader reader = readersByType.get(sensor.type());
        if (reader == null) {
            log.warn("shiftwatch no reader registered type={} sensor={}", sensor.type(), sensor.id());
            return SensorReading.failed();
        }
        try {
            SensorReading reading = reader.read(sensor.id());
            return reading != null ? reading : SensorReading.failed();
        } catch (RuntimeException e) {
            log.warn("shiftwatch sensor read failed type={} sensor={} msg={}", sensor.type(), sensor.id(), e.getMessage());
            return SensorReading.failed();
        }
    }
}
