package io.shiftwatch.sensor;

import io.shiftwatch.core.SensorRef;
import io.shiftwatch.core.SensorType;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.support.ScriptedSensorReader;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensorAggregatorTest {

    private final ScriptedSensorReader opc = new ScriptedSensorReader(SensorType.OPC)
            .set("a", "Press 1", 10.0, "pcs")
            .fail("b")
            .set("c", "Press 3", 5.0, "pcs");

    @Test
    void failedReadingShouldBeFaultWithoutValue() {
        SensorReading failed = SensorReading.failed();

        assertTrue(failed.fault());
        assertFalse(failed.hasValue());
        assertFalse(SensorReading.disabled().fault());
    }

    @Test
    void summationShouldSkipFaultsAndKeepLastTitle() {
        SensorAggregator aggregator = new SensorAggregator(List.of(opc));

        AggregatedReading reading = aggregator.read(refs("a", "b", "c"), true);

        assertEquals(List.of(new TitledValue("Press 3", 15.0, "pcs")), reading.values());
        assertTrue(reading.fault());
        assertFalse(reading.allZero());
    }

    @Test
    void withoutSummationShouldReturnOneValuePerSensorRead() {
        SensorAggregator aggregator = new SensorAggregator(List.of(opc));

        AggregatedReading reading = aggregator.read(refs("a", "b", "c"), false);

        assertEquals(2, reading.values().size());
        assertEquals("Press 1", reading.first().title());
    }

    @Test
    void zeroValuesShouldBeReportedAsAllZero() {
        ScriptedSensorReader idle = new ScriptedSensorReader(SensorType.OPC).set("a", "Press 1", 0.0, "pcs");
        SensorAggregator aggregator = new SensorAggregator(List.of(idle));

        AggregatedReading reading = aggregator.read(refs("a"), false);

        assertTrue(reading.allZero());
        assertFalse(reading.fault());
    }

    @Test
    void nothingReadShouldYieldSingleUnknownZero() {
        SensorAggregator aggregator = new SensorAggregator(List.of(opc));

        AggregatedReading reading = aggregator.read(refs("b"), true);

        assertEquals(List.of(new TitledValue("Unknown", 0.0, "~")), reading.values());
        assertTrue(reading.fault());
        assertTrue(reading.allZero());
    }

    @Test
    void missingReaderOrThrowingReaderShouldCountAsFault() {
        SensorReader throwing = new SensorReader() {
            @Override
            public SensorType type() {
                return SensorType.PLC;
            }

            @Override
            public SensorReading read(String sensorId) {
                throw new IllegalStateException("connection refused");
            }
        };
        SensorAggregator aggregator = new SensorAggregator(List.of(opc, throwing));

        AggregatedReading reading = aggregator.read(List.of(
                SensorRef.of(SensorType.PLC, "x"),
                SensorRef.of(SensorType.MODBUS_TCP, "y"),
                SensorRef.of(SensorType.OPC, "a")
        ), true);

        assertTrue(reading.fault());
        assertEquals(10.0, reading.first().value());
        assertFalse(aggregator.supports(SensorType.MODBUS_TCP));
    }

    @Test
    void duplicateReaderTypeShouldFail() {
        assertThrows(IllegalStateException.class,
                () -> new SensorAggregator(List.of(opc, new ScriptedSensorReader(SensorType.OPC))));
    }

    private static List<SensorRef> refs(String... ids) {
        return Arrays.stream(ids).map(id -> SensorRef.of(SensorType.OPC, id)).toList();
    }
}
