package io.shiftwatch.core;

import java.time.Instant;

/**
 * Sample of a cumulative single-sensor job: the raw counter plus the derived increment and rate.
 */
public record CounterSample(
        Instant timestamp,
        double value,
        double difference,
        double speed,
        String metricUnit
) implements SampleRecord {
}
