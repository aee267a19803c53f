package io.shiftwatch.core;

import java.time.Instant;
import java.util.List;

/**
 * Sample of a simple or multi-sensor job.
 */
public record SnapshotSample(Instant timestamp, List<TitledValue> values) implements SampleRecord {

    public SnapshotSample {
        values = List.copyOf(values);
    }
}
