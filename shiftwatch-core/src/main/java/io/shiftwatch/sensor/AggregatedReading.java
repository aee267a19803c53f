package io.shiftwatch.sensor;

import io.shiftwatch.core.TitledValue;

import java.util.List;

/**
 * Combined result of one collection cycle.
 *
 * @param values   one value per sensor read, or a single sum
 * @param allZero  no successfully read value was above zero
 * @param fault    at least one sensor failed to read this cycle
 */
public record AggregatedReading(List<TitledValue> values, boolean allZero, boolean fault) {

    public AggregatedReading {
        values = List.copyOf(values);
    }

    public TitledValue first() {
        return values.get(0);
    }
}
