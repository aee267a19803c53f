package io.shiftwatch.core;

import java.util.List;

public record SimpleParameters(
        String seriesKey,
        String description,
        List<SensorRef> sensors,
        boolean tgSend,
        boolean shiftReport,
        boolean summation,
        String chat
) implements JobParameters {

    public SimpleParameters {
        sensors = List.copyOf(sensors);
    }
}
