package io.shiftwatch.core;

import java.util.List;

public record CumulativeParameters(
        String seriesKey,
        String description,
        List<SensorRef> sensors,
        boolean tgSend,
        boolean shiftReport,
        boolean speedInfo,
        String chat
) implements JobParameters {

    public CumulativeParameters {
        sensors = List.copyOf(sensors);
    }
}
