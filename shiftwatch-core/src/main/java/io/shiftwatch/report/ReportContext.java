package io.shiftwatch.report;

import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.shift.ShiftWindow;

import java.util.List;

/**
 * Data handed to a {@link ReportChartProvider}.
 *
 * @param seriesKey     base series of the job
 * @param shiftSamples  base series records inside the report window, oldest first
 * @param weekSamples   shift-report checkpoints since the start of the week, oldest first
 */
public record ReportContext(
        String seriesKey,
        String description,
        ShiftWindow window,
        List<SampleRecord> shiftSamples,
        List<SampleRecord> weekSamples
) {
}
