package io.shiftwatch.report;

import io.shiftwatch.core.CounterSample;
import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.core.ShiftReportNames;
import io.shiftwatch.notify.Attachment;
import io.shiftwatch.notify.Notifier;
import io.shiftwatch.production.ProductionRecorder;
import io.shiftwatch.shift.ShiftClock;
import io.shiftwatch.shift.ShiftWindow;
import io.shiftwatch.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds and sends end-of-shift reports.
 *
 * <p>Scheduled reports fire shortly after a shift boundary, so they cover the shift running
 * {@code lookback} ago. Manually requested reports cover the shift before the current one.
 */
public class ShiftReportService {
    private static final Logger log = LoggerFactory.getLogger(ShiftReportService.class);

    static final int SHIFT_SAMPLE_LIMIT = 1000;
    static final int WEEK_SAMPLE_LIMIT = 16;

    private final TimeSeriesStore store;
    private final ProductionRecorder recorder;
    private final ShiftClock shiftClock;
    private final MessageFormatter formatter;
    private final Notifier notifier;
    private final ReportChartProvider chartProvider;
    private final Duration lookback;

    public ShiftReportService(TimeSeriesStore store,
                              ProductionRecorder recorder,
                              ShiftClock shiftClock,
                              MessageFormatter formatter,
                              Notifier notifier,
                              ReportChartProvider chartProvider,
                              Duration lookback) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.shiftClock = Objects.requireNonNull(shiftClock, "shiftClock must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.chartProvider = chartProvider;
        this.lookback = lookback == null ? Duration.ZERO : lookback;
    }

    /**
     * Report of a cumulative job from the checkpoint just written into its report series.
     */
    public void reportCounter(String reportSeries, String description, CounterSample checkpoint, boolean previous) {
        ShiftWindow window = shiftClock.reportWindow(lookback, previous);
        double dayProduced = recorder.dayProduction(reportSeries, checkpoint.difference());
        String message = formatter.reportMessage(
                window,
                checkpoint.value(),
                checkpoint.difference(),
                dayProduced,
                checkpoint.metricUnit(),
                description
        );

        List<Attachment> charts = renderCharts(ShiftReportNames.baseSeries(reportSeries), reportSeries, description, window);
        notifier.sendReport(message, charts);
        log.debug("shiftwatch counter report sent series={} shift={}", reportSeries, window.shift());
    }

    /**
     * Report of a simple job, summarising its base series over the report window.
     *
     * @return false when the window holds no samples and nothing was sent
     */
    public boolean reportSnapshots(String seriesKey, String description, boolean previous) {
        String baseSeries = ShiftReportNames.baseSeries(seriesKey);
        ShiftWindow window = shiftClock.reportWindow(lookback, previous);
        List<SampleRecord> samples = store.query(baseSeries, window.start().toInstant(), window.end().toInstant(),
                SHIFT_SAMPLE_LIMIT);
        if (samples.isEmpty()) {
            log.debug("shiftwatch no samples for shift report series={} shift={}", baseSeries, window.shift());
            return false;
        }

        List<Attachment> charts = List.of();
        if (chartProvider != null) {
            charts = chartProvider.render(new ReportContext(baseSeries, description, window, samples, List.of()));
        }
        notifier.sendReport(formatter.snapshotReportMessage(window, description, samples), charts);
        return true;
    }

    /**
     * Re-send the report of the previous shift for a report child job.
     *
     * @return false when there is no data to report
     */
    public boolean sendPreviousShiftReport(String jobName, String description, FunctionKind kind) {
        String seriesKey = ShiftReportNames.seriesOfChild(jobName);
        if (kind == FunctionKind.CUMULATIVE) {
            Optional<CounterSample> last = recorder.lastCounter(seriesKey);
            if (last.isEmpty()) {
                return false;
            }
            reportCounter(seriesKey, description, last.get(), true);
            return true;
        }
        return reportSnapshots(seriesKey, description, true);
    }

    private List<Attachment> renderCharts(String baseSeries, String reportSeries, String description, ShiftWindow window) {
        if (chartProvider == null) {
            return List.of();
        }
        List<SampleRecord> shiftSamples = store.query(baseSeries, window.start().toInstant(), window.end().toInstant(),
                SHIFT_SAMPLE_LIMIT);
        List<SampleRecord> weekSamples = store.query(reportSeries, shiftClock.startOfWeek().toInstant(),
                shiftClock.now().toInstant(), WEEK_SAMPLE_LIMIT);
        return chartProvider.render(new ReportContext(baseSeries, description, window, shiftSamples, weekSamples));
    }
}
