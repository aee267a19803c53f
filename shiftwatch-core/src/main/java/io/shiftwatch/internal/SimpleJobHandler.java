package io.shiftwatch.internal;

import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.core.SimpleParameters;
import io.shiftwatch.core.SnapshotSample;
import io.shiftwatch.idle.IdleFaultDetector;
import io.shiftwatch.notify.Notifier;
import io.shiftwatch.production.ProductionRecorder;
import io.shiftwatch.report.MessageFormatter;
import io.shiftwatch.report.ShiftReportService;
import io.shiftwatch.sensor.AggregatedReading;
import io.shiftwatch.sensor.SensorAggregator;
import io.shiftwatch.shift.ShiftClock;

import java.util.Objects;
import java.util.Optional;

/**
 * Firing of a snapshot job: store the sensor values unless nothing changed.
 *
 * <p>A cycle is idle when every value is zero, or, unless {@code skipEqualityCheck}, when the
 * values equal the last stored snapshot.
 */
public class SimpleJobHandler extends AbstractMonitorHandler {

    private final SensorAggregator aggregator;
    private final ProductionRecorder recorder;
    private final ShiftClock shiftClock;
    private final ShiftReportService reportService;
    private final boolean skipEqualityCheck;

    public SimpleJobHandler(SensorAggregator aggregator,
                            ProductionRecorder recorder,
                            IdleFaultDetector idleDetector,
                            ShiftClock shiftClock,
                            ShiftReportService reportService,
                            MessageFormatter formatter,
                            Notifier notifier,
                            boolean skipEqualityCheck) {
        super(idleDetector, formatter, notifier);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.shiftClock = Objects.requireNonNull(shiftClock, "shiftClock must not be null");
        this.reportService = Objects.requireNonNull(reportService, "reportService must not be null");
        this.skipEqualityCheck = skipEqualityCheck;
    }

    @Override
    public FunctionKind kind() {
        return FunctionKind.SIMPLE;
    }

    @Override
    public void execute(MonitorJob job) {
        SimpleParameters params = job.parameters(SimpleParameters.class);

        if (params.shiftReport()) {
            if (params.tgSend()) {
                deliver(job.name(), () -> reportService.reportSnapshots(params.seriesKey(), params.description(), false));
            }
            return;
        }

        AggregatedReading reading = aggregator.read(params.sensors(), params.summation());
        Optional<SnapshotSample> last = recorder.lastSnapshot(params.seriesKey());
        boolean unchanged = !skipEqualityCheck
                && last.map(s -> s.values().equals(reading.values())).orElse(false);

        if (reading.allZero() || unchanged) {
            onIdle(job.name(), params, reading.fault());
            return;
        }
        idleDetector.reset(job.name());

        SnapshotSample sample = recorder.recordSnapshot(params.seriesKey(), reading.values());
        if (params.tgSend()) {
            String message = formatter.snapshotMessage(sample.values(), shiftClock.current().label(), params.description());
            deliver(job.name(), () -> notifier.send(params.chat(), message));
        }
    }
}
