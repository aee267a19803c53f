package io.shiftwatch.internal;

import io.shiftwatch.core.CounterSample;
import io.shiftwatch.core.CumulativeParameters;
import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.idle.IdleFaultDetector;
import io.shiftwatch.notify.Notifier;
import io.shiftwatch.production.ProductionRecorder;
import io.shiftwatch.production.ShiftProduction;
import io.shiftwatch.report.MessageFormatter;
import io.shiftwatch.report.ShiftReportService;
import io.shiftwatch.sensor.AggregatedReading;
import io.shiftwatch.sensor.SensorAggregator;
import io.shiftwatch.shift.ShiftClock;
import io.shiftwatch.shift.ShiftWindow;

import java.util.Objects;
import java.util.Optional;

/**
 * Firing of a counter job: sum the sensors, store the increment, and report production.
 *
 * <p>On a shift-report child the sample is always stored as the new checkpoint and the shift
 * report is sent instead of the production pulse.
 */
public class CumulativeJobHandler extends AbstractMonitorHandler {

    private final SensorAggregator aggregator;
    private final ProductionRecorder recorder;
    private final ShiftClock shiftClock;
    private final ShiftReportService reportService;

    public CumulativeJobHandler(SensorAggregator aggregator,
                                ProductionRecorder recorder,
                                IdleFaultDetector idleDetector,
                                ShiftClock shiftClock,
                                ShiftReportService reportService,
                                MessageFormatter formatter,
                                Notifier notifier) {
        super(idleDetector, formatter, notifier);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.shiftClock = Objects.requireNonNull(shiftClock, "shiftClock must not be null");
        this.reportService = Objects.requireNonNull(reportService, "reportService must not be null");
    }

    @Override
    public FunctionKind kind() {
        return FunctionKind.CUMULATIVE;
    }

    @Override
    public void execute(MonitorJob job) {
        CumulativeParameters params = job.parameters(CumulativeParameters.class);

        AggregatedReading reading = aggregator.read(params.sensors(), true);
        Optional<CounterSample> stored = recorder.recordCounter(params.seriesKey(), reading.first(), params.shiftReport());
        if (stored.isEmpty()) {
            onIdle(job.name(), params, reading.fault());
            return;
        }
        idleDetector.reset(job.name());
        CounterSample sample = stored.get();

        if (params.shiftReport()) {
            deliver(job.name(), () -> reportService.reportCounter(params.seriesKey(), params.description(), sample, false));
            return;
        }
        if (!params.tgSend()) {
            return;
        }

        ShiftWindow window = shiftClock.current();
        ShiftProduction shift = recorder.shiftProduction(params.seriesKey(), sample.value(), params.speedInfo());
        double produced = shift.produced() > 0 ? shift.produced() : sample.difference();
        String message = formatter.productionMessage(
                sample.speed(),
                shift.shiftSpeed(),
                produced,
                sample.metricUnit(),
                window.label(),
                params.description(),
                params.speedInfo()
        );
        deliver(job.name(), () -> notifier.send(params.chat(), message));
    }
}
