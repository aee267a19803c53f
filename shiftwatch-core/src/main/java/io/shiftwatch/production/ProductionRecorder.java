package io.shiftwatch.production;

import io.shiftwatch.core.CounterSample;
import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.core.ShiftReportNames;
import io.shiftwatch.core.SnapshotSample;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns readings into series records and answers the production questions asked of a series.
 */
public class ProductionRecorder {
    private static final Logger log = LoggerFactory.getLogger(ProductionRecorder.class);

    private final TimeSeriesStore store;
    private final Clock clock;

    public ProductionRecorder(TimeSeriesStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Record a counter reading of a cumulative job.
     *
     * <p>Nothing is written when the counter did not grow, unless {@code checkpoint} is set: a shift
     * report must always leave a record so the next shift has a baseline.
     *
     * @return the stored record, or empty if the reading carried no new information
     */
    public Optional<CounterSample> recordCounter(String seriesKey, TitledValue reading, boolean checkpoint) {
        Instant now = clock.instant();
        Optional<CounterSample> last = lastCounter(seriesKey);

        CounterSample sample;
        if (last.isEmpty()) {
            sample = new CounterSample(now, reading.value(), 0.0, 0.0, reading.metricUnit());
        } else {
            CounterSample previous = last.get();
            double difference = DeltaEngine.delta(previous.value(), reading.value());
            if (difference <= 0.0 && !checkpoint) {
                log.debug("shiftwatch counter unchanged series={} value={}", seriesKey, reading.value());
                return Optional.empty();
            }
            double speed = DeltaEngine.speed(difference, elapsedSeconds(previous.timestamp(), now));
            sample = new CounterSample(now, reading.value(), difference, speed, reading.metricUnit());
        }

        store.append(seriesKey, sample);
        return Optional.of(sample);
    }

    /**
     * Record a snapshot of a simple or multi-sensor job.
     */
    public SnapshotSample recordSnapshot(String seriesKey, List<TitledValue> values) {
        SnapshotSample sample = new SnapshotSample(clock.instant(), values);
        store.append(seriesKey, sample);
        return sample;
    }

    public Optional<SnapshotSample> lastSnapshot(String seriesKey) {
        return store.last(seriesKey)
                .filter(SnapshotSample.class::isInstance)
                .map(SnapshotSample.class::cast);
    }

    public Optional<CounterSample> lastCounter(String seriesKey) {
        return store.last(seriesKey)
                .filter(CounterSample.class::isInstance)
                .map(CounterSample.class::cast);
    }

    /**
     * Production of the running shift: counter growth since the last shift-report checkpoint.
     *
     * @param seriesKey    base series of the job
     * @param currentValue counter value just recorded
     * @param withSpeed    also compute the hourly rate since the checkpoint
     */
    public ShiftProduction shiftProduction(String seriesKey, double currentValue, boolean withSpeed) {
        String reportSeries = ShiftReportNames.reportSeries(seriesKey);
        if (!store.seriesExists(reportSeries)) {
            return ShiftProduction.none();
        }

        Optional<CounterSample> checkpoint = lastCounter(reportSeries);
        if (checkpoint.isEmpty()) {
            return ShiftProduction.none();
        }

        double produced = DeltaEngine.delta(checkpoint.get().value(), currentValue);
        double shiftSpeed = 0.0;
        if (withSpeed) {
            shiftSpeed = DeltaEngine.speed(produced, elapsedSeconds(checkpoint.get().timestamp(), clock.instant()));
        }
        return new ShiftProduction(produced, shiftSpeed, true);
    }

    /**
     * Day total for a report: the difference stored one record before the most recent one plus the
     * current difference.
     *
     * <p>The lookup is positional, so around the calendar-day boundary the earlier record may
     * belong to another day.
     */
    public double dayProduction(String reportSeries, double currentDifference) {
        Optional<SampleRecord> earlier = store.last(reportSeries, 1);
        double earlierDifference = earlier
                .filter(CounterSample.class::isInstance)
                .map(r -> ((CounterSample) r).difference())
                .orElse(0.0);
        return earlierDifference + currentDifference;
    }

    private static double elapsedSeconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
