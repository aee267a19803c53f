package io.shiftwatch.production;

import io.shiftwatch.core.CounterSample;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.support.InMemoryTimeSeriesStore;
import io.shiftwatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProductionRecorderTest {

    private static final String SERIES = "line_a_counter";
    private static final String REPORT = "line_a_counter_shift_report";

    private InMemoryTimeSeriesStore store;
    private MutableClock clock;
    private ProductionRecorder recorder;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
        clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));
        recorder = new ProductionRecorder(store, clock);
        store.createSeries(SERIES);
    }

    @Test
    void firstReadingShouldBeStoredAsBaseline() {
        Optional<CounterSample> stored = recorder.recordCounter(SERIES, counter(100), false);

        assertTrue(stored.isPresent());
        assertEquals(0.0, stored.get().difference());
        assertEquals(0.0, stored.get().speed());
        assertEquals(1, store.records(SERIES).size());
    }

    @Test
    void growingCounterShouldStoreDifferenceAndSpeed() {
        recorder.recordCounter(SERIES, counter(100), false);
        clock.advance(Duration.ofMinutes(15));

        CounterSample sample = recorder.recordCounter(SERIES, counter(150), false).orElseThrow();

        assertEquals(150.0, sample.value());
        assertEquals(50.0, sample.difference());
        assertEquals(200.0, sample.speed(), 1e-9);
        assertEquals("pcs", sample.metricUnit());
    }

    @Test
    void unchangedCounterShouldNotBeStored() {
        recorder.recordCounter(SERIES, counter(100), false);
        clock.advance(Duration.ofMinutes(15));

        assertFalse(recorder.recordCounter(SERIES, counter(100), false).isPresent());
        assertEquals(1, store.records(SERIES).size());
    }

    @Test
    void checkpointShouldBeStoredEvenWhenUnchanged() {
        store.createSeries(REPORT);
        recorder.recordCounter(REPORT, counter(100), true);
        clock.advance(Duration.ofHours(12));

        CounterSample sample = recorder.recordCounter(REPORT, counter(100), true).orElseThrow();

        assertEquals(0.0, sample.difference());
        assertEquals(2, store.records(REPORT).size());
    }

    @Test
    void counterResetShouldStoreValueSinceRestart() {
        recorder.recordCounter(SERIES, counter(150), false);
        clock.advance(Duration.ofMinutes(15));

        CounterSample sample = recorder.recordCounter(SERIES, counter(40), false).orElseThrow();

        assertEquals(40.0, sample.difference());
    }

    @Test
    void shiftProductionShouldBeMeasuredFromLastCheckpoint() {
        assertEquals(ShiftProduction.none(), recorder.shiftProduction(SERIES, 160, true));

        store.createSeries(REPORT);
        recorder.recordCounter(REPORT, counter(100), true);
        clock.advance(Duration.ofHours(1));

        ShiftProduction production = recorder.shiftProduction(SERIES, 160, true);

        assertTrue(production.hasCheckpoint());
        assertEquals(60.0, production.produced());
        assertEquals(60.0, production.shiftSpeed(), 1e-9);
        assertEquals(0.0, recorder.shiftProduction(SERIES, 160, false).shiftSpeed());
    }

    @Test
    void dayProductionShouldAddRecordBeforeLatest() {
        store.append(REPORT, new CounterSample(clock.instant(), 1000, 300, 25, "pcs"));
        store.append(REPORT, new CounterSample(clock.instant().plusSeconds(43200), 1500, 500, 41, "pcs"));

        assertEquals(800.0, recorder.dayProduction(REPORT, 500));
    }

    @Test
    void dayProductionShouldTakeRecordBeforeLatestEvenFromPreviousCalendarDay() {
        // positional: the record before the latest counts whatever day it belongs to
        store.append(REPORT, new CounterSample(Instant.parse("2026-03-09T20:00:30Z"), 1000, 700, 58, "pcs"));
        store.append(REPORT, new CounterSample(Instant.parse("2026-03-10T08:00:30Z"), 1300, 300, 25, "pcs"));
        store.append(REPORT, new CounterSample(Instant.parse("2026-03-11T08:00:30Z"), 1700, 400, 16, "pcs"));

        assertEquals(700.0, recorder.dayProduction(REPORT, 400));
    }

    @Test
    void dayProductionWithSingleRecordShouldFallBackToCurrentDifference() {
        // Only one checkpoint: the positional lookup finds nothing before it.
        store.append(REPORT, new CounterSample(clock.instant(), 1500, 500, 41, "pcs"));

        assertEquals(500.0, recorder.dayProduction(REPORT, 500));
    }

    private static TitledValue counter(double value) {
        return new TitledValue("Counter", value, "pcs");
    }
}
