package io.shiftwatch.shift;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShiftClockTest {

    private static final LocalTime FIRST = LocalTime.of(8, 0);
    private static final LocalTime SECOND = LocalTime.of(20, 0);

    @Test
    void lastSecondBeforeFirstStartShouldBelongToPreviousNight() {
        ShiftWindow w = compute("2026-03-10T07:59:59Z", Duration.ZERO, false);

        assertEquals(Shift.NIGHT, w.shift());
        assertEquals(at("2026-03-09T20:00:00Z"), w.start());
        assertEquals(at("2026-03-10T08:00:00Z"), w.end());
    }

    @Test
    void firstStartShouldOpenDayShift() {
        ShiftWindow w = compute("2026-03-10T08:00:00Z", Duration.ZERO, false);

        assertEquals(Shift.DAY, w.shift());
        assertEquals(at("2026-03-10T08:00:00Z"), w.start());
        assertEquals(at("2026-03-10T20:00:00Z"), w.end());
    }

    @Test
    void lastSecondBeforeSecondStartShouldStillBeDay() {
        ShiftWindow w = compute("2026-03-10T19:59:59Z", Duration.ZERO, false);

        assertEquals(Shift.DAY, w.shift());
        assertEquals(at("2026-03-10T08:00:00Z"), w.start());
    }

    @Test
    void nightShouldWrapIntoNextDay() {
        ShiftWindow w = compute("2026-03-10T20:00:00Z", Duration.ZERO, false);

        assertEquals(Shift.NIGHT, w.shift());
        assertEquals(at("2026-03-10T20:00:00Z"), w.start());
        assertEquals(at("2026-03-11T08:00:00Z"), w.end());
    }

    @Test
    void lookbackShouldMoveReportJustAfterBoundaryIntoEndedShift() {
        ShiftWindow w = compute("2026-03-10T08:00:30Z", Duration.ofHours(1), false);

        assertEquals(Shift.NIGHT, w.shift());
        assertEquals(at("2026-03-09T20:00:00Z"), w.start());
        assertEquals(at("2026-03-10T08:00:00Z"), w.end());
    }

    @Test
    void previousDuringDayShouldReturnLastNight() {
        ShiftWindow w = compute("2026-03-10T10:00:00Z", Duration.ofHours(1), true);

        assertEquals(Shift.NIGHT, w.shift());
        assertEquals(at("2026-03-09T20:00:00Z"), w.start());
        assertEquals(at("2026-03-10T08:00:00Z"), w.end());
    }

    @Test
    void previousDuringNightShouldReturnThatDaysDayShift() {
        ShiftWindow afterMidnight = compute("2026-03-10T02:00:00Z", Duration.ZERO, true);
        ShiftWindow beforeMidnight = compute("2026-03-10T22:00:00Z", Duration.ZERO, true);

        assertEquals(Shift.DAY, afterMidnight.shift());
        assertEquals(at("2026-03-09T08:00:00Z"), afterMidnight.start());
        assertEquals(at("2026-03-09T20:00:00Z"), afterMidnight.end());

        assertEquals(Shift.DAY, beforeMidnight.shift());
        assertEquals(at("2026-03-10T08:00:00Z"), beforeMidnight.start());
    }

    @Test
    void windowShouldBeHalfOpen() {
        ShiftWindow w = compute("2026-03-10T12:00:00Z", Duration.ZERO, false);

        assertTrue(w.contains(at("2026-03-10T08:00:00Z")));
        assertFalse(w.contains(at("2026-03-10T20:00:00Z")));
    }

    @Test
    void shiftBoundariesShouldBeTruncatedToMinutes() {
        ShiftClock clock = new ShiftClock(LocalTime.of(8, 0, 45), SECOND,
                Clock.fixed(Instant.parse("2026-03-10T08:00:10Z"), ZoneOffset.UTC));

        assertEquals(LocalTime.of(8, 0), clock.firstShiftStart());
        assertEquals(Shift.DAY, clock.current().shift());
        assertEquals(0, clock.current().start().getSecond());
    }

    @Test
    void shouldRejectFirstShiftNotBeforeSecond() {
        Clock clock = Clock.systemUTC();
        assertThrows(IllegalArgumentException.class, () -> new ShiftClock(SECOND, FIRST, clock));
        assertThrows(IllegalArgumentException.class, () -> new ShiftClock(FIRST, FIRST, clock));
    }

    @Test
    void shouldUseClockZone() {
        ZoneId zone = ZoneId.of("Europe/Moscow");
        ShiftClock clock = new ShiftClock(FIRST, SECOND, Clock.fixed(Instant.parse("2026-03-10T05:30:00Z"), zone));

        ShiftWindow w = clock.current();

        assertEquals(Shift.DAY, w.shift());
        assertEquals(ZonedDateTime.of(2026, 3, 10, 8, 0, 0, 0, zone), w.start());
    }

    @Test
    void startOfWeekShouldBeMondayMidnight() {
        ShiftClock clock = new ShiftClock(FIRST, SECOND,
                Clock.fixed(Instant.parse("2026-03-12T15:00:00Z"), ZoneOffset.UTC));

        assertEquals(at("2026-03-09T00:00:00Z"), clock.startOfWeek());
    }

    private static ShiftWindow compute(String now, Duration lookback, boolean previous) {
        return ShiftClock.computeShift(at(now), FIRST, SECOND, lookback, previous);
    }

    private static ZonedDateTime at(String instant) {
        return Instant.parse(instant).atZone(ZoneOffset.UTC);
    }
}
