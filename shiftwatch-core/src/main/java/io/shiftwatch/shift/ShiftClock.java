package io.shiftwatch.shift;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Two-shift calendar: Day runs from the first shift start (inclusive) to the second shift start
 * (exclusive), Night covers the rest and wraps across midnight.
 */
public class ShiftClock {

    private final LocalTime firstShiftStart;
    private final LocalTime secondShiftStart;
    private final Clock clock;

    public ShiftClock(LocalTime firstShiftStart, LocalTime secondShiftStart, Clock clock) {
        this.firstShiftStart = Objects.requireNonNull(firstShiftStart, "firstShiftStart must not be null")
                .truncatedTo(ChronoUnit.MINUTES);
        this.secondShiftStart = Objects.requireNonNull(secondShiftStart, "secondShiftStart must not be null")
                .truncatedTo(ChronoUnit.MINUTES);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (!this.firstShiftStart.isBefore(this.secondShiftStart)) {
            throw new IllegalArgumentException("first shift must start before second shift: "
                    + firstShiftStart + " / " + secondShiftStart);
        }
    }

    /**
     * Computes the shift window for an instant.
     *
     * @param now              instant to classify, in the plant's zone
     * @param firstShiftStart  Day shift start
     * @param secondShiftStart Night shift start
     * @param lookback         moves {@code now} back before classification; ignored when {@code previous}
     * @param previous         return the shift before the one {@code now} falls into
     */
    public static ShiftWindow computeShift(ZonedDateTime now,
                                           LocalTime firstShiftStart,
                                           LocalTime secondShiftStart,
                                           Duration lookback,
                                           boolean previous) {
        Objects.requireNonNull(now, "now must not be null");
        ZonedDateTime t = (previous || lookback == null) ? now : now.minus(lookback);
        ZoneId zone = t.getZone();
        LocalDate date = t.toLocalDate();
        LocalTime time = t.toLocalTime();

        boolean inDay = !time.isBefore(firstShiftStart) && time.isBefore(secondShiftStart);
        if (inDay) {
            if (!previous) {
                return new ShiftWindow(at(date, firstShiftStart, zone), at(date, secondShiftStart, zone), Shift.DAY);
            }
            return new ShiftWindow(at(date.minusDays(1), secondShiftStart, zone), at(date, firstShiftStart, zone),
                    Shift.NIGHT);
        }

        LocalDate nightDate = time.isBefore(firstShiftStart) ? date.minusDays(1) : date;
        if (!previous) {
            return new ShiftWindow(at(nightDate, secondShiftStart, zone),
                    at(nightDate.plusDays(1), firstShiftStart, zone), Shift.NIGHT);
        }
        return new ShiftWindow(at(nightDate, firstShiftStart, zone), at(nightDate, secondShiftStart, zone), Shift.DAY);
    }

    /**
     * The shift running right now.
     */
    public ShiftWindow current() {
        return computeShift(now(), firstShiftStart, secondShiftStart, Duration.ZERO, false);
    }

    /**
     * Window a shift report covers: the shift running {@code lookback} ago, or with
     * {@code previous} the shift before the current one.
     */
    public ShiftWindow reportWindow(Duration lookback, boolean previous) {
        return computeShift(now(), firstShiftStart, secondShiftStart, lookback, previous);
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    public ZonedDateTime startOfWeek() {
        return now().toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .atStartOfDay(clock.getZone());
    }

    public LocalTime firstShiftStart() {
        return firstShiftStart;
    }

    public LocalTime secondShiftStart() {
        return secondShiftStart;
    }

    private static ZonedDateTime at(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone);
    }
}
