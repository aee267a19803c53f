package io.shiftwatch.shift;

import java.time.ZonedDateTime;

/**
 * Half-open reporting window {@code [start, end)} of one shift. Derived, never persisted.
 */
public record ShiftWindow(ZonedDateTime start, ZonedDateTime end, Shift shift) {

    public String label() {
        return shift.label();
    }

    public boolean contains(ZonedDateTime t) {
        return !t.isBefore(start) && t.isBefore(end);
    }
}
