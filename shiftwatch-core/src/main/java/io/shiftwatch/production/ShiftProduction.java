package io.shiftwatch.production;

/**
 * Output of the current shift measured against the last shift-report checkpoint.
 *
 * @param produced      increment since the checkpoint, 0 when there is no checkpoint
 * @param shiftSpeed    hourly rate since the checkpoint, 0 unless requested
 * @param hasCheckpoint whether a checkpoint existed
 */
public record ShiftProduction(double produced, double shiftSpeed, boolean hasCheckpoint) {

    public static ShiftProduction none() {
        return new ShiftProduction(0.0, 0.0, false);
    }
}
