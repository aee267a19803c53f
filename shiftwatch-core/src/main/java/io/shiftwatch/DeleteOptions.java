package io.shiftwatch;

/**
 * Options for {@link JobManager#deleteJob(String, DeleteOptions)}.
 *
 * <ul>
 *   <li>removeSeries: also drop the job's production series</li>
 *   <li>deleteShiftChildren: also remove both shift-report children and their shared report series</li>
 * </ul>
 */
public record DeleteOptions(boolean removeSeries, boolean deleteShiftChildren) {

    public static DeleteOptions defaults() {
        return new DeleteOptions(false, false);
    }

    public static DeleteOptions all() {
        return new DeleteOptions(true, true);
    }
}
