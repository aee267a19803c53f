package io.shiftwatch.core;

import java.util.List;

/**
 * Naming rules tying a base job to its shift-report children and series.
 */
public final class ShiftReportNames {

    public static final String REPORT_SUFFIX = "_shift_report";
    public static final String AM_SUFFIX = REPORT_SUFFIX + "_am";
    public static final String PM_SUFFIX = REPORT_SUFFIX + "_pm";

    private ShiftReportNames() {
    }

    public static boolean isChild(String jobName) {
        return jobName.endsWith(AM_SUFFIX) || jobName.endsWith(PM_SUFFIX);
    }

    /**
     * {@code line_a_counter} -> {@code line_a_counter_shift_report}.
     */
    public static String reportSeries(String baseName) {
        return baseName + REPORT_SUFFIX;
    }

    public static List<String> children(String baseName) {
        return List.of(baseName + AM_SUFFIX, baseName + PM_SUFFIX);
    }

    /**
     * Series written by a report child: strips the trailing {@code _am}/{@code _pm}.
     */
    public static String seriesOfChild(String childName) {
        if (isChild(childName)) {
            return childName.substring(0, childName.length() - 3);
        }
        return childName;
    }

    /**
     * Base series a report series summarises: strips {@code _shift_report}.
     */
    public static String baseSeries(String seriesKey) {
        if (seriesKey.endsWith(REPORT_SUFFIX)) {
            return seriesKey.substring(0, seriesKey.length() - REPORT_SUFFIX.length());
        }
        return seriesKey;
    }
}
