package io.shiftwatch.report;

import io.shiftwatch.notify.Attachment;

import java.util.List;

/**
 * Renders charts attached to shift reports. Reports are text-only when no provider is configured.
 */
public interface ReportChartProvider {

    List<Attachment> render(ReportContext context);
}
