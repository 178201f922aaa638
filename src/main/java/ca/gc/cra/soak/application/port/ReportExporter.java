package ca.gc.cra.soak.application.port;

import ca.gc.cra.soak.domain.report.FinalReport;

/**
 * Renders a completed {@link FinalReport} to an external format (JSON, HTML, CSV, text).
 *
 * @since SOAK 0.1
 */
@FunctionalInterface
public interface ReportExporter {
  /**
   * Exports the report.
   *
   * @param report immutable final report
   * @throws Exception when rendering or writing fails
   */
  void export(FinalReport report) throws Exception;
}
