package com.fever.assessment.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no report backend is configured.
 */
public class LoggingReportSink implements ReportSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingReportSink.class);

  @Override
  public void submit(AssessmentReport report) {
    log.info("Assessment report: session={}, score={}, level={}, type='{}'",
        report.getSessionId(),
        report.getAnalysis().getRiskScore(),
        report.getAnalysis().getRiskLevel().getLabel(),
        report.getAnalysis().getSuspectedFeverType());
  }
}
