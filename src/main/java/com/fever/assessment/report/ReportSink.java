package com.fever.assessment.report;

/**
 * Persistence collaborator for finished assessments. Called off the conversation path; a failure
 * here never affects the completed conversation.
 */
public interface ReportSink {

  /**
   * @throws ReportSubmissionException when the report could not be stored
   */
  void submit(AssessmentReport report);
}
