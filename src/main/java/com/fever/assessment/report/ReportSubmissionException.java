package com.fever.assessment.report;

public class ReportSubmissionException extends RuntimeException {

  public ReportSubmissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
