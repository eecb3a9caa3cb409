package com.fever.assessment.engine;

/**
 * A step identifier that the local catalog does not know, usually a sign that the remote backend
 * runs a different question set.
 */
public class ProtocolMismatchException extends RuntimeException {
  private final String stepId;

  public ProtocolMismatchException(String stepId, String message) {
    super(message);
    this.stepId = stepId;
  }

  public static ProtocolMismatchException unknownStep(String stepId) {
    return new ProtocolMismatchException(stepId, "Unknown dialogue step '" + stepId + "'");
  }

  public String getStepId() {
    return stepId;
  }
}
