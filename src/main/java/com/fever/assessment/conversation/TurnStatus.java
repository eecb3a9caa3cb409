package com.fever.assessment.conversation;

public enum TurnStatus {
  /** A question was presented or the assessment completed. */
  OK,
  /** The answer did not fit the question; the same question stands. */
  REPROMPT,
  /** Another answer is still being processed, or the session is still starting. */
  BUSY,
  /** The answer arrived after completion, or for a discarded session, and had no effect. */
  IGNORED
}
