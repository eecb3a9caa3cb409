package com.fever.assessment.conversation;

import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.SessionMode;

/**
 * Snapshot of a conversation after one operation, as shown to the user.
 */
public class ConversationTurn {
  private final TurnStatus status;
  private final String sessionId;
  private final SessionMode mode;
  private final ControllerState state;
  private final String currentStep;
  private final String message;
  private final Question question;
  private final Analysis analysis;

  public ConversationTurn(TurnStatus status, String sessionId, SessionMode mode,
                          ControllerState state, String currentStep, String message,
                          Question question, Analysis analysis) {
    this.status = status;
    this.sessionId = sessionId;
    this.mode = mode;
    this.state = state;
    this.currentStep = currentStep;
    this.message = message;
    this.question = question;
    this.analysis = analysis;
  }

  public TurnStatus getStatus() {
    return status;
  }

  public String getSessionId() {
    return sessionId;
  }

  public SessionMode getMode() {
    return mode;
  }

  public ControllerState getState() {
    return state;
  }

  public String getCurrentStep() {
    return currentStep;
  }

  public String getMessage() {
    return message;
  }

  public Question getQuestion() {
    return question;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public boolean isCompleted() {
    return state == ControllerState.COMPLETED;
  }
}
