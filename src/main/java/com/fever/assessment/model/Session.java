package com.fever.assessment.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Working state of one assessment conversation. Owned by a single
 * {@link com.fever.assessment.conversation.SessionController}; never shared.
 */
public class Session {
  public static final String LOCAL_PREFIX = "local-";

  private final String sessionId;
  private String currentStep;
  private final Map<String, Object> answers = new LinkedHashMap<>();
  private Question currentQuestion;
  private Analysis analysis;
  private boolean completed;
  private Instant lastUpdated;

  public Session(String sessionId, String currentStep, Map<String, Object> answers,
                 Instant lastUpdated) {
    this.sessionId = sessionId;
    this.currentStep = currentStep;
    if (answers != null) {
      this.answers.putAll(answers);
    }
    this.lastUpdated = lastUpdated;
  }

  public static Session local() {
    return new Session(LOCAL_PREFIX + UUID.randomUUID(), Step.START.getId(), Map.of(), Instant.now());
  }

  public static Session remote(String sessionId, String currentStep) {
    if (sessionId == null || sessionId.isBlank() || sessionId.startsWith(LOCAL_PREFIX)) {
      throw new IllegalArgumentException("Invalid remote session id: " + sessionId);
    }
    return new Session(sessionId, currentStep, Map.of(), Instant.now());
  }

  /**
   * Local session that picks up where a remote one stopped, keeping its answers.
   */
  public static Session localContinuation(Session remote, String anchorStep) {
    return new Session(LOCAL_PREFIX + remote.getSessionId(), anchorStep, remote.getAnswers(),
        Instant.now());
  }

  public String getSessionId() {
    return sessionId;
  }

  public SessionMode getMode() {
    return sessionId.startsWith(LOCAL_PREFIX) ? SessionMode.LOCAL : SessionMode.REMOTE;
  }

  public String getCurrentStep() {
    return currentStep;
  }

  public void setCurrentStep(String currentStep) {
    this.currentStep = currentStep;
    touch();
  }

  public Map<String, Object> getAnswers() {
    return Collections.unmodifiableMap(answers);
  }

  public void replaceAnswers(Map<String, Object> updated) {
    answers.clear();
    if (updated != null) {
      answers.putAll(updated);
    }
    touch();
  }

  public Question getCurrentQuestion() {
    return currentQuestion;
  }

  public void setCurrentQuestion(Question currentQuestion) {
    this.currentQuestion = currentQuestion;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public boolean isCompleted() {
    return completed;
  }

  public void complete(Analysis analysis) {
    this.analysis = analysis;
    this.completed = true;
    this.currentStep = Step.COMPLETE.getId();
    this.currentQuestion = null;
    touch();
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }

  private void touch() {
    this.lastUpdated = Instant.now();
  }
}
