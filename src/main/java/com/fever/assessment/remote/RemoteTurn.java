package com.fever.assessment.remote;

import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One reply of the remote dialogue backend, translated into local types. The step identifier is
 * kept exactly as the backend reported it.
 */
public class RemoteTurn {
  private final String sessionId;
  private final String stepId;
  private final Question question;
  private final String message;
  private final Map<String, Object> answers;
  private final Analysis analysis;

  public RemoteTurn(String sessionId, String stepId, Question question, String message,
                    Map<String, Object> answers, Analysis analysis) {
    this.sessionId = sessionId;
    this.stepId = stepId;
    this.question = question;
    this.message = message;
    this.answers = answers == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    this.analysis = analysis;
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getStepId() {
    return stepId;
  }

  public Question getQuestion() {
    return question;
  }

  public String getMessage() {
    return message;
  }

  public Map<String, Object> getAnswers() {
    return answers;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public boolean isCompleted() {
    return analysis != null;
  }
}
