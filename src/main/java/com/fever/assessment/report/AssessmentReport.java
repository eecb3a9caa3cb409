package com.fever.assessment.report;

import com.fever.assessment.model.Analysis;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class AssessmentReport {
  private final String sessionId;
  private final Analysis analysis;
  private final Map<String, Object> answers;
  private final Instant completedAt;

  public AssessmentReport(String sessionId, Analysis analysis, Map<String, Object> answers,
                          Instant completedAt) {
    this.sessionId = sessionId;
    this.analysis = analysis;
    this.answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    this.completedAt = completedAt;
  }

  public String getSessionId() {
    return sessionId;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public Map<String, Object> getAnswers() {
    return answers;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }
}
