package com.fever.assessment.model;

import java.util.Objects;

/**
 * Terminal output of an assessment. Level and recommendation are derived from the score and the
 * category; there is no way to set them independently.
 */
public final class Analysis {
  private final int riskScore;
  private final RiskLevel riskLevel;
  private final String suspectedFeverType;
  private final String recommendation;

  private Analysis(int riskScore, String suspectedFeverType) {
    this.riskScore = riskScore;
    this.riskLevel = RiskLevel.fromScore(riskScore);
    this.suspectedFeverType = suspectedFeverType;
    this.recommendation = Recommendations.forAnalysis(riskLevel, suspectedFeverType);
  }

  public static Analysis of(int riskScore, String suspectedFeverType) {
    int clamped = Math.max(0, Math.min(100, riskScore));
    String type = suspectedFeverType == null || suspectedFeverType.isBlank()
        ? FeverTypes.VIRAL_FEVER
        : suspectedFeverType.trim();
    return new Analysis(clamped, type);
  }

  public int getRiskScore() {
    return riskScore;
  }

  public RiskLevel getRiskLevel() {
    return riskLevel;
  }

  public String getSuspectedFeverType() {
    return suspectedFeverType;
  }

  public String getRecommendation() {
    return recommendation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Analysis other)) {
      return false;
    }
    return riskScore == other.riskScore && suspectedFeverType.equals(other.suspectedFeverType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(riskScore, suspectedFeverType);
  }

  @Override
  public String toString() {
    return "Analysis{score=" + riskScore + ", level=" + riskLevel.getLabel()
        + ", type='" + suspectedFeverType + "'}";
  }
}
