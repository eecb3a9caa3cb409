package com.fever.assessment.model;

public enum RiskLevel {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String label;

  RiskLevel(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** high above 70, medium above 50, low otherwise. */
  public static RiskLevel fromScore(int riskScore) {
    if (riskScore > 70) {
      return HIGH;
    }
    if (riskScore > 50) {
      return MEDIUM;
    }
    return LOW;
  }
}
