package com.fever.assessment.dto;

public class AnalysisView {
  private int risk_score;
  private String risk_level;
  private String suspected_fever_type;
  private String recommendation;

  public int getRisk_score() {
    return risk_score;
  }

  public void setRisk_score(int risk_score) {
    this.risk_score = risk_score;
  }

  public String getRisk_level() {
    return risk_level;
  }

  public void setRisk_level(String risk_level) {
    this.risk_level = risk_level;
  }

  public String getSuspected_fever_type() {
    return suspected_fever_type;
  }

  public void setSuspected_fever_type(String suspected_fever_type) {
    this.suspected_fever_type = suspected_fever_type;
  }

  public String getRecommendation() {
    return recommendation;
  }

  public void setRecommendation(String recommendation) {
    this.recommendation = recommendation;
  }
}
