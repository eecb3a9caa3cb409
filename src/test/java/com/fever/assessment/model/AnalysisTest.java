package com.fever.assessment.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class AnalysisTest {

  @Test
  @DisplayName("risk level bands: above 70 high, above 50 medium, otherwise low")
  public void levelBands() {
    assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(71));
    assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(70));
    assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(51));
    assertEquals(RiskLevel.LOW, RiskLevel.fromScore(50));
    assertEquals(RiskLevel.LOW, RiskLevel.fromScore(0));
  }

  @Test
  public void levelAndRecommendationFollowScore() {
    for (int score = 0; score <= 100; score++) {
      Analysis analysis = Analysis.of(score, FeverTypes.VIRAL_FEVER);
      assertEquals(RiskLevel.fromScore(score), analysis.getRiskLevel());
      assertEquals(Recommendations.forLevel(analysis.getRiskLevel()), analysis.getRecommendation());
    }
  }

  @Test
  public void lowRiskCategoriesKeepTheirOwnWording() {
    assertEquals("Rest and stay hydrated. If symptoms persist, consider consulting a doctor.",
        Analysis.of(40, FeverTypes.GENERAL_SYMPTOMS).getRecommendation());
    assertEquals("You appear to be in good health. Continue monitoring your symptoms.",
        Analysis.of(20, FeverTypes.NO_FEVER).getRecommendation());
    assertEquals(Recommendations.forLevel(RiskLevel.HIGH),
        Analysis.of(80, FeverTypes.NO_FEVER).getRecommendation());
  }

  @Test
  public void scoreIsClampedAndTypeDefaulted() {
    assertEquals(100, Analysis.of(140, "Viral Fever").getRiskScore());
    assertEquals(0, Analysis.of(-5, "Viral Fever").getRiskScore());
    assertEquals(FeverTypes.VIRAL_FEVER, Analysis.of(60, " ").getSuspectedFeverType());
    assertEquals(Analysis.of(75, FeverTypes.VIRAL_FEVER), Analysis.of(75, null));
  }
}
