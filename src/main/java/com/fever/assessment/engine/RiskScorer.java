package com.fever.assessment.engine;

import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.FeverTypes;

public class RiskScorer {
  static final int HIGH_FEVER_SCORE = 75;
  static final int FEVER_SCORE = 50;
  static final int MILD_SCORE = 30;
  static final int GENERAL_SYMPTOMS_SCORE = 40;
  static final int NO_FEVER_SCORE = 20;

  /** Strictly above 39.0 is 75, strictly above 38.0 is 50, anything else 30. */
  public int scoreTemperature(double celsius) {
    if (celsius > 39.0) {
      return HIGH_FEVER_SCORE;
    }
    if (celsius > 38.0) {
      return FEVER_SCORE;
    }
    return MILD_SCORE;
  }

  public Analysis feverAnalysis(double celsius) {
    return Analysis.of(scoreTemperature(celsius), FeverTypes.VIRAL_FEVER);
  }

  public Analysis generalSymptomsAnalysis() {
    return Analysis.of(GENERAL_SYMPTOMS_SCORE, FeverTypes.GENERAL_SYMPTOMS);
  }

  public Analysis noFeverAnalysis() {
    return Analysis.of(NO_FEVER_SCORE, FeverTypes.NO_FEVER);
  }
}
