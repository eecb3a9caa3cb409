package com.fever.assessment.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Guidance text for a finished assessment. Selected by risk level; the two no-fever categories
 * carry their own wording, but only while the level is low.
 */
public final class Recommendations {

  private static final Map<RiskLevel, String> BY_LEVEL = new EnumMap<>(RiskLevel.class);
  private static final Map<String, String> LOW_RISK_BY_CATEGORY = Map.of(
      FeverTypes.GENERAL_SYMPTOMS,
      "Rest and stay hydrated. If symptoms persist, consider consulting a doctor.",
      FeverTypes.NO_FEVER,
      "You appear to be in good health. Continue monitoring your symptoms.");

  static {
    BY_LEVEL.put(RiskLevel.HIGH,
        "Please consult a doctor immediately. Your temperature is high and requires medical attention.");
    BY_LEVEL.put(RiskLevel.MEDIUM,
        "Monitor your symptoms and consider consulting a doctor if they worsen.");
    BY_LEVEL.put(RiskLevel.LOW, "Rest and stay hydrated. Monitor your symptoms.");
  }

  private Recommendations() {
  }

  public static String forLevel(RiskLevel level) {
    return BY_LEVEL.get(level);
  }

  public static String forAnalysis(RiskLevel level, String suspectedFeverType) {
    if (level == RiskLevel.LOW && suspectedFeverType != null) {
      String categoryText = LOW_RISK_BY_CATEGORY.get(suspectedFeverType);
      if (categoryText != null) {
        return categoryText;
      }
    }
    return forLevel(level);
  }
}
