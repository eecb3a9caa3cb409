package com.fever.assessment.model;

import java.util.Optional;

/**
 * Named points of the assessment dialogue. The identifier is the value carried in
 * {@link Session#getCurrentStep()} and on the wire.
 */
public enum Step {
  START("start"),
  FEVER_DURATION("fever_duration"),
  TEMPERATURE("temperature"),
  OTHER_SYMPTOMS("other_symptoms"),
  COMPLETE("complete");

  private final String id;

  Step(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public static Optional<Step> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String trimmed = id.trim();
    for (Step step : values()) {
      if (step.id.equals(trimmed)) {
        return Optional.of(step);
      }
    }
    return Optional.empty();
  }
}
