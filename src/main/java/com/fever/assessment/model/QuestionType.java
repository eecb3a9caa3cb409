package com.fever.assessment.model;

import java.util.Locale;

public enum QuestionType {
  YES_NO("yes_no"),
  CHOICE("choice"),
  MULTI_CHOICE("multi_choice"),
  NUMERIC_FREE_TEXT("numeric_free_text");

  private final String wireName;

  QuestionType(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * Maps a type name reported by the dialogue backend. The backend also uses {@code number},
   * {@code text} and {@code end}; all of them take a free-text reply.
   */
  public static QuestionType fromWire(String value) {
    if (value == null || value.isBlank()) {
      return NUMERIC_FREE_TEXT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (QuestionType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    return NUMERIC_FREE_TEXT;
  }
}
