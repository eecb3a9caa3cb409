package com.fever.assessment.model;

import java.util.List;

/**
 * A user reply interpreted against the question it answers. The {@link Kind} decides which
 * accessor carries the value.
 */
public final class Answer {

  public enum Kind {
    AFFIRMATIVE,
    NEGATIVE,
    NUMBER,
    TEXT,
    CHOICES,
    UNRECOGNIZED
  }

  private final Kind kind;
  private final String raw;
  private final double number;
  private final String text;
  private final List<String> choices;

  private Answer(Kind kind, String raw, double number, String text, List<String> choices) {
    this.kind = kind;
    this.raw = raw == null ? "" : raw;
    this.number = number;
    this.text = text;
    this.choices = choices;
  }

  public static Answer affirmative(String raw) {
    return new Answer(Kind.AFFIRMATIVE, raw, Double.NaN, null, List.of());
  }

  public static Answer negative(String raw) {
    return new Answer(Kind.NEGATIVE, raw, Double.NaN, null, List.of());
  }

  public static Answer number(String raw, double value) {
    return new Answer(Kind.NUMBER, raw, value, null, List.of());
  }

  public static Answer text(String raw, String value) {
    return new Answer(Kind.TEXT, raw, Double.NaN, value, List.of());
  }

  public static Answer choices(String raw, List<String> values) {
    return new Answer(Kind.CHOICES, raw, Double.NaN, null, List.copyOf(values));
  }

  public static Answer unrecognized(String raw) {
    return new Answer(Kind.UNRECOGNIZED, raw, Double.NaN, null, List.of());
  }

  public Kind getKind() {
    return kind;
  }

  public String getRaw() {
    return raw;
  }

  public double getNumber() {
    if (kind != Kind.NUMBER) {
      throw new IllegalStateException("Answer is not numeric: " + kind);
    }
    return number;
  }

  public String getText() {
    if (kind != Kind.TEXT) {
      throw new IllegalStateException("Answer is not text: " + kind);
    }
    return text;
  }

  public List<String> getChoices() {
    return choices;
  }

  @Override
  public String toString() {
    return "Answer{" + kind + ", raw='" + raw + "'}";
  }
}
