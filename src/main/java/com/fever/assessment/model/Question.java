package com.fever.assessment.model;

import java.util.List;
import java.util.Objects;

public class Question {
  private final String key;
  private final QuestionType type;
  private final String prompt;
  private final List<String> options;

  public Question(String key, QuestionType type, String prompt, List<String> options) {
    this.key = Objects.requireNonNull(key, "key");
    this.type = Objects.requireNonNull(type, "type");
    this.prompt = prompt == null ? "" : prompt;
    this.options = options == null ? List.of() : List.copyOf(options);
  }

  public static Question yesNo(String key, String prompt) {
    return new Question(key, QuestionType.YES_NO, prompt, List.of("Yes", "No"));
  }

  public static Question choice(String key, String prompt, List<String> options) {
    return new Question(key, QuestionType.CHOICE, prompt, options);
  }

  public static Question freeText(String key, String prompt) {
    return new Question(key, QuestionType.NUMERIC_FREE_TEXT, prompt, List.of());
  }

  public String getKey() {
    return key;
  }

  public QuestionType getType() {
    return type;
  }

  public String getPrompt() {
    return prompt;
  }

  public List<String> getOptions() {
    return options;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Question other)) {
      return false;
    }
    return key.equals(other.key) && type == other.type && prompt.equals(other.prompt)
        && options.equals(other.options);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, type, prompt, options);
  }

  @Override
  public String toString() {
    return "Question{key='" + key + "', type=" + type + "}";
  }
}
