package com.fever.assessment.catalog;

import com.fever.assessment.model.Question;
import com.fever.assessment.model.Step;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Static question table, keyed by step identifier. The terminal {@code complete} step has no
 * question.
 */
@Component
public class QuestionCatalog {
  public static final String START_PROMPT =
      "Hello! I'm here to help assess your symptoms. Do you currently have a fever?";

  private static final Map<String, Question> QUESTIONS = buildCatalog();

  public Optional<Question> lookup(String stepId) {
    if (stepId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(QUESTIONS.get(stepId.trim()));
  }

  public Question require(Step step) {
    return lookup(step.getId())
        .orElseThrow(() -> new IllegalStateException("No question for step " + step.getId()));
  }

  public Question startQuestion() {
    return require(Step.START);
  }

  public Map<String, Question> all() {
    return QUESTIONS;
  }

  private static Map<String, Question> buildCatalog() {
    Map<String, Question> questions = new LinkedHashMap<>();
    questions.put(Step.START.getId(), Question.yesNo("has_fever", START_PROMPT));
    questions.put(Step.FEVER_DURATION.getId(), Question.choice("fever_duration",
        "How long have you had the fever?",
        List.of("Less than 24 hours", "1-3 days", "4-7 days", "More than a week")));
    questions.put(Step.TEMPERATURE.getId(), Question.freeText("temperature",
        "What is your current body temperature? (in Celsius)"));
    questions.put(Step.OTHER_SYMPTOMS.getId(), Question.yesNo("other_symptoms",
        "Do you have any other symptoms like headache, body ache, or fatigue?"));
    return Collections.unmodifiableMap(questions);
  }
}
