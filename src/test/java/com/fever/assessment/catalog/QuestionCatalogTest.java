package com.fever.assessment.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fever.assessment.model.Question;
import com.fever.assessment.model.QuestionType;
import com.fever.assessment.model.Step;
import java.util.List;
import org.junit.jupiter.api.Test;

public class QuestionCatalogTest {

  private final QuestionCatalog catalog = new QuestionCatalog();

  @Test
  public void startQuestionAsksAboutFever() {
    Question start = catalog.startQuestion();
    assertEquals("has_fever", start.getKey());
    assertEquals(QuestionType.YES_NO, start.getType());
    assertEquals(QuestionCatalog.START_PROMPT, start.getPrompt());
    assertEquals(List.of("Yes", "No"), start.getOptions());
  }

  @Test
  public void everyNonTerminalStepHasAQuestion() {
    for (Step step : Step.values()) {
      if (step == Step.COMPLETE) {
        assertTrue(catalog.lookup(step.getId()).isEmpty());
      } else {
        assertEquals(step, Step.fromId(step.getId()).orElseThrow());
        assertTrue(catalog.lookup(step.getId()).isPresent(), step.getId());
      }
    }
    assertEquals(4, catalog.all().size());
  }

  @Test
  public void durationOffersFixedOptions() {
    Question duration = catalog.require(Step.FEVER_DURATION);
    assertEquals(QuestionType.CHOICE, duration.getType());
    assertEquals(List.of("Less than 24 hours", "1-3 days", "4-7 days", "More than a week"),
        duration.getOptions());
  }

  @Test
  public void unknownStepsAreAbsent() {
    assertTrue(catalog.lookup("symptom_list").isEmpty());
    assertTrue(catalog.lookup(null).isEmpty());
  }
}
