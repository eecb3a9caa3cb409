package com.fever.assessment.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fever.assessment.model.Step;
import org.junit.jupiter.api.Test;

public class StepVocabularyTest {

  private final StepVocabulary vocabulary = new StepVocabulary();

  @Test
  public void mapsBackendNamesOntoLocalSteps() {
    assertEquals(Step.START, vocabulary.toLocal("initial").orElseThrow());
    assertEquals(Step.START, vocabulary.toLocal("has_fever").orElseThrow());
    assertEquals(Step.FEVER_DURATION, vocabulary.toLocal("fever_duration").orElseThrow());
    assertEquals(Step.TEMPERATURE, vocabulary.toLocal(" Temperature ").orElseThrow());
    assertEquals(Step.OTHER_SYMPTOMS, vocabulary.toLocal("no_fever").orElseThrow());
  }

  @Test
  public void unknownStepsHaveNoAnchor() {
    assertTrue(vocabulary.toLocal("symptom_list").isEmpty());
    assertTrue(vocabulary.toLocal("complete").isEmpty());
    assertTrue(vocabulary.toLocal(null).isEmpty());
  }
}
