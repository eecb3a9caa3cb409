package com.fever.assessment.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fever.assessment.model.Answer;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.QuestionType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class AnswerNormalizerTest {

  private final AnswerNormalizer normalizer = new AnswerNormalizer();
  private final Question yesNo = Question.yesNo("has_fever", "Do you have a fever?");
  private final Question temperature = Question.freeText("temperature", "Temperature?");

  @Test
  @DisplayName("yes/no: affirmative substrings win over negative ones")
  public void classifiesYesNo() {
    assertEquals(Answer.Kind.AFFIRMATIVE, normalizer.normalize(yesNo, "Yes").getKind());
    assertEquals(Answer.Kind.AFFIRMATIVE, normalizer.normalize(yesNo, "  yep, since monday ").getKind());
    assertEquals(Answer.Kind.AFFIRMATIVE, normalizer.normalize(yesNo, "Y").getKind());
    assertEquals(Answer.Kind.AFFIRMATIVE, normalizer.normalize(yesNo, "no... actually yes").getKind());
    assertEquals(Answer.Kind.NEGATIVE, normalizer.normalize(yesNo, "No").getKind());
    assertEquals(Answer.Kind.NEGATIVE, normalizer.normalize(yesNo, "nope").getKind());
    assertEquals(Answer.Kind.NEGATIVE, normalizer.normalize(yesNo, "n").getKind());
  }

  @Test
  @DisplayName("yes/no: anything else is unrecognized")
  public void unrecognizedYesNo() {
    assertEquals(Answer.Kind.UNRECOGNIZED, normalizer.normalize(yesNo, "maybe").getKind());
    assertEquals(Answer.Kind.UNRECOGNIZED, normalizer.normalize(yesNo, "   ").getKind());
    assertEquals(Answer.Kind.UNRECOGNIZED, normalizer.normalize(yesNo, null).getKind());
  }

  @Test
  @DisplayName("numeric: leading number is parsed, trailing text ignored")
  public void parsesLeadingNumber() {
    assertEquals(39.5, normalizer.normalize(temperature, "39.5").getNumber(), 0.0001);
    assertEquals(38.2, normalizer.normalize(temperature, "38.2°C").getNumber(), 0.0001);
    assertEquals(37.5, normalizer.normalize(temperature, "37,5").getNumber(), 0.0001);
    assertEquals(40.0, normalizer.normalize(temperature, " 40 degrees").getNumber(), 0.0001);
    assertEquals(0.5, normalizer.normalize(temperature, ".5").getNumber(), 0.0001);
    assertEquals(-0.5, normalizer.normalize(temperature, "-.5").getNumber(), 0.0001);
    assertEquals(38.0, normalizer.normalize(temperature, "38.").getNumber(), 0.0001);
  }

  @Test
  @DisplayName("numeric: non-numeric text falls back to text, blank to unrecognized")
  public void numericFallbacks() {
    Answer text = normalizer.normalize(temperature, "hot");
    assertEquals(Answer.Kind.TEXT, text.getKind());
    assertEquals("hot", text.getText());
    assertThrows(IllegalStateException.class, text::getNumber);

    assertEquals(Answer.Kind.TEXT, normalizer.normalize(temperature, "about 39").getKind());
    assertEquals(Answer.Kind.UNRECOGNIZED, normalizer.normalize(temperature, "").getKind());
    assertNull(normalizer.parseNumber("abc"));
    assertNull(normalizer.parseNumber("."));
  }

  @Test
  public void choiceAndMultiChoice() {
    Question duration = Question.choice("fever_duration", "How long?", List.of("1-3 days"));
    assertEquals("3-4 days", normalizer.normalize(duration, " 3-4 days ").getText());
    assertEquals(Answer.Kind.UNRECOGNIZED, normalizer.normalize(duration, "").getKind());

    Question symptoms = new Question("symptoms", QuestionType.MULTI_CHOICE, "Which?",
        List.of("Headache", "Cough", "Fatigue"));
    assertEquals(List.of("Headache", "Fatigue"),
        normalizer.normalize(symptoms, "Headache, ,Fatigue").getChoices());
  }
}
