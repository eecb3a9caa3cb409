package com.fever.assessment.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fever.assessment.catalog.QuestionCatalog;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.FeverTypes;
import com.fever.assessment.model.RiskLevel;
import com.fever.assessment.model.Session;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class DialogueEngineTest {

  private DialogueEngine engine;

  @BeforeEach
  public void setUp() {
    engine = new DialogueEngine(new QuestionCatalog());
  }

  @Test
  @DisplayName("fever path: Yes, 3-4 days, 39.5 ends at high risk")
  public void feverPathHighRisk() {
    Session session = Session.local();
    assertEquals("start", session.getCurrentStep());

    DialogueOutcome first = apply(session, "Yes");
    assertEquals(DialogueOutcome.Kind.NEXT_QUESTION, first.getKind());
    assertEquals("fever_duration", first.getNextStep());
    assertEquals("How long have you had the fever?", first.getMessage());

    DialogueOutcome second = apply(session, "3-4 days");
    assertEquals("temperature", second.getNextStep());

    DialogueOutcome last = apply(session, "39.5");
    assertTrue(last.isComplete());
    Analysis analysis = last.getAnalysis();
    assertEquals(75, analysis.getRiskScore());
    assertEquals(RiskLevel.HIGH, analysis.getRiskLevel());
    assertEquals(FeverTypes.VIRAL_FEVER, analysis.getSuspectedFeverType());
    assertEquals("Based on your symptoms, your risk level is HIGH. "
        + "Please consult a doctor immediately. Your temperature is high and requires medical attention.",
        last.getMessage());
    assertEquals(Map.of("has_fever", true, "fever_duration", "3-4 days", "temperature", 39.5),
        last.getAnswers());
  }

  @Test
  @DisplayName("no fever path: No, No ends at score 20")
  public void noFeverPath() {
    Session session = Session.local();
    assertEquals("other_symptoms", apply(session, "No").getNextStep());

    DialogueOutcome last = apply(session, "No");
    assertTrue(last.isComplete());
    assertEquals(20, last.getAnalysis().getRiskScore());
    assertEquals(RiskLevel.LOW, last.getAnalysis().getRiskLevel());
    assertEquals(FeverTypes.NO_FEVER, last.getAnalysis().getSuspectedFeverType());
    assertEquals("You appear to be in good health. Continue monitoring your symptoms.",
        last.getMessage());
  }

  @Test
  public void otherSymptomsGiveGeneralSymptoms() {
    Session session = Session.local();
    apply(session, "no");

    DialogueOutcome last = apply(session, "yes, a headache");
    assertEquals(40, last.getAnalysis().getRiskScore());
    assertEquals(FeverTypes.GENERAL_SYMPTOMS, last.getAnalysis().getSuspectedFeverType());
    assertEquals("Thank you for the information. "
        + "Rest and stay hydrated. If symptoms persist, consider consulting a doctor.",
        last.getMessage());
  }

  @Test
  @DisplayName("temperature bands are exclusive at 38.0 and 39.0")
  public void temperatureBoundaries() {
    assertEquals(30, scoreFor("38.0"));
    assertEquals(50, scoreFor("38.01"));
    assertEquals(50, scoreFor("39.0"));
    assertEquals(75, scoreFor("39.01"));
    assertEquals(30, scoreFor("36.6"));
  }

  @Test
  @DisplayName("unrecognized yes/no re-prompts with the same question and no state change")
  public void repromptsUnrecognizedAnswer() {
    Session session = Session.local();
    DialogueOutcome outcome = engine.advance(session, "maybe");

    assertTrue(outcome.isReprompt());
    assertEquals("start", outcome.getNextStep());
    assertEquals(DialogueEngine.REPROMPT_YES_NO, outcome.getMessage());
    assertEquals(engine.firstQuestion(), outcome.getQuestion());
    assertTrue(outcome.getAnswers().isEmpty());
    assertEquals("start", session.getCurrentStep());

    DialogueOutcome again = engine.advance(session, "maybe");
    assertEquals(outcome.getMessage(), again.getMessage());
    assertEquals(outcome.getQuestion(), again.getQuestion());
  }

  @Test
  public void invalidTemperatureNeverAdvances() {
    Session session = Session.local();
    apply(session, "yes");
    apply(session, "1-3 days");

    for (String input : new String[] {"hot", "", "about 39"}) {
      DialogueOutcome outcome = engine.advance(session, input);
      assertTrue(outcome.isReprompt());
      assertEquals("temperature", outcome.getNextStep());
      assertEquals(DialogueEngine.REPROMPT_TEMPERATURE, outcome.getMessage());
      assertNull(outcome.getAnalysis());
    }
    assertFalse(session.getAnswers().containsKey("temperature"));
  }

  @Test
  public void blankDurationReprompts() {
    Session session = Session.local();
    apply(session, "yes");

    DialogueOutcome outcome = engine.advance(session, "  ");
    assertTrue(outcome.isReprompt());
    assertEquals(DialogueEngine.REPROMPT_DURATION, outcome.getMessage());
  }

  @Test
  public void unknownStepIsProtocolMismatch() {
    Session session = new Session("local-x", "symptom_list", Map.of(), null);
    ProtocolMismatchException ex =
        assertThrows(ProtocolMismatchException.class, () -> engine.advance(session, "yes"));
    assertEquals("symptom_list", ex.getStepId());

    Session finished = new Session("local-y", "complete", Map.of(), null);
    assertThrows(ProtocolMismatchException.class, () -> engine.advance(finished, "yes"));
  }

  @Test
  public void resumesFromCarriedAnswers() {
    Session continuation = new Session("local-remote-1", "temperature",
        Map.of("has_fever", true, "fever_duration", "1-3 days"), null);

    DialogueOutcome outcome = engine.advance(continuation, "39.2");
    assertEquals(75, outcome.getAnalysis().getRiskScore());
    assertEquals(3, outcome.getAnswers().size());
  }

  private int scoreFor(String temperature) {
    Session session = new Session("local-t", "temperature", Map.of(), null);
    return engine.advance(session, temperature).getAnalysis().getRiskScore();
  }

  private DialogueOutcome apply(Session session, String answer) {
    DialogueOutcome outcome = engine.advance(session, answer);
    session.replaceAnswers(outcome.getAnswers());
    if (outcome.isComplete()) {
      session.complete(outcome.getAnalysis());
    } else {
      session.setCurrentStep(outcome.getNextStep());
      session.setCurrentQuestion(outcome.getQuestion());
    }
    return outcome;
  }
}
