package com.fever.assessment.engine;

import com.fever.assessment.catalog.QuestionCatalog;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Answer;
import com.fever.assessment.model.FeverTypes;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.Session;
import com.fever.assessment.model.Step;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Transition table of the symptom assessment. Used for local sessions and for any remote session
 * that had to fall back to local evaluation, so both modes share one rule set.
 * <p>
 * The engine never mutates the session it is given; callers apply the returned outcome.
 */
@Component
public class DialogueEngine {
  static final String REPROMPT_YES_NO = "Please answer with Yes or No.";
  static final String REPROMPT_TEMPERATURE = "Please enter a valid temperature number.";
  static final String REPROMPT_DURATION = "Please tell me how long you have had the fever.";

  private final QuestionCatalog catalog;
  private final AnswerNormalizer normalizer;
  private final RiskScorer riskScorer;

  public DialogueEngine(QuestionCatalog catalog) {
    this.catalog = catalog;
    this.normalizer = new AnswerNormalizer();
    this.riskScorer = new RiskScorer();
  }

  public Question firstQuestion() {
    return catalog.startQuestion();
  }

  public Optional<Question> questionAt(String stepId) {
    return catalog.lookup(stepId);
  }

  /**
   * Applies {@code rawAnswer} to the session's current step.
   *
   * @throws ProtocolMismatchException if the current step is not in the local catalog
   */
  public DialogueOutcome advance(Session session, String rawAnswer) {
    String stepId = session.getCurrentStep();
    Step step = Step.fromId(stepId)
        .filter(s -> s != Step.COMPLETE)
        .orElseThrow(() -> ProtocolMismatchException.unknownStep(stepId));
    Question question = catalog.lookup(step.getId())
        .orElseThrow(() -> ProtocolMismatchException.unknownStep(stepId));
    Answer answer = normalizer.normalize(question, rawAnswer);
    Map<String, Object> answers = new LinkedHashMap<>(session.getAnswers());

    switch (step) {
      case START:
        return answerStart(answers, question, answer);
      case FEVER_DURATION:
        return answerFeverDuration(answers, question, answer);
      case TEMPERATURE:
        return answerTemperature(answers, question, answer);
      case OTHER_SYMPTOMS:
        return answerOtherSymptoms(answers, question, answer);
      case COMPLETE:
      default:
        throw ProtocolMismatchException.unknownStep(stepId);
    }
  }

  private DialogueOutcome answerStart(Map<String, Object> answers, Question question, Answer answer) {
    switch (answer.getKind()) {
      case AFFIRMATIVE:
        answers.put(question.getKey(), true);
        return DialogueOutcome.next(answers, Step.FEVER_DURATION, catalog.require(Step.FEVER_DURATION));
      case NEGATIVE:
        answers.put(question.getKey(), false);
        return DialogueOutcome.next(answers, Step.OTHER_SYMPTOMS, catalog.require(Step.OTHER_SYMPTOMS));
      default:
        return DialogueOutcome.reprompt(answers, Step.START.getId(), question, REPROMPT_YES_NO);
    }
  }

  private DialogueOutcome answerFeverDuration(Map<String, Object> answers, Question question,
                                              Answer answer) {
    if (answer.getKind() != Answer.Kind.TEXT) {
      return DialogueOutcome.reprompt(answers, Step.FEVER_DURATION.getId(), question,
          REPROMPT_DURATION);
    }
    answers.put(question.getKey(), answer.getText());
    return DialogueOutcome.next(answers, Step.TEMPERATURE, catalog.require(Step.TEMPERATURE));
  }

  private DialogueOutcome answerTemperature(Map<String, Object> answers, Question question,
                                            Answer answer) {
    if (answer.getKind() != Answer.Kind.NUMBER) {
      return DialogueOutcome.reprompt(answers, Step.TEMPERATURE.getId(), question,
          REPROMPT_TEMPERATURE);
    }
    double temperature = answer.getNumber();
    answers.put(question.getKey(), temperature);
    Analysis analysis = riskScorer.feverAnalysis(temperature);
    return DialogueOutcome.complete(answers, analysis, completionMessage(analysis));
  }

  private DialogueOutcome answerOtherSymptoms(Map<String, Object> answers, Question question,
                                              Answer answer) {
    switch (answer.getKind()) {
      case AFFIRMATIVE:
        answers.put(question.getKey(), true);
        Analysis general = riskScorer.generalSymptomsAnalysis();
        return DialogueOutcome.complete(answers, general, completionMessage(general));
      case NEGATIVE:
        answers.put(question.getKey(), false);
        Analysis healthy = riskScorer.noFeverAnalysis();
        return DialogueOutcome.complete(answers, healthy, completionMessage(healthy));
      default:
        return DialogueOutcome.reprompt(answers, Step.OTHER_SYMPTOMS.getId(), question,
            REPROMPT_YES_NO);
    }
  }

  static String completionMessage(Analysis analysis) {
    switch (analysis.getSuspectedFeverType()) {
      case FeverTypes.NO_FEVER:
        return analysis.getRecommendation();
      case FeverTypes.GENERAL_SYMPTOMS:
        return "Thank you for the information. " + analysis.getRecommendation();
      default:
        return "Based on your symptoms, your risk level is "
            + analysis.getRiskLevel().getLabel().toUpperCase(Locale.ROOT) + ". "
            + analysis.getRecommendation();
    }
  }
}
