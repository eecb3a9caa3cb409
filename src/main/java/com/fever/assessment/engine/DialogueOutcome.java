package com.fever.assessment.engine;

import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.Step;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of feeding one answer into the {@link DialogueEngine}: either the next question, a
 * re-prompt of the same question, or a completed analysis.
 */
public final class DialogueOutcome {

  public enum Kind {
    NEXT_QUESTION,
    REPROMPT,
    COMPLETE
  }

  private final Kind kind;
  private final Map<String, Object> answers;
  private final String nextStep;
  private final Question question;
  private final Analysis analysis;
  private final String message;

  private DialogueOutcome(Kind kind, Map<String, Object> answers, String nextStep,
                          Question question, Analysis analysis, String message) {
    this.kind = kind;
    this.answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    this.nextStep = nextStep;
    this.question = question;
    this.analysis = analysis;
    this.message = message;
  }

  static DialogueOutcome next(Map<String, Object> answers, Step nextStep, Question question) {
    return new DialogueOutcome(Kind.NEXT_QUESTION, answers, nextStep.getId(), question, null,
        question.getPrompt());
  }

  static DialogueOutcome reprompt(Map<String, Object> answers, String stepId, Question question,
                                  String message) {
    return new DialogueOutcome(Kind.REPROMPT, answers, stepId, question, null, message);
  }

  static DialogueOutcome complete(Map<String, Object> answers, Analysis analysis, String message) {
    return new DialogueOutcome(Kind.COMPLETE, answers, Step.COMPLETE.getId(), null, analysis,
        message);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isComplete() {
    return kind == Kind.COMPLETE;
  }

  public boolean isReprompt() {
    return kind == Kind.REPROMPT;
  }

  public Map<String, Object> getAnswers() {
    return answers;
  }

  public String getNextStep() {
    return nextStep;
  }

  /** The question now awaiting a reply; null once complete. */
  public Question getQuestion() {
    return question;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public String getMessage() {
    return message;
  }
}
