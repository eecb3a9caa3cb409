package com.fever.assessment.engine;

import com.fever.assessment.model.Answer;
import com.fever.assessment.model.Question;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets raw replies according to the type of the question being answered.
 */
public class AnswerNormalizer {
  // Leading number only, so "39.5°C" reads as 39.5, ".5" as 0.5 and "abc 39" does not parse.
  private static final Pattern LEADING_NUMBER_PATTERN =
      Pattern.compile("^([+-]?(\\d+([\\.,]\\d*)?|[\\.,]\\d+))");

  public Answer normalize(Question question, String rawAnswer) {
    String text = sanitizeText(rawAnswer);
    switch (question.getType()) {
      case YES_NO:
        return classifyYesNo(rawAnswer, text);
      case CHOICE:
        return text.isEmpty() ? Answer.unrecognized(rawAnswer) : Answer.text(rawAnswer, text);
      case MULTI_CHOICE:
        List<String> selected = splitChoices(text);
        return selected.isEmpty() ? Answer.unrecognized(rawAnswer) : Answer.choices(rawAnswer, selected);
      case NUMERIC_FREE_TEXT:
        Double number = parseNumber(text);
        if (number != null) {
          return Answer.number(rawAnswer, number);
        }
        return text.isEmpty() ? Answer.unrecognized(rawAnswer) : Answer.text(rawAnswer, text);
      default:
        throw new IllegalStateException("Unhandled question type " + question.getType());
    }
  }

  /**
   * Substring match, affirmative first: "yes"/"yep" anywhere or exactly "y", then "no"/"nope"
   * anywhere or exactly "n".
   */
  Answer classifyYesNo(String rawAnswer, String text) {
    String normalized = text.toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return Answer.unrecognized(rawAnswer);
    }
    if (normalized.contains("yes") || normalized.contains("yep") || normalized.equals("y")) {
      return Answer.affirmative(rawAnswer);
    }
    if (normalized.contains("no") || normalized.contains("nope") || normalized.equals("n")) {
      return Answer.negative(rawAnswer);
    }
    return Answer.unrecognized(rawAnswer);
  }

  Double parseNumber(String text) {
    if (text == null || text.isEmpty()) {
      return null;
    }
    Matcher matcher = LEADING_NUMBER_PATTERN.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    String raw = matcher.group(1).replace(",", ".");
    try {
      double value = Double.parseDouble(raw);
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private List<String> splitChoices(String text) {
    List<String> selected = new ArrayList<>();
    for (String part : text.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        selected.add(trimmed);
      }
    }
    return selected;
  }

  private String sanitizeText(String message) {
    return message == null ? "" : message.trim();
  }
}
