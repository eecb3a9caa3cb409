package com.fever.assessment.conversation;

import com.fever.assessment.model.Step;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps step identifiers reported by the remote backend onto local steps. The backend names the
 * opening question {@code initial} or after its answer key {@code has_fever}.
 */
@Component
public class StepVocabulary {
  private static final Map<String, Step> REMOTE_TO_LOCAL = Map.of(
      "start", Step.START,
      "initial", Step.START,
      "has_fever", Step.START,
      "fever_duration", Step.FEVER_DURATION,
      "temperature", Step.TEMPERATURE,
      "other_symptoms", Step.OTHER_SYMPTOMS,
      "no_fever", Step.OTHER_SYMPTOMS);

  public Optional<Step> toLocal(String remoteStep) {
    if (remoteStep == null || remoteStep.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(REMOTE_TO_LOCAL.get(remoteStep.trim().toLowerCase(Locale.ROOT)));
  }
}
