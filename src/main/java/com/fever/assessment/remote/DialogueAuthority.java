package com.fever.assessment.remote;

import java.util.Map;

/**
 * Source of truth for a conversation while it is reachable. Implementations block; callers run
 * them off the request thread with a timeout.
 */
public interface DialogueAuthority {

  /** False when no remote backend is configured; sessions then start locally without a call. */
  boolean isEnabled();

  RemoteTurn startSession();

  RemoteTurn submitAnswer(String sessionId, String answer, String currentStep,
                          Map<String, Object> answers);
}
