package com.fever.assessment.remote;

import java.util.Map;

public class LocalOnlyAuthority implements DialogueAuthority {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public RemoteTurn startSession() {
    throw new AuthorityUnavailableException("Remote dialogue backend is disabled");
  }

  @Override
  public RemoteTurn submitAnswer(String sessionId, String answer, String currentStep,
                                 Map<String, Object> answers) {
    throw new AuthorityUnavailableException("Remote dialogue backend is disabled");
  }
}
