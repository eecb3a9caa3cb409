package com.fever.assessment.service;

import com.fever.assessment.conversation.SessionController;
import java.time.Instant;

public class HostedConversation {
  private final String conversationId;
  private final SessionController controller;
  private volatile Instant lastUpdated;

  public HostedConversation(String conversationId, SessionController controller,
                            Instant lastUpdated) {
    this.conversationId = conversationId;
    this.controller = controller;
    this.lastUpdated = lastUpdated;
  }

  public String getConversationId() {
    return conversationId;
  }

  public SessionController getController() {
    return controller;
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }

  public void setLastUpdated(Instant lastUpdated) {
    this.lastUpdated = lastUpdated;
  }
}
