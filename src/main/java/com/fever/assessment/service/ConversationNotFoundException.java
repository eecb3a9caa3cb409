package com.fever.assessment.service;

public class ConversationNotFoundException extends RuntimeException {

  public ConversationNotFoundException(String conversationId) {
    super("Conversation not found: " + conversationId);
  }
}
