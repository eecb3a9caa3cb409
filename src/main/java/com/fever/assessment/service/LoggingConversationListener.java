package com.fever.assessment.service;

import com.fever.assessment.conversation.ConversationListener;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversation events of the HTTP host. The HTTP client reads the state from each response, so
 * events are only logged.
 */
class LoggingConversationListener implements ConversationListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingConversationListener.class);

  private final String conversationId;

  LoggingConversationListener(String conversationId) {
    this.conversationId = conversationId;
  }

  @Override
  public void onQuestionPresented(Question question) {
    log.debug("[{}] Question presented: {}", conversationId, question.getKey());
  }

  @Override
  public void onReprompt(Question question, String message) {
    log.debug("[{}] Re-prompt for {}: {}", conversationId,
        question == null ? "-" : question.getKey(), message);
  }

  @Override
  public void onAnalysisReady(Analysis analysis) {
    log.info("[{}] Analysis ready: {}", conversationId, analysis);
  }

  @Override
  public void onRestart() {
    log.info("[{}] Conversation restarted", conversationId);
  }
}
