package com.fever.assessment.conversation;

import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;

/**
 * Events for the hosting application. Called while the controller holds its lock, so
 * implementations must return quickly.
 */
public interface ConversationListener {

  ConversationListener NONE = new ConversationListener() {
    @Override
    public void onQuestionPresented(Question question) {
    }

    @Override
    public void onAnalysisReady(Analysis analysis) {
    }

    @Override
    public void onRestart() {
    }
  };

  void onQuestionPresented(Question question);

  void onAnalysisReady(Analysis analysis);

  void onRestart();

  default void onReprompt(Question question, String message) {
  }
}
