package com.fever.assessment.dto;

public class ConversationView {
  private String conversation_id;
  private String session_id;
  private String mode;
  private String state;
  private String current_step;
  private String message;
  private QuestionView question;
  private AnalysisView analysis;
  private boolean completed;
  private String status;

  public String getConversation_id() {
    return conversation_id;
  }

  public void setConversation_id(String conversation_id) {
    this.conversation_id = conversation_id;
  }

  public String getSession_id() {
    return session_id;
  }

  public void setSession_id(String session_id) {
    this.session_id = session_id;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public String getState() {
    return state;
  }

  public void setState(String state) {
    this.state = state;
  }

  public String getCurrent_step() {
    return current_step;
  }

  public void setCurrent_step(String current_step) {
    this.current_step = current_step;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public QuestionView getQuestion() {
    return question;
  }

  public void setQuestion(QuestionView question) {
    this.question = question;
  }

  public AnalysisView getAnalysis() {
    return analysis;
  }

  public void setAnalysis(AnalysisView analysis) {
    this.analysis = analysis;
  }

  public boolean isCompleted() {
    return completed;
  }

  public void setCompleted(boolean completed) {
    this.completed = completed;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }
}
