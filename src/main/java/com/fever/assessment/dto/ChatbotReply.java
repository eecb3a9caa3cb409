package com.fever.assessment.dto;

import java.util.Map;

public class ChatbotReply {
  private String session_id;
  private String message;
  private ChatbotQuestion next_question;
  private String next_step;
  private String current_step;
  private Map<String, Object> session_data;
  private Boolean completed;
  private ChatbotAnalysis analysis;

  public String getSession_id() {
    return session_id;
  }

  public void setSession_id(String session_id) {
    this.session_id = session_id;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public ChatbotQuestion getNext_question() {
    return next_question;
  }

  public void setNext_question(ChatbotQuestion next_question) {
    this.next_question = next_question;
  }

  public String getNext_step() {
    return next_step;
  }

  public void setNext_step(String next_step) {
    this.next_step = next_step;
  }

  public String getCurrent_step() {
    return current_step;
  }

  public void setCurrent_step(String current_step) {
    this.current_step = current_step;
  }

  public Map<String, Object> getSession_data() {
    return session_data;
  }

  public void setSession_data(Map<String, Object> session_data) {
    this.session_data = session_data;
  }

  public Boolean getCompleted() {
    return completed;
  }

  public void setCompleted(Boolean completed) {
    this.completed = completed;
  }

  public ChatbotAnalysis getAnalysis() {
    return analysis;
  }

  public void setAnalysis(ChatbotAnalysis analysis) {
    this.analysis = analysis;
  }
}
