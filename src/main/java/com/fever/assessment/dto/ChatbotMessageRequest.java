package com.fever.assessment.dto;

import java.util.Map;

public class ChatbotMessageRequest {
  private String session_id;
  private String message;
  private String current_step;
  private Map<String, Object> session_data;

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
}
