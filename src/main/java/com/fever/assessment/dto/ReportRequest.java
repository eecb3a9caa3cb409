package com.fever.assessment.dto;

import java.util.Map;

public class ReportRequest {
  private String session_id;
  private Map<String, Object> session_data;
  private ChatbotAnalysis analysis;
  private String completed_at;

  public String getSession_id() {
    return session_id;
  }

  public void setSession_id(String session_id) {
    this.session_id = session_id;
  }

  public Map<String, Object> getSession_data() {
    return session_data;
  }

  public void setSession_data(Map<String, Object> session_data) {
    this.session_data = session_data;
  }

  public ChatbotAnalysis getAnalysis() {
    return analysis;
  }

  public void setAnalysis(ChatbotAnalysis analysis) {
    this.analysis = analysis;
  }

  public String getCompleted_at() {
    return completed_at;
  }

  public void setCompleted_at(String completed_at) {
    this.completed_at = completed_at;
  }
}
