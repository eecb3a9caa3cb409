package com.fever.assessment.report;

import com.fever.assessment.dto.ChatbotAnalysis;
import com.fever.assessment.dto.ReportRequest;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.security.BackendTokenProvider;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts finished assessments to the backend's {@code /api/chatbot/submit-report}.
 */
public class BackendReportSink implements ReportSink {
  private static final Logger log = LoggerFactory.getLogger(BackendReportSink.class);

  static final String REPORT_PATH = "/api/chatbot/submit-report";

  private final RestClient restClient;
  private final String baseUrl;
  private final BackendTokenProvider tokenProvider;

  public BackendReportSink(RestClient restClient, String baseUrl,
                           BackendTokenProvider tokenProvider) {
    this.restClient = restClient;
    this.baseUrl = baseUrl != null && baseUrl.endsWith("/")
        ? baseUrl.substring(0, baseUrl.length() - 1)
        : baseUrl;
    this.tokenProvider = tokenProvider;
  }

  @Override
  public void submit(AssessmentReport report) {
    ReportRequest request = toRequest(report);
    try {
      restClient.post()
          .uri(baseUrl + REPORT_PATH)
          .contentType(MediaType.APPLICATION_JSON)
          .headers(headers -> tokenProvider.getToken().ifPresent(headers::setBearerAuth))
          .body(request)
          .retrieve()
          .toBodilessEntity();
      log.info("Assessment report submitted: session={}, score={}",
          report.getSessionId(), report.getAnalysis().getRiskScore());
    } catch (HttpStatusCodeException ex) {
      throw new ReportSubmissionException("Report rejected with status " + ex.getStatusCode()
          + ": " + ex.getResponseBodyAsString(), ex);
    } catch (RestClientException ex) {
      throw new ReportSubmissionException("Report submission failed: " + ex.getMessage(), ex);
    }
  }

  static ReportRequest toRequest(AssessmentReport report) {
    Analysis analysis = report.getAnalysis();
    ChatbotAnalysis payload = new ChatbotAnalysis();
    payload.setRisk_score((double) analysis.getRiskScore());
    payload.setRisk_level(analysis.getRiskLevel().getLabel());
    payload.setSuspected_fever_type(analysis.getSuspectedFeverType());
    payload.setRecommendation(analysis.getRecommendation());

    ReportRequest request = new ReportRequest();
    request.setSession_id(report.getSessionId());
    request.setSession_data(new HashMap<>(report.getAnswers()));
    request.setAnalysis(payload);
    request.setCompleted_at(report.getCompletedAt() == null ? null : report.getCompletedAt().toString());
    return request;
  }
}
