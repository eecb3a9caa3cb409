package com.fever.assessment.remote;

import com.fever.assessment.dto.ChatbotAnalysis;
import com.fever.assessment.dto.ChatbotMessageRequest;
import com.fever.assessment.dto.ChatbotQuestion;
import com.fever.assessment.dto.ChatbotReply;
import com.fever.assessment.engine.ProtocolMismatchException;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.QuestionType;
import com.fever.assessment.model.Session;
import com.fever.assessment.model.Step;
import com.fever.assessment.security.BackendTokenProvider;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client for the platform's chatbot backend ({@code /api/chatbot/*}).
 * <p>
 * Every transport problem (timeout, connection failure, non-2xx status, empty body) surfaces as
 * {@link AuthorityUnavailableException}. A reply that cannot be mapped onto a dialogue step
 * surfaces as {@link ProtocolMismatchException}.
 */
public class RemoteDialogueClient implements DialogueAuthority {
  private static final Logger log = LoggerFactory.getLogger(RemoteDialogueClient.class);

  static final String START_PATH = "/api/chatbot/start-session";
  static final String MESSAGE_PATH = "/api/chatbot/message";

  // Backend steps whose question stores its answer under a different key.
  private static final Map<String, String> STEP_BY_ANSWER_KEY = Map.of("has_fever", "initial");

  private final RestClient restClient;
  private final String baseUrl;
  private final BackendTokenProvider tokenProvider;

  public RemoteDialogueClient(RestClient restClient, String baseUrl,
                              BackendTokenProvider tokenProvider) {
    this.restClient = restClient;
    this.baseUrl = stripTrailingSlash(baseUrl);
    this.tokenProvider = tokenProvider;
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public RemoteTurn startSession() {
    ChatbotReply reply = post(START_PATH, Map.of(), "start-session");
    String sessionId = reply.getSession_id();
    if (sessionId == null || sessionId.isBlank() || sessionId.startsWith(Session.LOCAL_PREFIX)) {
      throw new AuthorityUnavailableException("Remote start-session returned no usable session id");
    }
    log.info("Remote session started: id={}", sessionId);
    return toTurn(sessionId, reply);
  }

  @Override
  public RemoteTurn submitAnswer(String sessionId, String answer, String currentStep,
                                 Map<String, Object> answers) {
    ChatbotMessageRequest request = new ChatbotMessageRequest();
    request.setSession_id(sessionId);
    request.setMessage(answer);
    request.setCurrent_step(currentStep);
    request.setSession_data(answers == null ? new HashMap<>() : new HashMap<>(answers));
    ChatbotReply reply = post(MESSAGE_PATH, request, "message");
    String replySessionId = reply.getSession_id() == null || reply.getSession_id().isBlank()
        ? sessionId
        : reply.getSession_id();
    return toTurn(replySessionId, reply);
  }

  private ChatbotReply post(String path, Object body, String operation) {
    try {
      ChatbotReply reply = restClient.post()
          .uri(baseUrl + path)
          .contentType(MediaType.APPLICATION_JSON)
          .headers(this::authorize)
          .body(body)
          .retrieve()
          .body(ChatbotReply.class);
      if (reply == null) {
        throw new AuthorityUnavailableException("Remote " + operation + " returned an empty body");
      }
      return reply;
    } catch (HttpStatusCodeException ex) {
      log.warn("Remote {} error: status={}, body='{}'",
          operation, ex.getStatusCode(), ex.getResponseBodyAsString());
      throw new AuthorityUnavailableException("Remote " + operation + " failed with "
          + ex.getStatusCode(), ex);
    } catch (ResourceAccessException ex) {
      log.warn("Remote {} network error: {}", operation, ex.getMessage());
      throw new AuthorityUnavailableException("Remote " + operation + " unreachable", ex);
    } catch (RestClientException ex) {
      log.warn("Remote {} unexpected error: {}", operation, ex.getMessage());
      throw new AuthorityUnavailableException("Remote " + operation + " failed", ex);
    }
  }

  private void authorize(HttpHeaders headers) {
    tokenProvider.getToken().ifPresent(headers::setBearerAuth);
  }

  RemoteTurn toTurn(String sessionId, ChatbotReply reply) {
    Analysis analysis = toAnalysis(reply.getAnalysis());
    boolean completed = Boolean.TRUE.equals(reply.getCompleted()) || analysis != null;
    if (completed) {
      if (analysis == null) {
        throw new ProtocolMismatchException(Step.COMPLETE.getId(),
            "Remote reported completion without an analysis");
      }
      return new RemoteTurn(sessionId, Step.COMPLETE.getId(), null, reply.getMessage(),
          reply.getSession_data(), analysis);
    }

    Question question = toQuestion(reply.getNext_question());
    String stepId = resolveStepId(reply);
    if (stepId == null || question == null) {
      throw new ProtocolMismatchException(stepId,
          "Remote reply carries no next question for session " + sessionId);
    }
    String message = reply.getMessage() == null || reply.getMessage().isBlank()
        ? question.getPrompt()
        : reply.getMessage();
    return new RemoteTurn(sessionId, stepId, question, message, reply.getSession_data(), null);
  }

  /**
   * Step name in the backend's own vocabulary, echoed back as {@code current_step} on the next
   * message. Replies usually carry only the question, so the step is derived from its answer key.
   */
  String resolveStepId(ChatbotReply reply) {
    if (hasText(reply.getNext_step())) {
      return reply.getNext_step().trim();
    }
    if (hasText(reply.getCurrent_step())) {
      return reply.getCurrent_step().trim();
    }
    if (reply.getNext_question() != null && hasText(reply.getNext_question().getKey())) {
      String key = reply.getNext_question().getKey().trim();
      return STEP_BY_ANSWER_KEY.getOrDefault(key, key);
    }
    return null;
  }

  private Question toQuestion(ChatbotQuestion remote) {
    if (remote == null || !hasText(remote.getKey())) {
      return null;
    }
    QuestionType type = QuestionType.fromWire(remote.getType());
    return new Question(remote.getKey().trim(), type, remote.getQuestion(), remote.getOptions());
  }

  private Analysis toAnalysis(ChatbotAnalysis remote) {
    if (remote == null || remote.getRisk_score() == null) {
      return null;
    }
    Analysis analysis = Analysis.of((int) Math.round(remote.getRisk_score()),
        remote.getSuspected_fever_type());
    if (hasText(remote.getRisk_level())
        && !remote.getRisk_level().equalsIgnoreCase(analysis.getRiskLevel().getLabel())) {
      log.debug("Remote risk level '{}' differs from derived '{}' for score {}",
          remote.getRisk_level(), analysis.getRiskLevel().getLabel(), analysis.getRiskScore());
    }
    return analysis;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static String stripTrailingSlash(String url) {
    if (url == null) {
      return "";
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
