package com.fever.assessment.service;

import com.fever.assessment.catalog.QuestionCatalog;
import com.fever.assessment.conversation.ConversationTurn;
import com.fever.assessment.conversation.SessionController;
import com.fever.assessment.conversation.SessionControllerFactory;
import com.fever.assessment.dto.AnalysisView;
import com.fever.assessment.dto.ConversationView;
import com.fever.assessment.dto.QuestionView;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hosts assessment conversations for HTTP clients: one {@link SessionController} per
 * conversation, looked up by conversation id.
 */
@Service
public class AssessmentService {
  private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

  private final SessionControllerFactory controllerFactory;
  private final ConversationRegistry registry;
  private final QuestionCatalog catalog;

  public AssessmentService(SessionControllerFactory controllerFactory,
                           ConversationRegistry registry,
                           QuestionCatalog catalog) {
    this.controllerFactory = controllerFactory;
    this.registry = registry;
    this.catalog = catalog;
  }

  public CompletableFuture<ConversationView> start() {
    String conversationId = UUID.randomUUID().toString();
    SessionController controller =
        controllerFactory.create(new LoggingConversationListener(conversationId));
    registry.register(conversationId, controller);
    log.info("Conversation {} created", conversationId);
    return controller.startSession().thenApply(turn -> toView(conversationId, turn));
  }

  public CompletableFuture<ConversationView> answer(String conversationId, String answer) {
    HostedConversation hosted = require(conversationId);
    registry.touch(hosted);
    return hosted.getController().submitAnswer(answer)
        .thenApply(turn -> toView(hosted.getConversationId(), turn));
  }

  public CompletableFuture<ConversationView> restart(String conversationId) {
    HostedConversation hosted = require(conversationId);
    registry.touch(hosted);
    return hosted.getController().restart()
        .thenApply(turn -> toView(hosted.getConversationId(), turn));
  }

  public ConversationView view(String conversationId) {
    HostedConversation hosted = require(conversationId);
    return toView(hosted.getConversationId(), hosted.getController().currentTurn());
  }

  public void discard(String conversationId) {
    if (!registry.remove(conversationId)) {
      throw new ConversationNotFoundException(conversationId);
    }
    log.info("Conversation {} discarded", conversationId);
  }

  public Optional<QuestionView> question(String stepId) {
    return catalog.lookup(stepId).map(AssessmentService::toQuestionView);
  }

  public int activeConversations() {
    return registry.size();
  }

  private HostedConversation require(String conversationId) {
    return registry.find(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));
  }

  static ConversationView toView(String conversationId, ConversationTurn turn) {
    ConversationView view = new ConversationView();
    view.setConversation_id(conversationId);
    view.setSession_id(turn.getSessionId());
    view.setMode(turn.getMode() == null ? null : turn.getMode().name().toLowerCase(Locale.ROOT));
    view.setState(turn.getState().name());
    view.setCurrent_step(turn.getCurrentStep());
    view.setMessage(turn.getMessage());
    view.setQuestion(turn.getQuestion() == null ? null : toQuestionView(turn.getQuestion()));
    view.setAnalysis(turn.getAnalysis() == null ? null : toAnalysisView(turn.getAnalysis()));
    view.setCompleted(turn.isCompleted());
    view.setStatus(turn.getStatus().name());
    return view;
  }

  static QuestionView toQuestionView(Question question) {
    QuestionView view = new QuestionView();
    view.setKey(question.getKey());
    view.setType(question.getType().getWireName());
    view.setPrompt(question.getPrompt());
    view.setOptions(question.getOptions());
    return view;
  }

  static AnalysisView toAnalysisView(Analysis analysis) {
    AnalysisView view = new AnalysisView();
    view.setRisk_score(analysis.getRiskScore());
    view.setRisk_level(analysis.getRiskLevel().getLabel());
    view.setSuspected_fever_type(analysis.getSuspectedFeverType());
    view.setRecommendation(analysis.getRecommendation());
    return view;
  }
}
