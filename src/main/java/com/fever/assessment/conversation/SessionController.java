package com.fever.assessment.conversation;

import com.fever.assessment.engine.DialogueEngine;
import com.fever.assessment.engine.DialogueOutcome;
import com.fever.assessment.engine.ProtocolMismatchException;
import com.fever.assessment.model.Analysis;
import com.fever.assessment.model.Question;
import com.fever.assessment.model.Session;
import com.fever.assessment.model.SessionMode;
import com.fever.assessment.model.Step;
import com.fever.assessment.remote.AuthorityUnavailableException;
import com.fever.assessment.remote.DialogueAuthority;
import com.fever.assessment.remote.RemoteTurn;
import com.fever.assessment.report.AssessmentReport;
import com.fever.assessment.report.ReportSink;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one assessment conversation from start to analysis.
 * <p>
 * While the remote backend answers, it is authoritative and the local engine is not consulted.
 * Any transport failure moves the conversation to the local {@link DialogueEngine}, re-anchored on
 * the last step the remote reported; a step the local catalog does not know restarts the local
 * engine at {@code start}. None of these paths is reported to the user as an error.
 * <p>
 * Operations return futures. Answers are serialized: a second answer while one is in flight gets
 * a {@link TurnStatus#BUSY} turn. Results of calls that were overtaken by a restart are dropped.
 */
public class SessionController {
  private static final Logger log = LoggerFactory.getLogger(SessionController.class);

  private final DialogueEngine engine;
  private final DialogueAuthority authority;
  private final ReportSink reportSink;
  private final Executor executor;
  private final StepVocabulary vocabulary;
  private final ConversationListener listener;
  private final long remoteTimeoutMs;

  private final Object lock = new Object();
  private ControllerState state = ControllerState.IDLE;
  private Session session;
  private String lastMessage;
  private long generation;
  private boolean answerInFlight;

  public SessionController(DialogueEngine engine,
                           DialogueAuthority authority,
                           ReportSink reportSink,
                           Executor executor,
                           StepVocabulary vocabulary,
                           ConversationListener listener,
                           long remoteTimeoutMs) {
    this.engine = engine;
    this.authority = authority;
    this.reportSink = reportSink;
    this.executor = executor;
    this.vocabulary = vocabulary;
    this.listener = listener == null ? ConversationListener.NONE : listener;
    this.remoteTimeoutMs = remoteTimeoutMs;
  }

  /**
   * Opens the first session. On a controller that already has one, this behaves as
   * {@link #restart()}.
   */
  public CompletableFuture<ConversationTurn> startSession() {
    long startGeneration;
    synchronized (lock) {
      if (state == ControllerState.IDLE) {
        startGeneration = beginStarting();
      } else {
        log.info("Start requested while {}; restarting", state);
        startGeneration = discardAndBegin();
      }
    }
    return openSession(startGeneration);
  }

  /**
   * Discards the current session, whatever its state, and starts a new one.
   */
  public CompletableFuture<ConversationTurn> restart() {
    long startGeneration;
    synchronized (lock) {
      startGeneration = discardAndBegin();
    }
    return openSession(startGeneration);
  }

  public CompletableFuture<ConversationTurn> submitAnswer(String text) {
    final String sessionId;
    final String currentStep;
    final Map<String, Object> answers;
    final long answerGeneration;
    final boolean local;
    synchronized (lock) {
      if (state == ControllerState.COMPLETED) {
        log.debug("Ignoring answer for completed session {}", session.getSessionId());
        return CompletableFuture.completedFuture(snapshot(TurnStatus.IGNORED));
      }
      if (state == ControllerState.STARTING || answerInFlight) {
        return CompletableFuture.completedFuture(snapshot(TurnStatus.BUSY));
      }
      if (state != ControllerState.ACTIVE || session == null) {
        return CompletableFuture.completedFuture(snapshot(TurnStatus.IGNORED));
      }
      if (session.getMode() == SessionMode.REMOTE && (text == null || text.isBlank())) {
        return CompletableFuture.completedFuture(repromptBlank());
      }
      answerInFlight = true;
      answerGeneration = generation;
      sessionId = session.getSessionId();
      currentStep = session.getCurrentStep();
      answers = new LinkedHashMap<>(session.getAnswers());
      local = session.getMode() == SessionMode.LOCAL;
    }

    if (local) {
      try {
        return CompletableFuture.completedFuture(applyLocal(answerGeneration, text));
      } finally {
        release(answerGeneration);
      }
    }
    return callRemote(() -> authority.submitAnswer(sessionId, text, currentStep, answers))
        .handle((turn, error) -> error == null
            ? applyRemote(answerGeneration, turn)
            : degrade(answerGeneration, text, unwrap(error)))
        .whenComplete((turn, error) -> release(answerGeneration));
  }

  public ConversationTurn currentTurn() {
    synchronized (lock) {
      return snapshot(TurnStatus.OK);
    }
  }

  public ControllerState getState() {
    synchronized (lock) {
      return state;
    }
  }

  public Session getSession() {
    synchronized (lock) {
      return session;
    }
  }

  // Caller holds the lock.
  private long discardAndBegin() {
    if (state == ControllerState.STARTING || state == ControllerState.ACTIVE) {
      changeState(ControllerState.IDLE);
    }
    log.info("Conversation restart requested (previous session {})",
        session == null ? "none" : session.getSessionId());
    listener.onRestart();
    return beginStarting();
  }

  private long beginStarting() {
    changeState(ControllerState.STARTING);
    session = null;
    lastMessage = null;
    answerInFlight = false;
    return ++generation;
  }

  private CompletableFuture<ConversationTurn> openSession(long startGeneration) {
    if (!authority.isEnabled()) {
      return CompletableFuture.completedFuture(activateLocal(startGeneration, null));
    }
    return callRemote(authority::startSession)
        .handle((turn, error) -> error == null
            ? activateRemote(startGeneration, turn)
            : activateLocal(startGeneration, unwrap(error)));
  }

  private CompletableFuture<RemoteTurn> callRemote(Supplier<RemoteTurn> call) {
    try {
      return CompletableFuture.supplyAsync(call, executor)
          .orTimeout(remoteTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      return CompletableFuture.failedFuture(
          new AuthorityUnavailableException("Remote call rejected by executor", ex));
    }
  }

  private ConversationTurn activateRemote(long startGeneration, RemoteTurn turn) {
    if (turn.isCompleted()) {
      return activateLocal(startGeneration, new ProtocolMismatchException(turn.getStepId(),
          "Remote start-session returned a completed assessment"));
    }
    synchronized (lock) {
      if (startGeneration != generation) {
        return snapshot(TurnStatus.IGNORED);
      }
      Session remote = Session.remote(turn.getSessionId(), turn.getStepId());
      remote.replaceAnswers(turn.getAnswers());
      remote.setCurrentQuestion(turn.getQuestion());
      session = remote;
      lastMessage = turn.getMessage();
      changeState(ControllerState.ACTIVE);
      log.info("Session {} started in remote mode at step '{}'", remote.getSessionId(),
          remote.getCurrentStep());
      listener.onQuestionPresented(turn.getQuestion());
      return snapshot(TurnStatus.OK);
    }
  }

  private ConversationTurn activateLocal(long startGeneration, Throwable cause) {
    synchronized (lock) {
      if (startGeneration != generation) {
        return snapshot(TurnStatus.IGNORED);
      }
      if (cause != null) {
        log.warn("Remote start-session unavailable ({}); starting locally", describe(cause));
      }
      presentLocalStart();
      log.info("Session {} started in local mode", session.getSessionId());
      return snapshot(TurnStatus.OK);
    }
  }

  private ConversationTurn applyRemote(long answerGeneration, RemoteTurn turn) {
    synchronized (lock) {
      if (answerGeneration != generation) {
        return snapshot(TurnStatus.IGNORED);
      }
      if (!turn.getAnswers().isEmpty()) {
        session.replaceAnswers(turn.getAnswers());
      }
      if (turn.isCompleted()) {
        Analysis analysis = turn.getAnalysis();
        String message = turn.getMessage() == null || turn.getMessage().isBlank()
            ? analysis.getRecommendation()
            : turn.getMessage();
        complete(analysis, message);
        return snapshot(TurnStatus.OK);
      }
      boolean sameStep = turn.getStepId().equals(session.getCurrentStep());
      session.setCurrentStep(turn.getStepId());
      session.setCurrentQuestion(turn.getQuestion());
      lastMessage = turn.getMessage();
      if (sameStep) {
        listener.onReprompt(turn.getQuestion(), lastMessage);
        return snapshot(TurnStatus.REPROMPT);
      }
      listener.onQuestionPresented(turn.getQuestion());
      return snapshot(TurnStatus.OK);
    }
  }

  private ConversationTurn degrade(long answerGeneration, String text, Throwable cause) {
    synchronized (lock) {
      if (answerGeneration != generation) {
        return snapshot(TurnStatus.IGNORED);
      }
      Session remote = session;
      if (cause instanceof ProtocolMismatchException) {
        log.warn("Remote reply for session {} does not fit the local catalog ({}); "
            + "restarting locally at start", remote.getSessionId(), cause.getMessage());
        return restartLocally();
      }
      log.warn("Remote dialogue unavailable for session {} at step '{}' ({}); continuing locally",
          remote.getSessionId(), remote.getCurrentStep(), describe(cause));
      Optional<Step> anchor = vocabulary.toLocal(remote.getCurrentStep());
      if (anchor.isEmpty()) {
        log.warn("Remote step '{}' of session {} is unknown locally; restarting locally at start",
            remote.getCurrentStep(), remote.getSessionId());
        return restartLocally();
      }
      Session continuation = Session.localContinuation(remote, anchor.get().getId());
      continuation.setCurrentQuestion(
          engine.questionAt(continuation.getCurrentStep()).orElse(remote.getCurrentQuestion()));
      session = continuation;
      changeState(ControllerState.ACTIVE);
      log.info("Session {} degraded to local mode as {} at step '{}'", remote.getSessionId(),
          continuation.getSessionId(), continuation.getCurrentStep());
      return advanceLocally(text);
    }
  }

  private ConversationTurn applyLocal(long answerGeneration, String text) {
    synchronized (lock) {
      if (answerGeneration != generation) {
        return snapshot(TurnStatus.IGNORED);
      }
      return advanceLocally(text);
    }
  }

  // Caller holds the lock.
  private ConversationTurn advanceLocally(String text) {
    DialogueOutcome outcome;
    try {
      outcome = engine.advance(session, text);
    } catch (ProtocolMismatchException ex) {
      log.warn("Session {}: {}; restarting locally at start", session.getSessionId(),
          ex.getMessage());
      return restartLocally();
    }
    session.replaceAnswers(outcome.getAnswers());
    switch (outcome.getKind()) {
      case COMPLETE:
        complete(outcome.getAnalysis(), outcome.getMessage());
        return snapshot(TurnStatus.OK);
      case REPROMPT:
        lastMessage = outcome.getMessage();
        listener.onReprompt(outcome.getQuestion(), lastMessage);
        return snapshot(TurnStatus.REPROMPT);
      case NEXT_QUESTION:
      default:
        session.setCurrentStep(outcome.getNextStep());
        session.setCurrentQuestion(outcome.getQuestion());
        lastMessage = outcome.getMessage();
        listener.onQuestionPresented(outcome.getQuestion());
        return snapshot(TurnStatus.OK);
    }
  }

  // Caller holds the lock. Blank input in a remote session repeats the current question
  // without a backend call.
  private ConversationTurn repromptBlank() {
    Question question = session.getCurrentQuestion();
    lastMessage = question == null ? lastMessage : question.getPrompt();
    listener.onReprompt(question, lastMessage);
    return snapshot(TurnStatus.REPROMPT);
  }

  // Caller holds the lock.
  private ConversationTurn restartLocally() {
    presentLocalStart();
    return snapshot(TurnStatus.OK);
  }

  private void presentLocalStart() {
    Session fresh = Session.local();
    Question first = engine.firstQuestion();
    fresh.setCurrentQuestion(first);
    session = fresh;
    lastMessage = first.getPrompt();
    changeState(ControllerState.ACTIVE);
    listener.onQuestionPresented(first);
  }

  private void complete(Analysis analysis, String message) {
    session.complete(analysis);
    lastMessage = message;
    changeState(ControllerState.COMPLETED);
    log.info("Session {} completed: score={}, level={}, type='{}'", session.getSessionId(),
        analysis.getRiskScore(), analysis.getRiskLevel().getLabel(),
        analysis.getSuspectedFeverType());
    listener.onAnalysisReady(analysis);
    submitReport(new AssessmentReport(session.getSessionId(), analysis, session.getAnswers(),
        Instant.now()));
  }

  private void submitReport(AssessmentReport report) {
    try {
      CompletableFuture.runAsync(() -> reportSink.submit(report), executor)
          .whenComplete((ignored, error) -> {
            if (error != null) {
              log.warn("Report for session {} not stored: {}", report.getSessionId(),
                  unwrap(error).getMessage());
            }
          });
    } catch (RejectedExecutionException ex) {
      log.warn("Report for session {} not stored: executor rejected submission",
          report.getSessionId());
    }
  }

  private void release(long answerGeneration) {
    synchronized (lock) {
      if (answerGeneration == generation) {
        answerInFlight = false;
      }
    }
  }

  private void changeState(ControllerState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Invalid conversation transition " + state + " -> " + next);
    }
    if (state != next) {
      log.info("Session {} state change: {} -> {}",
          session == null ? "-" : session.getSessionId(), state, next);
    }
    state = next;
  }

  private ConversationTurn snapshot(TurnStatus status) {
    if (session == null) {
      return new ConversationTurn(status, null, null, state, null, lastMessage, null, null);
    }
    return new ConversationTurn(status, session.getSessionId(), session.getMode(), state,
        session.getCurrentStep(), lastMessage, session.getCurrentQuestion(),
        session.getAnalysis());
  }

  private String describe(Throwable cause) {
    if (cause instanceof TimeoutException) {
      return "timed out after " + remoteTimeoutMs + " ms";
    }
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
