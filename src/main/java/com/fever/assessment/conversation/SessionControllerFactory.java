package com.fever.assessment.conversation;

import com.fever.assessment.engine.DialogueEngine;
import com.fever.assessment.remote.DialogueAuthority;
import com.fever.assessment.report.ReportSink;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class SessionControllerFactory {
  private final DialogueEngine engine;
  private final DialogueAuthority authority;
  private final ReportSink reportSink;
  private final Executor executor;
  private final StepVocabulary vocabulary;
  private final long remoteTimeoutMs;

  public SessionControllerFactory(DialogueEngine engine,
                                  DialogueAuthority authority,
                                  ReportSink reportSink,
                                  @Qualifier("assessmentExecutor") Executor executor,
                                  StepVocabulary vocabulary,
                                  @Value("${assessment.remote.timeout-ms:3000}") long remoteTimeoutMs) {
    this.engine = engine;
    this.authority = authority;
    this.reportSink = reportSink;
    this.executor = executor;
    this.vocabulary = vocabulary;
    this.remoteTimeoutMs = remoteTimeoutMs;
  }

  public SessionController create(ConversationListener listener) {
    return new SessionController(engine, authority, reportSink, executor, vocabulary, listener,
        remoteTimeoutMs);
  }
}
