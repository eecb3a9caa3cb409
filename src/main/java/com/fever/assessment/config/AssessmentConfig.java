package com.fever.assessment.config;

import com.fever.assessment.remote.DialogueAuthority;
import com.fever.assessment.remote.LocalOnlyAuthority;
import com.fever.assessment.remote.RemoteDialogueClient;
import com.fever.assessment.report.BackendReportSink;
import com.fever.assessment.report.LoggingReportSink;
import com.fever.assessment.report.ReportSink;
import com.fever.assessment.security.BackendTokenProvider;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class AssessmentConfig {

  /**
   * Outbound client for the dialogue backend. Connect and read timeouts are kept short so a dead
   * backend turns into a local fallback within seconds.
   */
  @Bean
  public RestClient dialogueRestClient(RestClient.Builder builder,
                                       @Value("${assessment.remote.timeout-ms:3000}") int timeoutMs) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeoutMs);
    requestFactory.setReadTimeout(timeoutMs);
    return builder.requestFactory(requestFactory).build();
  }

  @Bean(name = "assessmentExecutor")
  public Executor assessmentExecutor(
      @Value("${assessment.executor.core-size:4}") int coreSize,
      @Value("${assessment.executor.max-size:16}") int maxSize,
      @Value("${assessment.executor.queue-capacity:200}") int queueCapacity) {
    int normalizedCoreSize = Math.max(coreSize, 1);
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(normalizedCoreSize);
    executor.setMaxPoolSize(Math.max(maxSize, normalizedCoreSize));
    executor.setQueueCapacity(Math.max(queueCapacity, 0));
    executor.setThreadNamePrefix("assessment-");
    executor.initialize();
    return executor;
  }

  @Bean
  @ConditionalOnProperty(name = "assessment.remote.enabled", havingValue = "true", matchIfMissing = true)
  public DialogueAuthority remoteDialogueAuthority(@Qualifier("dialogueRestClient") RestClient restClient,
                                                   @Value("${assessment.remote.base-url}") String baseUrl,
                                                   BackendTokenProvider tokenProvider) {
    return new RemoteDialogueClient(restClient, baseUrl, tokenProvider);
  }

  @Bean
  @ConditionalOnProperty(name = "assessment.remote.enabled", havingValue = "false")
  public DialogueAuthority localOnlyAuthority() {
    return new LocalOnlyAuthority();
  }

  @Bean
  @ConditionalOnProperty(name = "assessment.report.enabled", havingValue = "true", matchIfMissing = true)
  public ReportSink backendReportSink(@Qualifier("dialogueRestClient") RestClient restClient,
                                      @Value("${assessment.remote.base-url}") String baseUrl,
                                      BackendTokenProvider tokenProvider) {
    return new BackendReportSink(restClient, baseUrl, tokenProvider);
  }

  @Bean
  @ConditionalOnProperty(name = "assessment.report.enabled", havingValue = "false")
  public ReportSink loggingReportSink() {
    return new LoggingReportSink();
  }
}
